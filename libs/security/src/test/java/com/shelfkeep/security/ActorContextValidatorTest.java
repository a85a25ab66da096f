package com.shelfkeep.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ActorContextValidator")
class ActorContextValidatorTest {

    @Test
    @DisplayName("accepts a tenant-scoped member")
    void validTenantActor() {
        var result = ActorContextValidator.validate(new ActorContext("m-1", "t-1", Role.MEMBER));
        assertThat(result.valid()).isTrue();
        assertThat(result.errors()).isEmpty();
    }

    @Test
    @DisplayName("accepts a global actor with null tenant")
    void validGlobalActor() {
        var result = ActorContextValidator.validate(new ActorContext("root", null, Role.SUPER_ADMIN));
        assertThat(result.valid()).isTrue();
    }

    @Test
    @DisplayName("collects every error at once")
    void collectsAllErrors() {
        var result = ActorContextValidator.validate(new ActorContext(" ", "", null));
        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).hasSize(3);
    }

    @Test
    @DisplayName("rejects a null actor")
    void nullActor() {
        var result = ActorContextValidator.validate(null);
        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).containsExactly("actor must not be null");
    }
}
