package com.shelfkeep.security;

import com.shelfkeep.security.testing.TestActorContextFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for RoleChecker: checks respect the role hierarchy.
 */
@DisplayName("RoleChecker")
class RoleCheckerTest {

    @Nested
    @DisplayName("hasRole()")
    class HasRole {

        @Test
        @DisplayName("member has MEMBER but not TENANT_ADMIN")
        void member() {
            var actor = TestActorContextFactory.member("m-1");
            assertThat(RoleChecker.hasRole(actor, Role.MEMBER)).isTrue();
            assertThat(RoleChecker.hasRole(actor, Role.TENANT_ADMIN)).isFalse();
        }

        @Test
        @DisplayName("SUPER_ADMIN satisfies every role via hierarchy")
        void superAdmin() {
            var actor = TestActorContextFactory.globalSuperAdmin("root");
            assertThat(RoleChecker.hasRole(actor, Role.MEMBER)).isTrue();
            assertThat(RoleChecker.hasRole(actor, Role.TENANT_ADMIN)).isTrue();
            assertThat(RoleChecker.hasRole(actor, Role.SUPER_ADMIN)).isTrue();
        }

        @Test
        @DisplayName("actor without a role has nothing")
        void nullRole() {
            var actor = new ActorContext("m-1", "t-1", null);
            assertThat(RoleChecker.hasRole(actor, Role.MEMBER)).isFalse();
        }
    }
}
