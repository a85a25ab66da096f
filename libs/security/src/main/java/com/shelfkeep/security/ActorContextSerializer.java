package com.shelfkeep.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Base64;

/**
 * Serializes and deserializes {@link ActorContext} for propagation in an HTTP header.
 * <p>
 * The authorization layer in front of the registry puts the verified actor into the
 * {@value #HEADER} header as Base64-encoded JSON; header values must stay ASCII-safe.
 */
public final class ActorContextSerializer {

    /** Header carrying the encoded actor context. */
    public static final String HEADER = "X-Actor-Context";

    private static final ObjectMapper MAPPER =
            new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private ActorContextSerializer() {
        // utility class
    }

    /**
     * Serializes an actor context to a Base64-encoded JSON string.
     *
     * @throws ActorSerializationException if serialization fails
     */
    public static String serialize(ActorContext actor) {
        try {
            byte[] json = MAPPER.writeValueAsBytes(actor);
            return Base64.getEncoder().encodeToString(json);
        } catch (JsonProcessingException e) {
            throw new ActorSerializationException("Failed to serialize actor context", e);
        }
    }

    /**
     * Deserializes a Base64-encoded JSON string back to an actor context.
     *
     * @throws ActorSerializationException if the value is not valid Base64 or JSON
     */
    public static ActorContext deserialize(String encoded) {
        try {
            byte[] json = Base64.getDecoder().decode(encoded);
            return MAPPER.readValue(json, ActorContext.class);
        } catch (Exception e) {
            throw new ActorSerializationException("Failed to deserialize actor context", e);
        }
    }

    /**
     * Exception thrown when actor context serialization/deserialization fails.
     */
    public static class ActorSerializationException extends RuntimeException {
        public ActorSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
