package com.conduit.errormodel;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON form of a sub-error list, as carried in the {@code suberrors} trailer.
 * <p>
 * Field names follow the layout already used on the wire by the other implementation:
 * {@code [{"Identifier":{"type":"dns","value":"a.com"},"Type":2,"Detail":"...",
 * "SubErrors":null,"RetryAfter":0}]} with {@code RetryAfter} in nanoseconds.
 */
public final class SubErrorSerializer {

    // Trailer values must stay printable ASCII.
    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(JsonWriteFeature.ESCAPE_NON_ASCII)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private static final TypeReference<List<SubErrorJson>> LIST_TYPE = new TypeReference<>() {};

    private SubErrorSerializer() {
        // utility class
    }

    /**
     * Serializes sub-errors to a JSON array.
     *
     * @throws SubErrorSerializationException if serialization fails
     */
    public static String serialize(List<SubError> subErrors) {
        try {
            return MAPPER.writeValueAsString(toJson(subErrors));
        } catch (JsonProcessingException e) {
            throw new SubErrorSerializationException("Failed to serialize sub-errors", e);
        }
    }

    /**
     * Parses a JSON array of sub-errors.
     *
     * @throws SubErrorSerializationException if the JSON is malformed or names an unknown error type
     */
    public static List<SubError> deserialize(String json) {
        List<SubErrorJson> parsed;
        try {
            parsed = MAPPER.readValue(json, LIST_TYPE);
        } catch (JsonProcessingException e) {
            throw new SubErrorSerializationException("Failed to deserialize sub-errors", e);
        }
        try {
            return fromJson(parsed);
        } catch (IllegalArgumentException e) {
            throw new SubErrorSerializationException("Invalid sub-error: " + e.getMessage(), e);
        }
    }

    private static List<SubErrorJson> toJson(List<SubError> subErrors) {
        if (subErrors == null || subErrors.isEmpty()) {
            return null;
        }
        List<SubErrorJson> out = new ArrayList<>(subErrors.size());
        for (SubError sub : subErrors) {
            ErrorEnvelope e = sub.error();
            out.add(new SubErrorJson(
                    new IdentifierJson(sub.identifier().type(), sub.identifier().value()),
                    e.type().code(),
                    e.detail(),
                    toJson(e.subErrors()),
                    e.retryAfter().toNanos()));
        }
        return out;
    }

    private static List<SubError> fromJson(List<SubErrorJson> json) {
        if (json == null) {
            return List.of();
        }
        List<SubError> out = new ArrayList<>(json.size());
        for (SubErrorJson sub : json) {
            if (sub == null || sub.identifier() == null) {
                throw new IllegalArgumentException("sub-error without identifier");
            }
            ErrorType type = ErrorType.fromCode(sub.type())
                    .orElseThrow(() -> new IllegalArgumentException("unknown error type " + sub.type()));
            ErrorEnvelope envelope = new ErrorEnvelope(
                    type, sub.detail(), fromJson(sub.subErrors()), Duration.ofNanos(sub.retryAfter()));
            out.add(new SubError(new Identifier(sub.identifier().type(), sub.identifier().value()), envelope));
        }
        return out;
    }

    @JsonInclude(JsonInclude.Include.ALWAYS)
    record SubErrorJson(
            @JsonProperty("Identifier") IdentifierJson identifier,
            @JsonProperty("Type") int type,
            @JsonProperty("Detail") String detail,
            @JsonProperty("SubErrors") List<SubErrorJson> subErrors,
            @JsonProperty("RetryAfter") long retryAfter) {}

    record IdentifierJson(
            @JsonProperty("type") String type,
            @JsonProperty("value") String value) {}

    /**
     * Exception thrown when sub-error serialization/deserialization fails.
     */
    public static class SubErrorSerializationException extends RuntimeException {
        public SubErrorSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
