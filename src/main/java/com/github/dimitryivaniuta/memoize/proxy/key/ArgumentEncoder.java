package com.github.dimitryivaniuta.memoize.proxy.key;

import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;

/**
 * Deterministic, order-preserving text form of an argument vector.
 *
 * <p>Relies on an {@link ObjectMapper} with sorted properties and map entries
 * (see {@code JacksonConfig}); equal vectors encode equally, and values of different JSON
 * types never collide ({@code 1} vs {@code "1"}).
 *
 * <p>Beans are encoded from their fields, not their getters: objects that differ only in
 * state without a getter must still get different keys.
 */
@RequiredArgsConstructor
public class ArgumentEncoder {

    private final ObjectMapper mapper;

    /**
     * Encoder over a copy of {@code base} that writes every field (private ones included),
     * ignores getters and keeps null members.
     */
    public static ArgumentEncoder fieldBased(ObjectMapper base) {
        ObjectMapper mapper = base.copy()
                .setSerializationInclusion(JsonInclude.Include.ALWAYS)
                .setVisibility(PropertyAccessor.ALL, Visibility.NONE)
                .setVisibility(PropertyAccessor.FIELD, Visibility.ANY);
        return new ArgumentEncoder(mapper);
    }

    public String encode(String callable, Object[] arguments) {
        try {
            return mapper.writeValueAsString(arguments);
        } catch (JsonProcessingException e) {
            throw new KeyDerivationException("Cannot encode arguments of " + callable + " into a cache key", e);
        }
    }
}
