package com.lazymc.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.type.LogicalType;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import com.lazymc.core.model.Config;

import java.io.IOException;
import java.util.Objects;

/**
 * Decodes TOML configuration text into a {@link Config}.
 *
 * <p>
 * Tables and keys map onto the section builders in
 * {@code com.lazymc.core.model}. Unknown tables and keys are ignored. Values
 * of the wrong type are rejected rather than coerced, so {@code sleep_after =
 * "60"}, {@code command = 5} and {@code methods = [0]} are errors. A missing
 * {@code [server]} table or {@code command} is an error too.
 * </p>
 *
 * @since 1.0.0
 */
public final class TomlConfigDecoder {

    private final ObjectMapper mapper;

    public TomlConfigDecoder() {
        this.mapper = TomlMapper.builder()
                .disable(MapperFeature.ALLOW_COERCION_OF_SCALARS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT)
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
                .enable(DeserializationFeature.FAIL_ON_NUMBERS_FOR_ENUMS)
                // text fields only accept TOML strings
                .withCoercionConfig(LogicalType.Textual, c -> c
                        .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
                        .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
                        .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail))
                .build();
    }

    /**
     * @param text TOML document; must not be {@code null}
     * @return configuration without a source path
     * @throws IOException              if the text is not valid TOML or does not
     *                                  match the configuration schema
     * @throws IllegalArgumentException if a value is out of range
     * @throws IllegalStateException    if a required table or key is missing
     */
    public Config decode(String text) throws IOException {
        Objects.requireNonNull(text, "TOML text must not be null");
        Config config = mapper.readValue(text, Config.class);
        if (config == null) {
            throw new IllegalStateException("missing table [server]");
        }
        return config;
    }
}
