package com.libragraph.imagio.core.variant;

import io.quarkus.runtime.configuration.ConfigurationException;
import org.eclipse.microprofile.config.Config;

import java.util.Optional;
import java.util.function.Function;

/**
 * Rendering settings read from {@code imagio.variants.*}.
 *
 * <pre>
 *   imagio.variants.deduplicate=true
 *   imagio.variants.write-through-failure=fail
 *   imagio.variants.jpeg-quality=0.9
 * </pre>
 */
public record VariantSettings(
        boolean deduplicate,
        WriteThroughFailurePolicy writeThroughFailure,
        float jpegQuality
) {

    public static final String PREFIX = "imagio.variants.";

    public static final VariantSettings DEFAULTS = new VariantSettings(true, WriteThroughFailurePolicy.FAIL, 0.9f);

    public static VariantSettings fromConfig(Config config) {
        return of(property -> config.getOptionalValue(property, String.class));
    }

    /**
     * Builds and validates settings from a property lookup; absent properties
     * take their defaults.
     *
     * @throws ConfigurationException if a property is present but invalid
     */
    public static VariantSettings of(Function<String, Optional<String>> lookup) {
        Function<String, Optional<String>> prop = name ->
                lookup.apply(PREFIX + name)
                        .map(String::trim)
                        .filter(s -> !s.isEmpty());

        boolean deduplicate = prop.apply("deduplicate")
                .map(v -> parseBoolean("deduplicate", v))
                .orElse(DEFAULTS.deduplicate());

        WriteThroughFailurePolicy policy = prop.apply("write-through-failure")
                .map(v -> {
                    try {
                        return WriteThroughFailurePolicy.fromLabel(v);
                    } catch (IllegalArgumentException e) {
                        throw invalid("write-through-failure", v, "expected fail or serve");
                    }
                })
                .orElse(DEFAULTS.writeThroughFailure());

        float quality = prop.apply("jpeg-quality")
                .map(VariantSettings::parseQuality)
                .orElse(DEFAULTS.jpegQuality());

        return new VariantSettings(deduplicate, policy, quality);
    }

    private static boolean parseBoolean(String name, String value) {
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw invalid(name, value, "expected true or false");
    }

    private static float parseQuality(String value) {
        float quality;
        try {
            quality = Float.parseFloat(value);
        } catch (NumberFormatException e) {
            throw invalid("jpeg-quality", value, "expected a number");
        }
        if (!(quality > 0f && quality <= 1f)) {
            throw invalid("jpeg-quality", value, "must be in (0, 1]");
        }
        return quality;
    }

    private static ConfigurationException invalid(String name, String value, String reason) {
        return new ConfigurationException("Invalid " + PREFIX + name + "=" + value + ": " + reason);
    }
}
