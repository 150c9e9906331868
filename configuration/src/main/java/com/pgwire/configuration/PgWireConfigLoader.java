package com.pgwire.configuration;

import com.pgwire.configuration.exception.ConfigurationInitializationException;
import com.pgwire.configuration.predefined.PgWireConnectionProperties;
import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;

import java.util.Collections;
import java.util.Map;

/**
 * Reads {@link PgWireConnectionProperties} from system properties, environment variables and
 * {@code META-INF/microprofile-config.properties}. Overrides passed to {@link #load(Map)} win over all
 * of them.
 */
public class PgWireConfigLoader {
    private static final String OVERRIDES_SOURCE_NAME = "pgwire-overrides";
    private static final int OVERRIDES_ORDINAL = 500;

    public static PgWireConnectionProperties load() {
        return load(Collections.emptyMap());
    }

    public static PgWireConnectionProperties load(Map<String, String> overrides) {
        try {
            SmallRyeConfig config = new SmallRyeConfigBuilder()
                    .addDefaultSources()
                    .addDefaultInterceptors()
                    .withSources(new PropertiesConfigSource(overrides, OVERRIDES_SOURCE_NAME, OVERRIDES_ORDINAL))
                    .withMapping(PgWireConnectionProperties.class)
                    .build();
            return config.getConfigMapping(PgWireConnectionProperties.class);
        } catch (RuntimeException e) {
            throw new ConfigurationInitializationException("Failed to load pgwire connection configuration: " + e.getMessage(), e);
        }
    }

    private PgWireConfigLoader() {
    }
}
