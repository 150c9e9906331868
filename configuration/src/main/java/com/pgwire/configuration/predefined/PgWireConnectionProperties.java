package com.pgwire.configuration.predefined;

import com.pgwire.configuration.model.SslMode;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.util.Map;
import java.util.Optional;

@ConfigMapping(prefix = "pgwire.connection")
public interface PgWireConnectionProperties {

    String host();

    @WithDefault("5432")
    int port();

    String database();

    String user();

    Optional<String> password();

    Optional<String> applicationName();

    @WithDefault("10000")
    int connectTimeoutMs();

    @WithDefault("disable")
    SslMode sslMode();

    /**
     * Extra run-time parameters sent in the startup message, e.g.
     * {@code pgwire.connection.startup-parameters.search_path=public}.
     */
    Map<String, String> startupParameters();
}
