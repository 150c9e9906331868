package com.pgwire.client.model;

import com.pgwire.configuration.model.SslMode;
import com.pgwire.configuration.predefined.PgWireConnectionProperties;
import io.netty.handler.ssl.SslContext;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PgConnectionSettings {
    private String host;
    @Builder.Default
    private int port = 5432;
    private String database;
    private String user;
    private String password;
    private String applicationName;
    @Builder.Default
    private int connectTimeoutMs = 10000;
    @Builder.Default
    private SslMode sslMode = SslMode.DISABLE;
    // only consulted when sslMode is not DISABLE
    private SslContext sslContext;
    @Builder.Default
    private Map<String, String> startupParameters = new LinkedHashMap<>();

    public static PgConnectionSettings fromProperties(PgWireConnectionProperties properties) {
        return PgConnectionSettings
                .builder()
                .host(properties.host())
                .port(properties.port())
                .database(properties.database())
                .user(properties.user())
                .password(properties.password().orElse(null))
                .applicationName(properties.applicationName().orElse(null))
                .connectTimeoutMs(properties.connectTimeoutMs())
                .sslMode(properties.sslMode())
                .startupParameters(new LinkedHashMap<>(properties.startupParameters()))
                .build();
    }
}
