package com.pgwire.client.model;

import com.pgwire.configuration.PgWireConfigLoader;
import com.pgwire.configuration.model.SslMode;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PgConnectionSettingsTest {

    @Test
    void settingsAreTakenFromProperties() {
        PgConnectionSettings settings = PgConnectionSettings.fromProperties(PgWireConfigLoader.load(Map.of(
                "pgwire.connection.host", "db.internal",
                "pgwire.connection.database", "orders",
                "pgwire.connection.user", "app",
                "pgwire.connection.ssl-mode", "prefer",
                "pgwire.connection.startup-parameters.statement_timeout", "5000"
        )));

        assertThat(settings.getHost()).isEqualTo("db.internal");
        assertThat(settings.getPort()).isEqualTo(5432);
        assertThat(settings.getDatabase()).isEqualTo("orders");
        assertThat(settings.getUser()).isEqualTo("app");
        assertThat(settings.getPassword()).isNull();
        assertThat(settings.getSslMode()).isEqualTo(SslMode.PREFER);
        assertThat(settings.getStartupParameters()).containsEntry("statement_timeout", "5000");
    }

    @Test
    void builderDefaults() {
        PgConnectionSettings settings = PgConnectionSettings.builder().host("h").build();

        assertThat(settings.getConnectTimeoutMs()).isEqualTo(10000);
        assertThat(settings.getSslMode()).isEqualTo(SslMode.DISABLE);
        assertThat(settings.getStartupParameters()).isEmpty();
    }
}
