package com.pgwire.configuration;

import com.pgwire.configuration.exception.ConfigurationInitializationException;
import com.pgwire.configuration.model.SslMode;
import com.pgwire.configuration.predefined.PgWireConnectionProperties;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PgWireConfigLoaderTest {

    @Test
    void defaultsApplyWhenOnlyRequiredValuesAreGiven() {
        PgWireConnectionProperties properties = PgWireConfigLoader.load(Map.of("pgwire.connection.host", "db.local"));

        assertThat(properties.host()).isEqualTo("db.local");
        assertThat(properties.database()).isEqualTo("testdb");
        assertThat(properties.user()).isEqualTo("tester");
        assertThat(properties.port()).isEqualTo(5432);
        assertThat(properties.connectTimeoutMs()).isEqualTo(10000);
        assertThat(properties.sslMode()).isEqualTo(SslMode.DISABLE);
        assertThat(properties.password()).isEmpty();
        assertThat(properties.applicationName()).isEmpty();
        assertThat(properties.startupParameters()).isEmpty();
    }

    @Test
    void overridesWinOverPropertiesFile() {
        PgWireConnectionProperties properties = PgWireConfigLoader.load(Map.of(
                "pgwire.connection.host", "10.0.0.5",
                "pgwire.connection.port", "6432",
                "pgwire.connection.database", "other",
                "pgwire.connection.password", "secret",
                "pgwire.connection.ssl-mode", "require",
                "pgwire.connection.startup-parameters.search_path", "audit"
        ));

        assertThat(properties.port()).isEqualTo(6432);
        assertThat(properties.database()).isEqualTo("other");
        assertThat(properties.password()).contains("secret");
        assertThat(properties.sslMode()).isEqualTo(SslMode.REQUIRE);
        assertThat(properties.startupParameters()).containsEntry("search_path", "audit");
    }

    @Test
    void missingHostFailsWithConfigurationError() {
        assertThatThrownBy(PgWireConfigLoader::load)
                .isInstanceOf(ConfigurationInitializationException.class)
                .hasMessageContaining("pgwire connection configuration");
    }

    @Test
    void malformedPortFailsWithConfigurationError() {
        assertThatThrownBy(() -> PgWireConfigLoader.load(Map.of(
                "pgwire.connection.host", "db.local",
                "pgwire.connection.port", "five")))
                .isInstanceOf(ConfigurationInitializationException.class);
    }
}
