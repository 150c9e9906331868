package com.pgwire.client.integration;

import com.pgwire.client.connection.PgConnection;
import com.pgwire.client.copy.PgCopyWriter;
import com.pgwire.client.model.PgConnectionSettings;
import com.pgwire.client.model.PgQueryResult;
import com.pgwire.client.reader.ListRowReader;
import com.pgwire.client.reader.MapRowReader;
import com.pgwire.postgresprotocol.error.PgErrorCondition;
import com.pgwire.postgresprotocol.error.PgServerException;
import com.pgwire.postgresprotocol.model.protocol.NotificationResponse;
import com.pgwire.typecodec.model.PgInterval;
import org.apache.commons.lang3.StringUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfEnvironmentVariable;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs against a real server, configured through PGWIRE_TEST_HOST, PGWIRE_TEST_PORT,
 * PGWIRE_TEST_DATABASE, PGWIRE_TEST_USER and PGWIRE_TEST_PASSWORD.
 */
@EnabledIfEnvironmentVariable(named = "PGWIRE_TEST_HOST", matches = ".+")
class PgConnectionLiveTest {

    private PgConnection connection;

    @BeforeEach
    void connect() {
        connection = PgConnection.open(PgConnectionSettings
                .builder()
                .host(System.getenv("PGWIRE_TEST_HOST"))
                .port(Integer.parseInt(StringUtils.defaultIfEmpty(System.getenv("PGWIRE_TEST_PORT"), "5432")))
                .database(StringUtils.defaultIfEmpty(System.getenv("PGWIRE_TEST_DATABASE"), "postgres"))
                .user(StringUtils.defaultIfEmpty(System.getenv("PGWIRE_TEST_USER"), "postgres"))
                .password(System.getenv("PGWIRE_TEST_PASSWORD"))
                .applicationName("pgwire-live-test")
                .build());
    }

    @AfterEach
    void disconnect() {
        connection.close();
    }

    @Test
    void binaryResultsOfCommonTypes() {
        connection.prepare("types", "SELECT 1::int4, 2::int8, 1.50::numeric, 'x'::text, DATE '2024-02-29', "
                + "INTERVAL '1 month 2 days', ARRAY[1, NULL, 3]::int4[], ROW(1, 'a')");

        PgQueryResult<List<List<Object>>> result = connection.execute("types", ListRowReader::new);

        assertThat(result.getResult()).hasSize(1);
        assertThat(result.getResult().get(0)).containsExactly(
                1, 2L, new BigDecimal("1.50"), "x", LocalDate.of(2024, 2, 29),
                new PgInterval(1, 2, 0), Arrays.asList(1, null, 3), List.of(1, "a"));
    }

    @Test
    void parametersRoundTrip() {
        PgQueryResult<List<Map<String, Object>>> result = connection.query(
                "SELECT $1::int8 + 1 AS next, $2::text AS name", MapRowReader::new, 41L, "ann");

        assertThat(result.getResult()).containsExactly(Map.of("next", 42L, "name", "ann"));
    }

    @Test
    void errorsAreClassified() {
        assertThatThrownBy(() -> connection.simpleQuery("SELECT * FROM pgwire_table_that_does_not_exist"))
                .isInstanceOfSatisfying(PgServerException.class, e -> assertThat(e.is(PgErrorCondition.UNDEFINED_TABLE)).isTrue());
        assertThat(connection.simpleQuery("SELECT 1").get(0).getResult()).containsExactly(List.of(1));
    }

    @Test
    void copyInAndNotifications() {
        connection.simpleQuery("CREATE TEMP TABLE pgwire_copy (id int4, name text)");
        try (PgCopyWriter writer = connection.copyIn("pgwire_copy", "id", "name")) {
            writer.writeRow(1, "a");
            writer.writeRow(2, null);
            assertThat(writer.finish()).isEqualTo(2);
        }
        assertThat(connection.simpleQuery("SELECT count(*) FROM pgwire_copy").get(0).getResult()).containsExactly(List.of(2L));

        connection.simpleQuery("LISTEN pgwire_jobs; NOTIFY pgwire_jobs, 'done'");
        NotificationResponse notification = connection.waitForNotification(Duration.ofSeconds(5));
        assertThat(notification.getPayload()).isEqualTo("done");
    }
}
