package com.pgwire.client.connection;

import com.pgwire.client.model.PgPreparedStatement;
import com.pgwire.client.model.PgQueryResult;
import com.pgwire.client.reader.IgnoreRowReader;
import com.pgwire.client.reader.ListRowReader;
import com.pgwire.client.reader.MapRowReader;
import com.pgwire.client.reader.PgColumnValue;
import com.pgwire.client.reader.RowReader;
import com.pgwire.client.support.FrontendMessage;
import com.pgwire.client.support.ScriptedConnection;
import com.pgwire.postgresprotocol.error.PgErrorCondition;
import com.pgwire.postgresprotocol.error.PgServerException;
import com.pgwire.postgresprotocol.exception.ConnectionClosedException;
import com.pgwire.postgresprotocol.exception.ParameterCountMismatchException;
import com.pgwire.postgresprotocol.exception.UnknownPreparedStatementException;
import com.pgwire.postgresprotocol.model.protocol.ErrorResponse;
import com.pgwire.postgresprotocol.model.protocol.NotificationResponse;
import com.pgwire.postgresprotocol.model.protocol.RowDescription;
import com.pgwire.postgresprotocol.model.protocol.TransactionStatus;
import com.pgwire.typecodec.constant.PgTypeOids;
import com.pgwire.typecodec.reader.ReadTable;
import io.netty.buffer.ByteBuf;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static com.pgwire.client.support.BackendMessages.bindComplete;
import static com.pgwire.client.support.BackendMessages.closeComplete;
import static com.pgwire.client.support.BackendMessages.column;
import static com.pgwire.client.support.BackendMessages.commandComplete;
import static com.pgwire.client.support.BackendMessages.dataRow;
import static com.pgwire.client.support.BackendMessages.emptyQueryResponse;
import static com.pgwire.client.support.BackendMessages.error;
import static com.pgwire.client.support.BackendMessages.int4;
import static com.pgwire.client.support.BackendMessages.noData;
import static com.pgwire.client.support.BackendMessages.notice;
import static com.pgwire.client.support.BackendMessages.notification;
import static com.pgwire.client.support.BackendMessages.parameterDescription;
import static com.pgwire.client.support.BackendMessages.parseComplete;
import static com.pgwire.client.support.BackendMessages.readyForQuery;
import static com.pgwire.client.support.BackendMessages.rowDescription;
import static com.pgwire.client.support.BackendMessages.text;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Timeout(10)
class PgConnectionTest {

    private ScriptedConnection scripted;
    private PgConnection connection;

    @BeforeEach
    void open() {
        scripted = ScriptedConnection.open();
        connection = scripted.getConnection();
    }

    @Test
    void startupStateIsExposed() {
        assertThat(connection.getBackendProcessId()).isEqualTo(ScriptedConnection.BACKEND_PROCESS_ID);
        assertThat(connection.getServerParameters()).containsEntry("server_version", "16.1");
        assertThat(connection.getTransactionStatus()).isEqualTo(TransactionStatus.IDLE);
        assertThat(connection.getReadTable()).isSameAs(ReadTable.installed());
    }

    @Test
    void simpleQueryReturnsOneResultPerStatement() {
        scripted.reply(
                rowDescription(column("n", PgTypeOids.INT4)),
                dataRow(text("1")),
                dataRow((byte[]) null),
                commandComplete("SELECT 2"),
                commandComplete("UPDATE 3"),
                readyForQuery('I'));

        List<PgQueryResult<List<List<Object>>>> results = connection.simpleQuery("SELECT n FROM t; UPDATE t SET x = 1");

        assertThat(results).hasSize(2);
        assertThat(results.get(0).getResult()).containsExactly(List.of(1), Collections.singletonList(null));
        assertThat(results.get(0).getCommandTag()).isEqualTo("SELECT 2");
        assertThat(results.get(0).getFields()).extracting(RowDescription.FieldDescription::getFieldName).containsExactly("n");
        assertThat(results.get(1).getResult()).isNull();
        assertThat(results.get(1).getAffectedRows()).isEqualTo(3);

        List<FrontendMessage> sent = scripted.sent();
        assertThat(FrontendMessage.startBytes(sent)).containsExactly('Q');
        assertThat(sent.get(0).payloadText()).isEqualTo("SELECT n FROM t; UPDATE t SET x = 1\0");
    }

    @Test
    void emptyQueryStringGivesEmptyResult() {
        scripted.reply(emptyQueryResponse(), readyForQuery('I'));

        List<PgQueryResult<List<List<Object>>>> results = connection.simpleQuery("");

        assertThat(results).hasSize(1);
        assertThat(results.get(0).isEmptyQuery()).isTrue();
    }

    @Test
    void serverErrorLeavesConnectionUsable() {
        scripted.reply(error("ERROR", "42P01", "relation \"nope\" does not exist"), readyForQuery('I'));

        assertThatThrownBy(() -> connection.simpleQuery("SELECT * FROM nope"))
                .isInstanceOfSatisfying(PgServerException.class, e -> {
                    assertThat(e.getCondition()).isEqualTo(PgErrorCondition.UNDEFINED_TABLE);
                    assertThat(e.getServerMessage()).contains("nope");
                });
        assertThat(connection.isUsable()).isTrue();

        scripted.reply(rowDescription(column("one", PgTypeOids.INT4)), dataRow(text("1")), commandComplete("SELECT 1"), readyForQuery('I'));
        assertThat(connection.simpleQuery("SELECT 1").get(0).getResult()).containsExactly(List.of(1));
    }

    @Test
    void failedTransactionIsTracked() {
        scripted.reply(error("ERROR", "22012", "division by zero"), readyForQuery('E'));

        assertThatThrownBy(() -> connection.simpleQuery("SELECT 1/0")).isInstanceOf(PgServerException.class);
        assertThat(connection.getTransactionStatus()).isEqualTo(TransactionStatus.FAILED_TRANSACTION);
    }

    @Test
    void fatalErrorEndsConnection() {
        scripted.reply(error("FATAL", "57P01", "terminating connection due to administrator command"));

        assertThatThrownBy(() -> connection.simpleQuery("SELECT pg_sleep(10)"))
                .isInstanceOfSatisfying(PgServerException.class, e -> assertThat(e.isFatal()).isTrue());
        assertThat(connection.isUsable()).isFalse();
        assertThatThrownBy(() -> connection.simpleQuery("SELECT 1")).isInstanceOf(ConnectionClosedException.class);
    }

    @Test
    void failingRowReaderStillDrainsExchange() {
        scripted.reply(rowDescription(column("n", PgTypeOids.INT4)), dataRow(text("1")), dataRow(text("2")), commandComplete("SELECT 2"), readyForQuery('I'));

        assertThatThrownBy(() -> connection.simpleQuery("SELECT n FROM t", FailingRowReader::new))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("reader broke");
        assertThat(connection.isUsable()).isTrue();

        scripted.reply(commandComplete("SET"), readyForQuery('I'));
        assertThat(connection.simpleQuery("SET x = 1").get(0).getCommandTag()).isEqualTo("SET");
    }

    @Test
    void noticesGoToListener() {
        List<ErrorResponse> notices = new ArrayList<>();
        connection.setNoticeListener(notices::add);
        scripted.reply(notice("table \"t\" does not exist, skipping"), commandComplete("DROP TABLE"), readyForQuery('I'));

        connection.simpleQuery("DROP TABLE IF EXISTS t");

        assertThat(notices).extracting(ErrorResponse::getMessage).containsExactly("table \"t\" does not exist, skipping");
    }

    @Test
    void notificationsAreQueuedWithoutListener() {
        scripted.reply(notification(77, "jobs", "42"), commandComplete("LISTEN"), readyForQuery('I'));
        connection.simpleQuery("LISTEN jobs");

        NotificationResponse notification = connection.waitForNotification(Duration.ofSeconds(1));
        assertThat(notification.getChannel()).isEqualTo("jobs");
        assertThat(notification.getPayload()).isEqualTo("42");
        assertThat(notification.getProcessId()).isEqualTo(77);

        assertThat(connection.waitForNotification(Duration.ofMillis(50))).isNull();
    }

    @Test
    void notificationQueueDropsOldestWhenFull() {
        int sent = PgSession.MAX_PENDING_NOTIFICATIONS + 2;
        ByteBuf[] replies = new ByteBuf[sent + 2];
        for (int i = 0; i < sent; i++) {
            replies[i] = notification(77, "jobs", String.valueOf(i));
        }
        replies[sent] = commandComplete("LISTEN");
        replies[sent + 1] = readyForQuery('I');
        scripted.reply(replies);
        connection.simpleQuery("LISTEN jobs");

        assertThat(connection.waitForNotification(Duration.ofSeconds(1)).getPayload()).isEqualTo("2");

        NotificationResponse last = null;
        NotificationResponse next;
        int remaining = 1;
        while ((next = connection.waitForNotification(Duration.ofMillis(50))) != null) {
            last = next;
            remaining++;
        }
        assertThat(remaining).isEqualTo(PgSession.MAX_PENDING_NOTIFICATIONS);
        assertThat(last.getPayload()).isEqualTo(String.valueOf(sent - 1));
    }

    @Test
    void notificationArrivingWhileIdleIsRead() {
        scripted.reply(notification(77, "jobs", "later"));

        assertThat(connection.waitForNotification(Duration.ofSeconds(1)).getPayload()).isEqualTo("later");
    }

    @Test
    void notificationListenerReceivesNotifications() {
        List<NotificationResponse> received = new ArrayList<>();
        connection.setNotificationListener(received::add);
        scripted.reply(notification(77, "jobs", "1"), commandComplete("NOTIFY"), readyForQuery('I'));

        connection.simpleQuery("NOTIFY jobs, '1'");

        assertThat(received).extracting(NotificationResponse::getPayload).containsExactly("1");
        assertThat(connection.waitForNotification(Duration.ofMillis(50))).isNull();
    }

    @Test
    void preparedStatementRequestsBinaryResults() {
        PgPreparedStatement statement = prepareById();

        assertThat(statement.getParameterTypeOids()).containsExactly(PgTypeOids.INT4);
        assertThat(statement.getResultFields()).hasSize(2);
        List<FrontendMessage> prepareMessages = scripted.sent();
        assertThat(FrontendMessage.startBytes(prepareMessages)).containsExactly('P', 'D', 'S');
        assertThat(prepareMessages.get(0).payloadText()).startsWith("by_id\0SELECT id, name FROM users WHERE id = $1\0");

        scripted.reply(bindComplete(), dataRow(int4(7), text("bob")), commandComplete("SELECT 1"), readyForQuery('I'));
        PgQueryResult<List<Map<String, Object>>> result = connection.execute("by_id", MapRowReader::new, 7);

        assertThat(result.getResult()).containsExactly(Map.of("id", 7, "name", "bob"));
        assertThat(result.getAffectedRows()).isEqualTo(1);

        List<FrontendMessage> executeMessages = scripted.sent();
        assertThat(FrontendMessage.startBytes(executeMessages)).containsExactly('B', 'E', 'S');
        ByteBuf bind = executeMessages.get(0).payloadBuf();
        // unnamed portal
        assertThat(bind.readByte()).isZero();
        assertThat(bind.readCharSequence(6, StandardCharsets.UTF_8).toString()).isEqualTo("by_id\0");
        assertThat(bind.readShort()).isEqualTo((short) 1);
        assertThat(bind.readShort()).isEqualTo((short) 1);
        assertThat(bind.readShort()).isEqualTo((short) 1);
        assertThat(bind.readInt()).isEqualTo(4);
        assertThat(bind.readInt()).isEqualTo(7);
        assertThat(bind.readShort()).isEqualTo((short) 2);
        assertThat(bind.readShort()).isEqualTo((short) 1);
        assertThat(bind.readShort()).isEqualTo((short) 1);
    }

    @Test
    void textOnlyReaderSwitchesResultColumnToText() {
        prepareById();
        scripted.sent();
        connection.setReadTable(ReadTable.installed().withTextReader(PgTypeOids.INT4, (value, table) -> "id-" + value));

        scripted.reply(bindComplete(), dataRow(text("7"), text("bob")), commandComplete("SELECT 1"), readyForQuery('I'));
        PgQueryResult<List<List<Object>>> result = connection.execute("by_id", ListRowReader::new, 7);

        assertThat(result.getResult()).containsExactly(List.of("id-7", "bob"));
        ByteBuf bind = scripted.sent().get(0).payloadBuf();
        bind.skipBytes(bind.readableBytes() - 4);
        assertThat(bind.readShort()).isEqualTo((short) 0);
        assertThat(bind.readShort()).isEqualTo((short) 1);
    }

    @Test
    void preparingSameNameClosesPreviousStatement() {
        prepareById();
        scripted.sent();

        scripted.reply(closeComplete(), parseComplete(), parameterDescription(), noData(), readyForQuery('I'));
        PgPreparedStatement statement = connection.prepare("by_id", "SELECT 1");

        assertThat(FrontendMessage.startBytes(scripted.sent())).containsExactly('C', 'P', 'D', 'S');
        assertThat(statement.getResultFields()).isEmpty();
        assertThat(connection.getPreparedStatement("by_id").getSql()).isEqualTo("SELECT 1");
    }

    @Test
    void parameterCountIsCheckedBeforeSending() {
        prepareById();
        scripted.sent();

        assertThatThrownBy(() -> connection.execute("by_id", IgnoreRowReader::new))
                .isInstanceOf(ParameterCountMismatchException.class);
        assertThat(scripted.sent()).isEmpty();
        assertThat(connection.isUsable()).isTrue();
    }

    @Test
    void unknownStatementNamesAreRejected() {
        assertThatThrownBy(() -> connection.execute("missing", IgnoreRowReader::new))
                .isInstanceOf(UnknownPreparedStatementException.class);
        assertThatThrownBy(() -> connection.unprepare("missing"))
                .isInstanceOf(UnknownPreparedStatementException.class);
    }

    @Test
    void unprepareClosesOnServer() {
        prepareById();
        scripted.sent();

        scripted.reply(closeComplete(), readyForQuery('I'));
        connection.unprepare("by_id");

        assertThat(FrontendMessage.startBytes(scripted.sent())).containsExactly('C', 'S');
        assertThat(connection.getPreparedStatement("by_id")).isNull();
        assertThatThrownBy(() -> connection.execute("by_id", IgnoreRowReader::new, 1))
                .isInstanceOf(UnknownPreparedStatementException.class);
    }

    @Test
    void failedPrepareIsNotRemembered() {
        scripted.reply(error("ERROR", "42601", "syntax error at or near \"SELEC\""), readyForQuery('I'));

        assertThatThrownBy(() -> connection.prepare("broken", "SELEC 1"))
                .isInstanceOfSatisfying(PgServerException.class, e -> assertThat(e.is(PgErrorCondition.SYNTAX_ERROR)).isTrue());
        assertThat(connection.getPreparedStatement("broken")).isNull();
    }

    @Test
    void queryRunsThroughUnnamedStatement() {
        scripted.reply(
                parseComplete(), parameterDescription(PgTypeOids.TEXT), noData(), readyForQuery('I'),
                bindComplete(), commandComplete("INSERT 0 1"), readyForQuery('T'));

        PgQueryResult<Long> result = connection.query("INSERT INTO t VALUES ($1)", IgnoreRowReader::new, "x");

        assertThat(result.getAffectedRows()).isEqualTo(1);
        assertThat(result.getResult()).isNull();
        assertThat(connection.getTransactionStatus()).isEqualTo(TransactionStatus.IN_TRANSACTION);
        assertThat(FrontendMessage.startBytes(scripted.sent())).containsExactly('P', 'D', 'S', 'B', 'E', 'S');
    }

    @Test
    void readTableScopeRestoresPreviousTable() {
        ReadTable before = connection.getReadTable();
        try (PgConnection.ReadTableScope ignored = connection.useReadTable(before.withTextReader(PgTypeOids.INT4, (value, table) -> "five:" + value))) {
            scripted.reply(rowDescription(column("n", PgTypeOids.INT4)), dataRow(text("5")), commandComplete("SELECT 1"), readyForQuery('I'));
            assertThat(connection.simpleQuery("SELECT 5").get(0).getResult()).containsExactly(List.of("five:5"));
        }

        assertThat(connection.getReadTable()).isSameAs(before);
        scripted.reply(rowDescription(column("n", PgTypeOids.INT4)), dataRow(text("5")), commandComplete("SELECT 1"), readyForQuery('I'));
        assertThat(connection.simpleQuery("SELECT 5").get(0).getResult()).containsExactly(List.of(5));
    }

    @Test
    void closeSendsTerminate() {
        connection.close();

        assertThat(FrontendMessage.startBytes(scripted.sent())).containsExactly('X');
        assertThat(connection.isUsable()).isFalse();
    }

    private PgPreparedStatement prepareById() {
        scripted.reply(
                parseComplete(),
                parameterDescription(PgTypeOids.INT4),
                rowDescription(column("id", PgTypeOids.INT4), column("name", PgTypeOids.TEXT)),
                readyForQuery('I'));
        return connection.prepare("by_id", "SELECT id, name FROM users WHERE id = $1");
    }

    private static class FailingRowReader implements RowReader<Void> {
        @Override
        public void onRowDescription(List<RowDescription.FieldDescription> fields) {
        }

        @Override
        public void onRow(List<PgColumnValue> columns) {
            throw new IllegalStateException("reader broke");
        }

        @Override
        public Void onComplete() {
            return null;
        }
    }
}
