package com.pgwire.client.copy;

import com.pgwire.client.connection.PgConnection;
import com.pgwire.client.connection.PgSession;
import com.pgwire.client.model.PgQueryResult;
import com.pgwire.client.reader.ListRowReader;
import com.pgwire.postgresprotocol.constant.PostgresProtocolGeneralConstants;
import com.pgwire.postgresprotocol.decoder.ServerPostgresProtocolMessageDecoder;
import com.pgwire.postgresprotocol.encoder.ClientPostgresProtocolMessageEncoder;
import com.pgwire.postgresprotocol.error.PgServerException;
import com.pgwire.postgresprotocol.exception.MessageDecodingException;
import com.pgwire.postgresprotocol.exception.ParameterCountMismatchException;
import com.pgwire.postgresprotocol.exception.PgClientException;
import com.pgwire.postgresprotocol.exception.ValueEncodingException;
import com.pgwire.postgresprotocol.model.internal.PgMessageInfo;
import com.pgwire.postgresprotocol.model.protocol.CopyInResponse;
import com.pgwire.postgresprotocol.stream.PgMessageStream;
import com.pgwire.typecodec.encoder.PgValueEncoders;
import com.pgwire.typecodec.literal.SqlLiteralFormatter;
import com.pgwire.typecodec.model.PgNull;
import io.netty.buffer.ByteBuf;
import lombok.Cleanup;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Streams rows into a table with {@code COPY ... FROM STDIN (FORMAT BINARY)}.
 * <pre>
 * try (PgCopyWriter writer = connection.copyIn("measurements", "id", "taken_at", "value")) {
 *     writer.writeRow(1, OffsetDateTime.now(), new BigDecimal("1.5"));
 *     long copied = writer.finish();
 * }
 * </pre>
 * While a writer is open its connection rejects every other exchange. Closing a writer that was
 * neither finished nor aborted finishes it.
 */
@Slf4j
public class PgCopyWriter implements AutoCloseable {

    public enum State {
        OPEN,
        // trailer and CopyDone sent, completion not read yet
        CLOSED,
        FINISHED,
        ABORTED
    }

    static final byte[] BINARY_HEADER = new byte[]{'P', 'G', 'C', 'O', 'P', 'Y', '\n', (byte) 0xFF, '\r', '\n', 0};
    static final short TRAILER = -1;
    private static final int FLUSH_EVERY_ROWS = 128;

    private final PgConnection connection;
    private final PgSession session;
    private final PgMessageStream stream;
    @Getter
    private final String table;
    @Getter
    private final List<PgCopyColumn> columns;

    @Getter
    private State state;
    @Getter
    private long rowsWritten = 0;
    private long copiedRowCount = -1;

    private PgCopyWriter(PgConnection connection, PgSession session, String table, List<PgCopyColumn> columns) {
        this.connection = connection;
        this.session = session;
        this.stream = session.getStream();
        this.table = table;
        this.columns = columns;
        this.state = State.OPEN;
    }

    /**
     * Opens a writer for the named columns, looking their types up in {@code pg_attribute}.
     */
    public static PgCopyWriter open(PgConnection connection, String table, String... columnNames) {
        return open(connection, table, resolveColumns(connection, table, Arrays.asList(columnNames)));
    }

    public static PgCopyWriter open(PgConnection connection, String table, List<PgCopyColumn> columns) {
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("COPY needs at least one column.");
        }
        for (PgCopyColumn column : columns) {
            if (PgValueEncoders.find(column.getTypeOid()) == null) {
                throw new ValueEncodingException("Column '" + column.getName() + "' has type OID " + column.getTypeOid() + " which has no binary encoder.");
            }
        }

        PgCopyWriter writer = new PgCopyWriter(connection, connection.beginCopy(), table, Collections.unmodifiableList(new ArrayList<>(columns)));
        try {
            writer.start();
        } catch (RuntimeException e) {
            writer.state = State.ABORTED;
            connection.endCopy();
            throw e;
        }
        return writer;
    }

    public void writeRow(Object... values) {
        writeRow(Arrays.asList(values));
    }

    public void writeRow(List<?> values) {
        checkState(State.OPEN);
        if (values.size() != columns.size()) {
            throw new ParameterCountMismatchException("COPY " + table, columns.size(), values.size());
        }

        @Cleanup("release") ByteBuf row = stream.alloc().buffer();
        row.writeShort(columns.size());
        for (int i = 0; i < columns.size(); i++) {
            Object value = values.get(i);
            if (value == null || value == PgNull.NULL) {
                row.writeInt(PostgresProtocolGeneralConstants.NULL_VALUE_LENGTH);
                continue;
            }
            int lengthIdx = row.writerIndex();
            row.writeInt(0);
            PgValueEncoders.encodeBinary(columns.get(i).getTypeOid(), value, row);
            row.setInt(lengthIdx, row.writerIndex() - lengthIdx - 4);
        }

        stream.write(ClientPostgresProtocolMessageEncoder.encodeCopyDataMessage(row, stream.alloc()));
        rowsWritten++;
        if (rowsWritten % FLUSH_EVERY_ROWS == 0) {
            stream.flush();
        }
    }

    /**
     * Sends the trailer and CopyDone and waits for the server to commit the copy.
     *
     * @return number of rows the server copied
     */
    public long finish() {
        if (state == State.FINISHED) {
            return copiedRowCount;
        }
        checkState(State.OPEN);

        try {
            @Cleanup("release") ByteBuf trailer = stream.alloc().buffer(2);
            trailer.writeShort(TRAILER);
            stream.write(ClientPostgresProtocolMessageEncoder.encodeCopyDataMessage(trailer, stream.alloc()));
            stream.write(ClientPostgresProtocolMessageEncoder.encodeCopyDoneMessage(stream.alloc()));
            stream.write(ClientPostgresProtocolMessageEncoder.encodeSyncMessage(stream.alloc()));
            stream.flush();
            state = State.CLOSED;

            PgServerException serverError = null;
            long count = -1;
            while (true) {
                PgMessageInfo message = session.receive();
                try {
                    switch (message.getStartByte()) {
                        case PostgresProtocolGeneralConstants.COMMAND_COMPLETE_START_CHAR ->
                                count = ServerPostgresProtocolMessageDecoder.decodeCommandCompleteMessage(message).getAffectedRows();
                        case PostgresProtocolGeneralConstants.ERROR_MESSAGE_START_CHAR -> serverError = onError(message, serverError);
                        case PostgresProtocolGeneralConstants.READY_FOR_QUERY_MESSAGE_START_CHAR -> {
                            session.onReadyForQuery(message);
                            if (serverError != null) {
                                state = State.ABORTED;
                                throw serverError;
                            }
                            state = State.FINISHED;
                            copiedRowCount = count;
                            log.debug("Copied {} rows into {}.", count, table);
                            return count;
                        }
                        default -> throw unexpected(message);
                    }
                } finally {
                    message.release();
                }
            }
        } finally {
            connection.endCopy();
        }
    }

    /**
     * Makes the server abandon the copy. Nothing written by this writer is kept.
     *
     * @throws PgServerException always, the error the server reported for the abandoned copy
     */
    public void abort(String reason) {
        checkState(State.OPEN);
        try {
            stream.write(ClientPostgresProtocolMessageEncoder.encodeCopyFailMessage(reason, stream.alloc()));
            stream.write(ClientPostgresProtocolMessageEncoder.encodeSyncMessage(stream.alloc()));
            stream.flush();

            PgServerException serverError = null;
            while (true) {
                PgMessageInfo message = session.receive();
                try {
                    switch (message.getStartByte()) {
                        case PostgresProtocolGeneralConstants.ERROR_MESSAGE_START_CHAR -> serverError = onError(message, serverError);
                        case PostgresProtocolGeneralConstants.COMMAND_COMPLETE_START_CHAR ->
                                log.warn("Server completed a COPY that was aborted.");
                        case PostgresProtocolGeneralConstants.READY_FOR_QUERY_MESSAGE_START_CHAR -> {
                            session.onReadyForQuery(message);
                            state = State.ABORTED;
                            if (serverError != null) {
                                throw serverError;
                            }
                            throw new PgClientException("COPY into " + table + " was aborted: " + reason);
                        }
                        default -> throw unexpected(message);
                    }
                } finally {
                    message.release();
                }
            }
        } finally {
            connection.endCopy();
        }
    }

    @Override
    public void close() {
        if (state == State.OPEN) {
            finish();
        }
    }

    private void start() {
        String sql = "COPY " + table + " ("
                + columns.stream().map(column -> quoteIdentifier(column.getName())).collect(Collectors.joining(", "))
                + ") FROM STDIN (FORMAT BINARY)";

        // Flush instead of Sync: the server ignores Sync while in copy-in mode
        stream.write(ClientPostgresProtocolMessageEncoder.encodeParseMessage("", sql, Collections.emptyList(), stream.alloc()));
        stream.write(ClientPostgresProtocolMessageEncoder.encodeBindMessage("", "", Collections.emptyList(), Collections.emptyList(), stream.alloc()));
        stream.write(ClientPostgresProtocolMessageEncoder.encodeExecuteMessage("", 0, stream.alloc()));
        stream.write(ClientPostgresProtocolMessageEncoder.encodeFlushMessage(stream.alloc()));
        stream.flush();

        while (true) {
            PgMessageInfo message = session.receive();
            try {
                switch (message.getStartByte()) {
                    case PostgresProtocolGeneralConstants.PARSE_COMPLETE_START_CHAR,
                            PostgresProtocolGeneralConstants.BIND_COMPLETE_START_CHAR -> {
                        // expected
                    }
                    case PostgresProtocolGeneralConstants.COPY_IN_RESPONSE_START_CHAR -> {
                        CopyInResponse copyInResponse = ServerPostgresProtocolMessageDecoder.decodeCopyResponse(message);
                        if (copyInResponse.getOverallFormat() != PostgresProtocolGeneralConstants.BINARY_FORMAT_CODE) {
                            throw new MessageDecodingException("Server started a text COPY although binary was requested.");
                        }
                        sendHeader();
                        log.debug("Started binary COPY into {} with {} columns.", table, columns.size());
                        return;
                    }
                    case PostgresProtocolGeneralConstants.ERROR_MESSAGE_START_CHAR -> {
                        PgServerException error = session.classifyError(message);
                        if (!error.isFatal()) {
                            syncAfterFailedStart();
                        }
                        throw error;
                    }
                    default -> throw unexpected(message);
                }
            } finally {
                message.release();
            }
        }
    }

    private void sendHeader() {
        @Cleanup("release") ByteBuf header = stream.alloc().buffer(BINARY_HEADER.length + 8);
        header.writeBytes(BINARY_HEADER);
        // flags
        header.writeInt(0);
        // header extension length
        header.writeInt(0);
        stream.write(ClientPostgresProtocolMessageEncoder.encodeCopyDataMessage(header, stream.alloc()));
    }

    private void syncAfterFailedStart() {
        stream.writeAndFlush(ClientPostgresProtocolMessageEncoder.encodeSyncMessage(stream.alloc()));
        while (true) {
            PgMessageInfo message = session.receive();
            try {
                if (message.getStartByte() == PostgresProtocolGeneralConstants.READY_FOR_QUERY_MESSAGE_START_CHAR) {
                    session.onReadyForQuery(message);
                    return;
                }
            } finally {
                message.release();
            }
        }
    }

    private PgServerException onError(PgMessageInfo message, PgServerException previous) {
        PgServerException error = session.classifyError(message);
        if (error.isFatal()) {
            state = State.ABORTED;
            throw error;
        }
        return previous != null ? previous : error;
    }

    private MessageDecodingException unexpected(PgMessageInfo message) {
        MessageDecodingException exception = new MessageDecodingException("Received unexpected message '" + (char) message.getStartByte() + "' during COPY.");
        state = State.ABORTED;
        stream.markFailed(exception);
        return exception;
    }

    private void checkState(State expected) {
        if (state != expected) {
            throw new IllegalStateException("COPY writer for " + table + " is " + state + ", expected " + expected + ".");
        }
    }

    static List<PgCopyColumn> resolveColumns(PgConnection connection, String table, List<String> columnNames) {
        String sql = "SELECT attname, atttypid FROM pg_catalog.pg_attribute WHERE attrelid = "
                + SqlLiteralFormatter.toSqlText(table) + "::regclass AND attnum > 0 AND NOT attisdropped";
        List<PgQueryResult<List<List<Object>>>> results = connection.simpleQuery(sql, ListRowReader::new);

        Map<String, Integer> typeOids = new HashMap<>();
        for (List<Object> row : results.get(0).getResult()) {
            typeOids.put((String) row.get(0), ((Long) row.get(1)).intValue());
        }

        List<PgCopyColumn> ret = new ArrayList<>(columnNames.size());
        for (String columnName : columnNames) {
            Integer oid = typeOids.get(columnName);
            if (oid == null) {
                throw new PgClientException("Column '" + columnName + "' does not exist in table " + table + ". Known columns: " + StringUtils.join(typeOids.keySet(), ", "));
            }
            ret.add(PgCopyColumn.of(columnName, oid));
        }
        return ret;
    }

    private static String quoteIdentifier(String identifier) {
        return "\"" + StringUtils.replace(identifier, "\"", "\"\"") + "\"";
    }
}
