package com.pgwire.client.query;

import com.pgwire.client.connection.PgSession;
import com.pgwire.client.model.PgPreparedStatement;
import com.pgwire.client.model.PgQueryResult;
import com.pgwire.client.reader.RowReader;
import com.pgwire.postgresprotocol.constant.PostgresProtocolGeneralConstants;
import com.pgwire.postgresprotocol.decoder.ServerPostgresProtocolMessageDecoder;
import com.pgwire.postgresprotocol.encoder.ClientPostgresProtocolMessageEncoder;
import com.pgwire.postgresprotocol.error.PgServerException;
import com.pgwire.postgresprotocol.exception.MessageDecodingException;
import com.pgwire.postgresprotocol.exception.ParameterCountMismatchException;
import com.pgwire.postgresprotocol.model.internal.PgMessageInfo;
import com.pgwire.postgresprotocol.model.protocol.BindParameter;
import com.pgwire.postgresprotocol.model.protocol.RowDescription;
import com.pgwire.postgresprotocol.stream.PgMessageStream;
import com.pgwire.typecodec.encoder.PgParameterEncoder;
import com.pgwire.typecodec.reader.ReadTable;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;

/**
 * Extended query protocol: Parse/Describe for preparation, Bind/Execute for execution, every batch
 * closed by Sync.
 */
@Slf4j
public class PgExtendedQueryExecutor {
    public static final String UNNAMED = "";

    /**
     * Parses and describes {@code sql} as statement {@code name}.
     *
     * @param closeExisting send Close for {@code name} first, in the same batch
     */
    public static PgPreparedStatement prepare(PgSession session, String name, String sql, List<Integer> parameterTypeOids, boolean closeExisting) {
        PgMessageStream stream = session.getStream();
        if (closeExisting) {
            stream.write(ClientPostgresProtocolMessageEncoder.encodeCloseMessage(PostgresProtocolGeneralConstants.DESCRIBE_OR_CLOSE_STATEMENT, name, stream.alloc()));
        }
        stream.write(ClientPostgresProtocolMessageEncoder.encodeParseMessage(name, sql, parameterTypeOids, stream.alloc()));
        stream.write(ClientPostgresProtocolMessageEncoder.encodeDescribeMessage(PostgresProtocolGeneralConstants.DESCRIBE_OR_CLOSE_STATEMENT, name, stream.alloc()));
        stream.write(ClientPostgresProtocolMessageEncoder.encodeSyncMessage(stream.alloc()));
        stream.flush();

        List<Integer> describedParameterOids = parameterTypeOids;
        List<RowDescription.FieldDescription> fields = Collections.emptyList();
        PgServerException serverError = null;

        while (true) {
            PgMessageInfo message = session.receive();
            try {
                switch (message.getStartByte()) {
                    case PostgresProtocolGeneralConstants.PARSE_COMPLETE_START_CHAR,
                            PostgresProtocolGeneralConstants.CLOSE_COMPLETE_START_CHAR,
                            PostgresProtocolGeneralConstants.NO_DATA_START_CHAR -> {
                        // nothing to read
                    }
                    case PostgresProtocolGeneralConstants.PARAMETER_DESCRIPTION_START_CHAR -> describedParameterOids =
                            ServerPostgresProtocolMessageDecoder.decodeParameterDescription(message).getParameterTypeOids();
                    case PostgresProtocolGeneralConstants.ROW_DESCRIPTION_START_CHAR -> fields =
                            ServerPostgresProtocolMessageDecoder.decodeRowDescriptionMessage(message).getFieldDescriptions();
                    case PostgresProtocolGeneralConstants.ERROR_MESSAGE_START_CHAR -> serverError = onError(session, message, serverError);
                    case PostgresProtocolGeneralConstants.READY_FOR_QUERY_MESSAGE_START_CHAR -> {
                        session.onReadyForQuery(message);
                        if (serverError != null) {
                            throw serverError;
                        }
                        log.debug("Prepared statement '{}' with {} parameters and {} result columns.", name, describedParameterOids.size(), fields.size());
                        return PgPreparedStatement
                                .builder()
                                .name(name)
                                .sql(sql)
                                .parameterTypeOids(Collections.unmodifiableList(new ArrayList<>(describedParameterOids)))
                                .resultFields(Collections.unmodifiableList(new ArrayList<>(fields)))
                                .build();
                    }
                    default -> throw unexpected(session, message, "preparation");
                }
            } finally {
                message.release();
            }
        }
    }

    /**
     * Binds {@code parameters} to a prepared statement and runs it through the unnamed portal.
     */
    public static <R> PgQueryResult<R> execute(PgSession session,
                                               PgPreparedStatement statement,
                                               Supplier<? extends RowReader<R>> readerSupplier,
                                               List<?> parameters) {
        int expected = statement.getParameterTypeOids().size();
        if (parameters.size() != expected) {
            throw new ParameterCountMismatchException(statement.getName(), expected, parameters.size());
        }

        PgMessageStream stream = session.getStream();
        ReadTable readTable = session.getReadTable();

        // encode everything before the first byte is written, so an encoding failure leaves the connection idle
        List<BindParameter> bindParameters = new ArrayList<>(parameters.size());
        for (int i = 0; i < parameters.size(); i++) {
            bindParameters.add(PgParameterEncoder.encode(statement.getParameterTypeOids().get(i), parameters.get(i), stream.alloc()));
        }

        List<Short> resultFormats = new ArrayList<>(statement.getResultFields().size());
        List<RowDescription.FieldDescription> fields = new ArrayList<>(statement.getResultFields().size());
        for (RowDescription.FieldDescription field : statement.getResultFields()) {
            short format = readTable.decodesBinary(field.getFieldDataTypeOid())
                    ? PostgresProtocolGeneralConstants.BINARY_FORMAT_CODE
                    : PostgresProtocolGeneralConstants.TEXT_FORMAT_CODE;
            resultFormats.add(format);
            fields.add(field.toBuilder().formatCode(format).build());
        }

        stream.write(ClientPostgresProtocolMessageEncoder.encodeBindMessage(UNNAMED, statement.getName(), bindParameters, resultFormats, stream.alloc()));
        stream.write(ClientPostgresProtocolMessageEncoder.encodeExecuteMessage(UNNAMED, 0, stream.alloc()));
        stream.write(ClientPostgresProtocolMessageEncoder.encodeSyncMessage(stream.alloc()));
        stream.flush();

        PgResultCollector<R> collector = new PgResultCollector<>(readerSupplier, readTable);
        PgServerException serverError = null;

        while (true) {
            PgMessageInfo message = session.receive();
            try {
                switch (message.getStartByte()) {
                    case PostgresProtocolGeneralConstants.BIND_COMPLETE_START_CHAR -> {
                        if (!fields.isEmpty()) {
                            collector.onRowDescription(fields);
                        }
                    }
                    case PostgresProtocolGeneralConstants.DATA_ROW_START_CHAR -> collector.onDataRow(message);
                    case PostgresProtocolGeneralConstants.COMMAND_COMPLETE_START_CHAR -> collector.onCommandComplete(message);
                    case PostgresProtocolGeneralConstants.EMPTY_QUERY_RESPONSE_START_CHAR -> collector.onEmptyQuery();
                    case PostgresProtocolGeneralConstants.PORTAL_SUSPENDED_START_CHAR ->
                            log.debug("Portal suspended although no row limit was set.");
                    case PostgresProtocolGeneralConstants.ERROR_MESSAGE_START_CHAR -> serverError = onError(session, message, serverError);
                    case PostgresProtocolGeneralConstants.READY_FOR_QUERY_MESSAGE_START_CHAR -> {
                        session.onReadyForQuery(message);
                        if (serverError != null) {
                            throw serverError;
                        }
                        if (collector.getReaderFailure() != null) {
                            throw collector.getReaderFailure();
                        }
                        if (collector.getResults().isEmpty()) {
                            throw new MessageDecodingException("Execution of statement '" + statement.getName() + "' ended without a completion message.");
                        }
                        return collector.getResults().get(0);
                    }
                    default -> throw unexpected(session, message, "execution");
                }
            } finally {
                message.release();
            }
        }
    }

    /**
     * Closes a prepared statement on the server.
     */
    public static void close(PgSession session, String name) {
        PgMessageStream stream = session.getStream();
        stream.write(ClientPostgresProtocolMessageEncoder.encodeCloseMessage(PostgresProtocolGeneralConstants.DESCRIBE_OR_CLOSE_STATEMENT, name, stream.alloc()));
        stream.write(ClientPostgresProtocolMessageEncoder.encodeSyncMessage(stream.alloc()));
        stream.flush();

        PgServerException serverError = null;
        while (true) {
            PgMessageInfo message = session.receive();
            try {
                switch (message.getStartByte()) {
                    case PostgresProtocolGeneralConstants.CLOSE_COMPLETE_START_CHAR -> log.debug("Closed prepared statement '{}'.", name);
                    case PostgresProtocolGeneralConstants.ERROR_MESSAGE_START_CHAR -> serverError = onError(session, message, serverError);
                    case PostgresProtocolGeneralConstants.READY_FOR_QUERY_MESSAGE_START_CHAR -> {
                        session.onReadyForQuery(message);
                        if (serverError != null) {
                            throw serverError;
                        }
                        return;
                    }
                    default -> throw unexpected(session, message, "statement close");
                }
            } finally {
                message.release();
            }
        }
    }

    private static PgServerException onError(PgSession session, PgMessageInfo message, PgServerException previous) {
        PgServerException error = session.classifyError(message);
        if (error.isFatal()) {
            throw error;
        }
        // the first error is the one that aborted the batch
        return previous != null ? previous : error;
    }

    /**
     * The protocol state is unknown after an unexpected message, so the connection is given up.
     */
    private static MessageDecodingException unexpected(PgSession session, PgMessageInfo message, String phase) {
        MessageDecodingException exception = new MessageDecodingException("Received unexpected message '" + (char) message.getStartByte() + "' during " + phase + ".");
        session.getStream().markFailed(exception);
        return exception;
    }

    private PgExtendedQueryExecutor() {
    }
}
