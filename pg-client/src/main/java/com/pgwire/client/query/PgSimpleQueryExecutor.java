package com.pgwire.client.query;

import com.pgwire.client.connection.PgSession;
import com.pgwire.client.model.PgQueryResult;
import com.pgwire.client.reader.RowReader;
import com.pgwire.postgresprotocol.constant.PostgresProtocolGeneralConstants;
import com.pgwire.postgresprotocol.encoder.ClientPostgresProtocolMessageEncoder;
import com.pgwire.postgresprotocol.error.PgServerException;
import com.pgwire.postgresprotocol.model.internal.PgMessageInfo;
import com.pgwire.postgresprotocol.stream.PgMessageStream;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.function.Supplier;

/**
 * Simple query protocol: one Query message that may hold several statements. Results arrive in text
 * format.
 */
@Slf4j
public class PgSimpleQueryExecutor {
    public static final String COPY_IN_NOT_SUPPORTED_REASON = "COPY FROM STDIN is not supported in simple query execution";

    /**
     * @return one result per statement, in statement order
     * @throws PgServerException for the first statement that failed, after the connection is ready again
     */
    public static <R> List<PgQueryResult<R>> execute(PgSession session, String sql, Supplier<? extends RowReader<R>> readerSupplier) {
        PgMessageStream stream = session.getStream();
        stream.writeAndFlush(ClientPostgresProtocolMessageEncoder.encodeSimpleQueryMessage(sql, stream.alloc()));

        PgResultCollector<R> collector = new PgResultCollector<>(readerSupplier, session.getReadTable());
        PgServerException serverError = null;

        while (true) {
            PgMessageInfo message = session.receive();
            try {
                switch (message.getStartByte()) {
                    case PostgresProtocolGeneralConstants.ROW_DESCRIPTION_START_CHAR -> collector.onRowDescription(message);
                    case PostgresProtocolGeneralConstants.DATA_ROW_START_CHAR -> collector.onDataRow(message);
                    case PostgresProtocolGeneralConstants.COMMAND_COMPLETE_START_CHAR -> collector.onCommandComplete(message);
                    case PostgresProtocolGeneralConstants.EMPTY_QUERY_RESPONSE_START_CHAR -> collector.onEmptyQuery();
                    case PostgresProtocolGeneralConstants.ERROR_MESSAGE_START_CHAR -> {
                        serverError = session.classifyError(message);
                        if (serverError.isFatal()) {
                            throw serverError;
                        }
                    }
                    case PostgresProtocolGeneralConstants.COPY_IN_RESPONSE_START_CHAR -> {
                        log.warn("Statement started COPY FROM STDIN, answering with CopyFail.");
                        stream.writeAndFlush(ClientPostgresProtocolMessageEncoder.encodeCopyFailMessage(COPY_IN_NOT_SUPPORTED_REASON, stream.alloc()));
                    }
                    case PostgresProtocolGeneralConstants.COPY_OUT_RESPONSE_START_CHAR ->
                            log.debug("Statement started COPY TO STDOUT, discarding its data.");
                    case PostgresProtocolGeneralConstants.COPY_DATA_START_CHAR,
                            PostgresProtocolGeneralConstants.COPY_DONE_START_CHAR -> {
                        // discarded copy out data
                    }
                    case PostgresProtocolGeneralConstants.READY_FOR_QUERY_MESSAGE_START_CHAR -> {
                        session.onReadyForQuery(message);
                        if (serverError != null) {
                            throw serverError;
                        }
                        if (collector.getReaderFailure() != null) {
                            throw collector.getReaderFailure();
                        }
                        return collector.getResults();
                    }
                    default -> log.warn("Ignoring unexpected message '{}' during simple query.", (char) message.getStartByte());
                }
            } finally {
                message.release();
            }
        }
    }

    private PgSimpleQueryExecutor() {
    }
}
