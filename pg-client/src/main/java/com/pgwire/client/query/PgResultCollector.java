package com.pgwire.client.query;

import com.pgwire.client.model.PgQueryResult;
import com.pgwire.client.reader.PgColumnValue;
import com.pgwire.client.reader.RowReader;
import com.pgwire.postgresprotocol.decoder.ServerPostgresProtocolMessageDecoder;
import com.pgwire.postgresprotocol.exception.MessageDecodingException;
import com.pgwire.postgresprotocol.model.internal.PgMessageInfo;
import com.pgwire.postgresprotocol.model.protocol.CommandComplete;
import com.pgwire.postgresprotocol.model.protocol.DataRow;
import com.pgwire.postgresprotocol.model.protocol.RowDescription;
import com.pgwire.typecodec.reader.ReadTable;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;

/**
 * Feeds the result sets of one exchange into row readers. The first failure of a reader is kept and
 * the remaining rows are skipped, so that the exchange can still be drained to ReadyForQuery.
 */
@Slf4j
class PgResultCollector<R> {
    private final Supplier<? extends RowReader<R>> readerSupplier;
    private final ReadTable readTable;
    private final List<PgQueryResult<R>> results = new ArrayList<>();

    private RowReader<R> reader;
    private List<RowDescription.FieldDescription> fields = Collections.emptyList();
    private RuntimeException readerFailure;

    PgResultCollector(Supplier<? extends RowReader<R>> readerSupplier, ReadTable readTable) {
        this.readerSupplier = readerSupplier;
        this.readTable = readTable;
    }

    void onRowDescription(List<RowDescription.FieldDescription> fields) {
        this.fields = fields;
        if (readerFailure != null) {
            return;
        }
        try {
            reader = readerSupplier.get();
            reader.onRowDescription(fields);
        } catch (RuntimeException e) {
            fail(e);
        }
    }

    void onRowDescription(PgMessageInfo message) {
        onRowDescription(ServerPostgresProtocolMessageDecoder.decodeRowDescriptionMessage(message).getFieldDescriptions());
    }

    void onDataRow(PgMessageInfo message) {
        if (readerFailure != null || reader == null) {
            return;
        }
        try {
            DataRow dataRow = ServerPostgresProtocolMessageDecoder.decodeDataRowMessage(message);
            List<byte[]> columns = dataRow.getColumns();
            if (dataRow.getColumnCount() != fields.size()) {
                throw new MessageDecodingException("DataRow has " + dataRow.getColumnCount() + " columns but the row description has " + fields.size() + ".");
            }

            List<PgColumnValue> values = new ArrayList<>(columns.size());
            for (int i = 0; i < columns.size(); i++) {
                values.add(new PgColumnValue(fields.get(i), columns.get(i), readTable));
            }
            reader.onRow(values);
        } catch (RuntimeException e) {
            fail(e);
        }
    }

    void onCommandComplete(PgMessageInfo message) {
        CommandComplete commandComplete = ServerPostgresProtocolMessageDecoder.decodeCommandCompleteMessage(message);
        R result = null;
        if (reader != null && readerFailure == null) {
            try {
                result = reader.onComplete();
            } catch (RuntimeException e) {
                fail(e);
            }
        }
        results.add(new PgQueryResult<>(commandComplete.getCommandTag(), commandComplete.getAffectedRows(), fields, result));
        reader = null;
        fields = Collections.emptyList();
    }

    void onEmptyQuery() {
        results.add(PgQueryResult.emptyQuery());
        reader = null;
        fields = Collections.emptyList();
    }

    RuntimeException getReaderFailure() {
        return readerFailure;
    }

    List<PgQueryResult<R>> getResults() {
        return results;
    }

    private void fail(RuntimeException e) {
        log.debug("Row reader failed, skipping the remaining rows of the exchange.", e);
        readerFailure = e;
        reader = null;
    }
}
