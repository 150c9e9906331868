package com.pgwire.client.reader;

import com.pgwire.postgresprotocol.model.protocol.RowDescription;

import java.util.List;

/**
 * Discards rows without decoding them and returns how many there were.
 */
public class IgnoreRowReader implements RowReader<Long> {
    private long rowCount = 0;

    @Override
    public void onRowDescription(List<RowDescription.FieldDescription> fields) {
    }

    @Override
    public void onRow(List<PgColumnValue> columns) {
        rowCount++;
    }

    @Override
    public Long onComplete() {
        return rowCount;
    }
}
