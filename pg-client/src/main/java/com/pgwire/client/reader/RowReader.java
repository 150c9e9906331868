package com.pgwire.client.reader;

import com.pgwire.postgresprotocol.model.protocol.RowDescription;

import java.util.List;

/**
 * Consumes one result set. A fresh reader is created for every result set, so implementations may
 * keep state between calls.
 *
 * @param <R> result built from the rows
 */
public interface RowReader<R> {

    void onRowDescription(List<RowDescription.FieldDescription> fields);

    void onRow(List<PgColumnValue> columns);

    R onComplete();
}
