package com.pgwire.client.reader;

import com.pgwire.postgresprotocol.model.protocol.RowDescription;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects rows as lists of decoded values in column order.
 */
public class ListRowReader implements RowReader<List<List<Object>>> {
    private final List<List<Object>> rows = new ArrayList<>();

    @Override
    public void onRowDescription(List<RowDescription.FieldDescription> fields) {
    }

    @Override
    public void onRow(List<PgColumnValue> columns) {
        List<Object> row = new ArrayList<>(columns.size());
        for (PgColumnValue column : columns) {
            row.add(column.decode());
        }
        rows.add(row);
    }

    @Override
    public List<List<Object>> onComplete() {
        return rows;
    }
}
