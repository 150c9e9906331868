package com.pgwire.client.reader;

import com.pgwire.postgresprotocol.model.protocol.RowDescription;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects rows as column name to value maps, keeping column order. With duplicate column names the
 * last column wins.
 */
public class MapRowReader implements RowReader<List<Map<String, Object>>> {
    private final List<Map<String, Object>> rows = new ArrayList<>();

    @Override
    public void onRowDescription(List<RowDescription.FieldDescription> fields) {
    }

    @Override
    public void onRow(List<PgColumnValue> columns) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (PgColumnValue column : columns) {
            row.put(column.getName(), column.decode());
        }
        rows.add(row);
    }

    @Override
    public List<Map<String, Object>> onComplete() {
        return rows;
    }
}
