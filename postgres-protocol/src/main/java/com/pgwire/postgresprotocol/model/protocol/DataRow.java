package com.pgwire.postgresprotocol.model.protocol;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

@Getter
@AllArgsConstructor
public class DataRow {
    // null entries are SQL nulls
    private final List<byte[]> columns;

    public int getColumnCount() {
        return columns.size();
    }

    public boolean isNull(int index) {
        return columns.get(index) == null;
    }
}
