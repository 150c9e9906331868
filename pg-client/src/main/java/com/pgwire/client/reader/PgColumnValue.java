package com.pgwire.client.reader;

import com.pgwire.postgresprotocol.model.protocol.RowDescription;
import com.pgwire.typecodec.reader.ReadTable;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Raw value of one column in one row. Decoding is left to the reader so that rows can be skipped
 * cheaply.
 */
@Getter
@AllArgsConstructor
public class PgColumnValue {
    private final RowDescription.FieldDescription field;
    // null for SQL NULL
    private final byte[] rawValue;
    private final ReadTable readTable;

    public boolean isNull() {
        return rawValue == null;
    }

    public Object decode() {
        return readTable.decode(field.getFieldDataTypeOid(), field.getFormatCode(), rawValue);
    }

    public String getName() {
        return field.getFieldName();
    }
}
