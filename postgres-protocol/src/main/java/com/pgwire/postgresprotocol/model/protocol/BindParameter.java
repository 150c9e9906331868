package com.pgwire.postgresprotocol.model.protocol;

import com.pgwire.postgresprotocol.constant.PostgresProtocolGeneralConstants;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * One encoded Bind parameter. A null {@code value} is sent as length -1.
 */
@Data
@AllArgsConstructor
public class BindParameter {
    private short formatCode;
    private byte[] value;

    public static BindParameter nullValue() {
        return new BindParameter(PostgresProtocolGeneralConstants.BINARY_FORMAT_CODE, null);
    }

    public static BindParameter binary(byte[] value) {
        return new BindParameter(PostgresProtocolGeneralConstants.BINARY_FORMAT_CODE, value);
    }

    public static BindParameter text(byte[] value) {
        return new BindParameter(PostgresProtocolGeneralConstants.TEXT_FORMAT_CODE, value);
    }
}
