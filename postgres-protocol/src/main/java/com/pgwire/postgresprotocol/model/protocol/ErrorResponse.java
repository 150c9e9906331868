package com.pgwire.postgresprotocol.model.protocol;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Decoded ErrorResponse or NoticeResponse body. Both messages share the same field layout.
 *
 * @see <a href="https://www.postgresql.org/docs/current/protocol-error-fields.html">Error and notice fields</a>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {
    private String severity;
    private String severityNotLocalized;
    private String code;
    private String message;
    private String detail;
    private String hint;
    private Integer position;
    private Integer internalPosition;
    private String internalQuery;
    private String where;
    private String schemaName;
    private String tableName;
    private String columnName;
    private String dataTypeName;
    private String constraintName;
    private String file;
    private Integer line;
    private String routine;
}
