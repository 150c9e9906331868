package com.pgwire.typecodec.literal;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Text of a value as it appears in SQL. When {@code requiresQuoting} is set the text must be
 * single-quoted before it is embedded into a statement.
 */
@Data
@AllArgsConstructor
public class SqlLiteral {
    private String text;
    private boolean requiresQuoting;
}
