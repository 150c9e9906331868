package com.pgwire.typecodec.literal;

import com.pgwire.typecodec.model.PgNull;
import io.netty.buffer.ByteBufUtil;
import org.apache.commons.lang3.StringUtils;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders Java values as SQL literals.
 * <pre>
 * SqlLiteralFormatter.toSqlString(42)       -> SqlLiteral("42", false)
 * SqlLiteralFormatter.toSqlString("it's")   -> SqlLiteral("it's", true)
 * SqlLiteralFormatter.toSqlText("it's")     -> 'it''s'
 * </pre>
 */
public class SqlLiteralFormatter {
    private static final String NULL = "NULL";

    public static SqlLiteral toSqlString(Object value) {
        if (value == null || value == PgNull.NULL) {
            return new SqlLiteral(NULL, false);
        }
        if (value instanceof Boolean) {
            return new SqlLiteral((Boolean) value ? "true" : "false", false);
        }
        if (value instanceof Number) {
            return formatNumber((Number) value);
        }
        if (value instanceof byte[]) {
            return new SqlLiteral("\\x" + ByteBufUtil.hexDump((byte[]) value), true);
        }
        if (value instanceof Iterable || value.getClass().isArray()) {
            List<String> elements = new ArrayList<>();
            for (Object element : elementsOf(value)) {
                elements.add(toSqlText(element));
            }
            return new SqlLiteral("ARRAY[" + StringUtils.join(elements, ",") + "]", false);
        }
        return new SqlLiteral(value.toString(), true);
    }

    /**
     * @return literal text ready to be embedded into a statement
     */
    public static String toSqlText(Object value) {
        return quote(toSqlString(value));
    }

    public static String quote(SqlLiteral literal) {
        if (!literal.isRequiresQuoting()) {
            return literal.getText();
        }
        return "'" + StringUtils.replace(literal.getText(), "'", "''") + "'";
    }

    private static SqlLiteral formatNumber(Number number) {
        if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            if (Double.isNaN(d)) {
                return new SqlLiteral("NaN", true);
            }
            if (Double.isInfinite(d)) {
                return new SqlLiteral(d > 0 ? "Infinity" : "-Infinity", true);
            }
            return new SqlLiteral(new BigDecimal(number.toString()).toPlainString(), false);
        }
        if (number instanceof BigDecimal) {
            return new SqlLiteral(((BigDecimal) number).toPlainString(), false);
        }
        if (number instanceof BigInteger) {
            return new SqlLiteral(number.toString(), false);
        }
        return new SqlLiteral(new BigDecimal(number.toString()).toPlainString(), false);
    }

    private static Iterable<?> elementsOf(Object value) {
        if (value instanceof Iterable) {
            return (Iterable<?>) value;
        }
        int length = Array.getLength(value);
        List<Object> ret = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            ret.add(Array.get(value, i));
        }
        return ret;
    }

    private SqlLiteralFormatter() {
    }
}
