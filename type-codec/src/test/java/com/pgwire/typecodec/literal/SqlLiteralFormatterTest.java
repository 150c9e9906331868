package com.pgwire.typecodec.literal;

import com.pgwire.typecodec.model.PgNull;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SqlLiteralFormatterTest {

    @Test
    void nullAndBooleans() {
        assertThat(SqlLiteralFormatter.toSqlString(null)).isEqualTo(new SqlLiteral("NULL", false));
        assertThat(SqlLiteralFormatter.toSqlString(PgNull.NULL)).isEqualTo(new SqlLiteral("NULL", false));
        assertThat(SqlLiteralFormatter.toSqlString(true)).isEqualTo(new SqlLiteral("true", false));
    }

    @Test
    void numbersAreUnquoted() {
        assertThat(SqlLiteralFormatter.toSqlText(42)).isEqualTo("42");
        assertThat(SqlLiteralFormatter.toSqlText(-7L)).isEqualTo("-7");
        assertThat(SqlLiteralFormatter.toSqlText(2.5d)).isEqualTo("2.5");
        assertThat(SqlLiteralFormatter.toSqlText(new BigDecimal("1E+3"))).isEqualTo("1000");
        assertThat(SqlLiteralFormatter.toSqlText(new BigInteger("123456789012345678901234567890"))).isEqualTo("123456789012345678901234567890");
    }

    @Test
    void nonFiniteFloatsAreQuoted() {
        assertThat(SqlLiteralFormatter.toSqlText(Double.NaN)).isEqualTo("'NaN'");
        assertThat(SqlLiteralFormatter.toSqlText(Float.NEGATIVE_INFINITY)).isEqualTo("'-Infinity'");
        assertThat(SqlLiteralFormatter.toSqlText(Double.POSITIVE_INFINITY)).isEqualTo("'Infinity'");
        assertThat(SqlLiteralFormatter.toSqlString(Float.NaN)).isEqualTo(new SqlLiteral("NaN", true));
        assertThat(SqlLiteralFormatter.toSqlString(2.5d)).isEqualTo(new SqlLiteral("2.5", false));
    }

    @Test
    void stringsAreQuotedAndEscaped() {
        assertThat(SqlLiteralFormatter.toSqlString("it's")).isEqualTo(new SqlLiteral("it's", true));
        assertThat(SqlLiteralFormatter.toSqlText("it's")).isEqualTo("'it''s'");
        assertThat(SqlLiteralFormatter.toSqlText(new byte[]{1, (byte) 0xAB})).isEqualTo("'\\x01ab'");
    }

    @Test
    void collectionsBecomeArrayConstructors() {
        assertThat(SqlLiteralFormatter.toSqlText(Arrays.asList(1, null, 3))).isEqualTo("ARRAY[1,NULL,3]");
        assertThat(SqlLiteralFormatter.toSqlText(new String[]{"a", "b'c"})).isEqualTo("ARRAY['a','b''c']");
        assertThat(SqlLiteralFormatter.toSqlText(List.of(List.of(1), List.of(2)))).isEqualTo("ARRAY[ARRAY[1],ARRAY[2]]");
    }
}
