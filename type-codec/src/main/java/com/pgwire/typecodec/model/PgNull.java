package com.pgwire.typecodec.model;

/**
 * Explicit SQL NULL marker, accepted wherever a Java {@code null} is.
 */
public enum PgNull {
    NULL
}
