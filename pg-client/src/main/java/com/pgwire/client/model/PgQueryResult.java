package com.pgwire.client.model;

import com.pgwire.postgresprotocol.model.protocol.RowDescription;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of one statement.
 *
 * @param <R> what the row reader built from the rows; null when the statement returned no rows description
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PgQueryResult<R> {
    // null for an empty query string
    private String commandTag;
    private long affectedRows;
    private List<RowDescription.FieldDescription> fields;
    private R result;

    public static <R> PgQueryResult<R> emptyQuery() {
        return new PgQueryResult<>(null, 0, Collections.emptyList(), null);
    }

    public boolean isEmptyQuery() {
        return commandTag == null;
    }
}
