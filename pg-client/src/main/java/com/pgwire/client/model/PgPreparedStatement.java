package com.pgwire.client.model;

import com.pgwire.postgresprotocol.model.protocol.RowDescription;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PgPreparedStatement {
    private String name;
    private String sql;
    private List<Integer> parameterTypeOids;
    // empty when the statement returns no rows
    private List<RowDescription.FieldDescription> resultFields;
}
