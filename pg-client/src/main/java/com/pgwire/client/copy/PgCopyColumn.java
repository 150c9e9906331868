package com.pgwire.client.copy;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor(staticName = "of")
public class PgCopyColumn {
    private String name;
    private int typeOid;
}
