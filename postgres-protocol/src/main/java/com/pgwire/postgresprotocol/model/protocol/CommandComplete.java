package com.pgwire.postgresprotocol.model.protocol;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommandComplete {
    private String commandTag;

    /**
     * Number of rows the command reported, taken from the last word of the tag
     * ({@code INSERT 0 5}, {@code UPDATE 3}, {@code SELECT 10}, {@code COPY 4}); -1 when the tag carries none.
     */
    public long getAffectedRows() {
        if (commandTag == null) {
            return -1;
        }
        int lastSpace = commandTag.lastIndexOf(' ');
        if (lastSpace < 0) {
            return -1;
        }
        try {
            return Long.parseLong(commandTag.substring(lastSpace + 1));
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
