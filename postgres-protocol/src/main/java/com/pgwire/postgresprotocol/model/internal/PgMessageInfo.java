package com.pgwire.postgresprotocol.model.internal;

import io.netty.buffer.ByteBuf;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One framed backend message: its start byte and the payload after the length field.
 * Whoever receives it must call {@link #release()}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PgMessageInfo {
    private byte startByte;
    private ByteBuf payload;

    public int getLength() {
        return payload.readableBytes();
    }

    public void release() {
        if (payload != null && payload.refCnt() > 0) {
            payload.release();
        }
    }
}
