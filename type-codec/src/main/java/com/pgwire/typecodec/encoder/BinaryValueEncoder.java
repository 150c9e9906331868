package com.pgwire.typecodec.encoder;

import io.netty.buffer.ByteBuf;

import java.util.function.BiConsumer;

/**
 * Writes Java values of one type OID in binary format.
 */
public interface BinaryValueEncoder {

    /**
     * @return true when {@link #encode(Object, ByteBuf)} accepts this non-null value
     */
    boolean supports(Object value);

    /**
     * Writes the value bytes only, without a length prefix.
     */
    void encode(Object value, ByteBuf out);

    static BinaryValueEncoder of(Class<?> type, BiConsumer<Object, ByteBuf> writer) {
        return ofTypes(writer, type);
    }

    static BinaryValueEncoder ofTypes(BiConsumer<Object, ByteBuf> writer, Class<?>... types) {
        return new BinaryValueEncoder() {
            @Override
            public boolean supports(Object value) {
                for (Class<?> type : types) {
                    if (type.isInstance(value)) {
                        return true;
                    }
                }
                return false;
            }

            @Override
            public void encode(Object value, ByteBuf out) {
                writer.accept(value, out);
            }
        };
    }
}
