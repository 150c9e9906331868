package com.pgwire.typecodec.encoder;

import com.pgwire.postgresprotocol.constant.PostgresProtocolGeneralConstants;
import com.pgwire.postgresprotocol.exception.ValueEncodingException;
import com.pgwire.typecodec.model.PgNull;
import io.netty.buffer.ByteBuf;
import lombok.AllArgsConstructor;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Encodes a {@link List} or a Java array as a Postgres array of {@code elementOid}. Nested lists or
 * arrays become extra dimensions and must be rectangular. {@code byte[]} is never treated as an
 * array, it is a bytea element.
 */
@AllArgsConstructor
public class PgArrayEncoder implements BinaryValueEncoder {
    private final int elementOid;
    private final BinaryValueEncoder elementEncoder;

    @Override
    public boolean supports(Object value) {
        if (!isContainer(value)) {
            return false;
        }
        try {
            List<Integer> dimensions = dimensionsOf(value);
            List<Object> leaves = new ArrayList<>();
            collectLeaves(value, dimensions, 0, leaves);
            for (Object leaf : leaves) {
                if (!isNull(leaf) && !elementEncoder.supports(leaf)) {
                    return false;
                }
            }
            return true;
        } catch (ValueEncodingException e) {
            return false;
        }
    }

    @Override
    public void encode(Object value, ByteBuf out) {
        List<Integer> dimensions = dimensionsOf(value);
        List<Object> leaves = new ArrayList<>();
        collectLeaves(value, dimensions, 0, leaves);

        if (leaves.isEmpty()) {
            out.writeInt(0);
            out.writeInt(0);
            out.writeInt(elementOid);
            return;
        }

        boolean hasNull = leaves.stream().anyMatch(PgArrayEncoder::isNull);
        out.writeInt(dimensions.size());
        out.writeInt(hasNull ? 1 : 0);
        out.writeInt(elementOid);
        for (Integer size : dimensions) {
            out.writeInt(size);
            // lower bound
            out.writeInt(1);
        }

        for (Object leaf : leaves) {
            if (isNull(leaf)) {
                out.writeInt(PostgresProtocolGeneralConstants.NULL_VALUE_LENGTH);
                continue;
            }
            int lengthIdx = out.writerIndex();
            out.writeInt(0);
            elementEncoder.encode(leaf, out);
            out.setInt(lengthIdx, out.writerIndex() - lengthIdx - 4);
        }
    }

    static boolean isContainer(Object value) {
        return value instanceof List || (value != null && value.getClass().isArray() && !(value instanceof byte[]));
    }

    private static boolean isNull(Object value) {
        return value == null || value == PgNull.NULL;
    }

    private static List<Object> asList(Object value) {
        if (value instanceof List) {
            @SuppressWarnings("unchecked")
            List<Object> list = (List<Object>) value;
            return list;
        }
        if (value instanceof Object[]) {
            return Arrays.asList((Object[]) value);
        }
        int length = Array.getLength(value);
        List<Object> ret = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            ret.add(Array.get(value, i));
        }
        return ret;
    }

    private static List<Integer> dimensionsOf(Object value) {
        List<Integer> dimensions = new ArrayList<>();
        Object current = value;
        while (isContainer(current)) {
            List<Object> list = asList(current);
            dimensions.add(list.size());
            if (list.isEmpty()) {
                break;
            }
            current = list.get(0);
        }
        return dimensions;
    }

    private static void collectLeaves(Object value, List<Integer> dimensions, int depth, List<Object> leaves) {
        List<Object> list = asList(value);
        if (list.size() != dimensions.get(depth)) {
            throw new ValueEncodingException("Multidimensional arrays must have sub-arrays with matching dimensions.");
        }
        boolean innermost = depth == dimensions.size() - 1;
        for (Object element : list) {
            if (innermost) {
                if (isContainer(element)) {
                    throw new ValueEncodingException("Multidimensional arrays must have sub-arrays with matching dimensions.");
                }
                leaves.add(element);
            } else {
                if (!isContainer(element)) {
                    throw new ValueEncodingException("Multidimensional arrays must have sub-arrays with matching dimensions.");
                }
                collectLeaves(element, dimensions, depth + 1, leaves);
            }
        }
    }
}
