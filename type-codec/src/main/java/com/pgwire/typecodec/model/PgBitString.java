package com.pgwire.typecodec.model;

import com.pgwire.postgresprotocol.exception.MessageDecodingException;

import java.util.Arrays;

/**
 * Value of {@code bit(n)} or {@code varbit}: exactly {@link #length()} bits, most significant first.
 */
public final class PgBitString {

    private final boolean[] bits;

    public PgBitString(boolean[] bits) {
        this.bits = bits.clone();
    }

    public static PgBitString fromString(String text) {
        boolean[] bits = new boolean[text.length()];
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '1') {
                bits[i] = true;
            } else if (c != '0') {
                throw new MessageDecodingException("Invalid bit string literal '" + text + "'.");
            }
        }
        return new PgBitString(bits);
    }

    /**
     * Unpacks {@code bitLength} bits from a big-endian byte buffer, dropping pad bits of the last byte.
     */
    public static PgBitString fromPackedBytes(int bitLength, byte[] packed) {
        if (bitLength < 0 || (bitLength + 7) / 8 > packed.length) {
            throw new MessageDecodingException("Bit string of length " + bitLength + " does not fit into " + packed.length + " bytes.");
        }

        boolean[] bits = new boolean[bitLength];
        for (int i = 0; i < bitLength; i++) {
            bits[i] = (packed[i / 8] & (0x80 >>> (i % 8))) != 0;
        }
        return new PgBitString(bits);
    }

    public byte[] toPackedBytes() {
        byte[] packed = new byte[(bits.length + 7) / 8];
        for (int i = 0; i < bits.length; i++) {
            if (bits[i]) {
                packed[i / 8] |= (byte) (0x80 >>> (i % 8));
            }
        }
        return packed;
    }

    public int length() {
        return bits.length;
    }

    public boolean get(int idx) {
        return bits[idx];
    }

    public boolean[] getBits() {
        return bits.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(bits, ((PgBitString) o).bits);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bits);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(bits.length);
        for (boolean bit : bits) {
            builder.append(bit ? '1' : '0');
        }
        return builder.toString();
    }
}
