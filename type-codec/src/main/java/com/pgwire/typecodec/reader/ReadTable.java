package com.pgwire.typecodec.reader;

import com.pgwire.postgresprotocol.constant.PostgresProtocolGeneralConstants;
import com.pgwire.postgresprotocol.exception.UnknownTypeOidException;
import com.pgwire.postgresprotocol.utils.DecoderUtils;
import com.pgwire.typecodec.codec.DefaultTypeReaders;
import com.pgwire.typecodec.constant.PgTypeOids;
import com.pgwire.typecodec.datetime.JavaTimeValueFactory;
import com.pgwire.typecodec.datetime.TemporalValueFactory;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable mapping from type OID to {@link TypeReader}. A table without an entry for an OID asks its
 * parent. Overrides never modify an existing table, they create a child table instead:
 * <pre>
 * ReadTable custom = ReadTable.installed().withBinaryReader(PgTypeOids.RECORD, myDecoder);
 * </pre>
 * The process-wide table used by new connections changes only through {@link #install(ReadTable)}.
 */
@Slf4j
public final class ReadTable {

    private static volatile ReadTable installedTable;

    private final ReadTable parent;
    private final Map<Integer, TypeReader> readers;
    private final TemporalValueFactory temporalValueFactory;

    private ReadTable(ReadTable parent, Map<Integer, TypeReader> readers, TemporalValueFactory temporalValueFactory) {
        this.parent = parent;
        this.readers = Collections.unmodifiableMap(new HashMap<>(readers));
        this.temporalValueFactory = temporalValueFactory;
    }

    /**
     * @return built-in table, never affected by {@link #install(ReadTable)}
     */
    public static ReadTable defaultTable() {
        return DefaultTableHolder.DEFAULT;
    }

    public static ReadTable installed() {
        ReadTable table = installedTable;
        return table == null ? defaultTable() : table;
    }

    public static void install(ReadTable table) {
        Objects.requireNonNull(table, "table");
        installedTable = table;
        log.debug("Installed new process-wide read table.");
    }

    public static void resetInstalled() {
        installedTable = null;
    }

    /**
     * @return empty child table behaving exactly like this one
     */
    public ReadTable copy() {
        return new ReadTable(this, Collections.emptyMap(), null);
    }

    /**
     * Replaces the entry of {@code oid} with a binary-only reader. Text-format values of this OID
     * decode to the raw string in the returned table.
     */
    public ReadTable withBinaryReader(int oid, BinaryValueDecoder decoder) {
        return withReader(oid, TypeReader.binaryOnly(decoder));
    }

    /**
     * Replaces the entry of {@code oid} with a text-only reader. Result columns of this OID are
     * requested in text format from then on.
     */
    public ReadTable withTextReader(int oid, TextValueDecoder decoder) {
        return withReader(oid, TypeReader.textOnly(decoder));
    }

    public ReadTable withReader(int oid, TypeReader reader) {
        Objects.requireNonNull(reader, "reader");
        return new ReadTable(this, Map.of(oid, reader), null);
    }

    public ReadTable withTemporalValueFactory(TemporalValueFactory factory) {
        Objects.requireNonNull(factory, "factory");
        return new ReadTable(this, Collections.emptyMap(), factory);
    }

    public TypeReader find(int oid) {
        for (ReadTable table = this; table != null; table = table.parent) {
            TypeReader reader = table.readers.get(oid);
            if (reader != null) {
                return reader;
            }
        }
        return null;
    }

    public TemporalValueFactory getTemporalValueFactory() {
        for (ReadTable table = this; table != null; table = table.parent) {
            if (table.temporalValueFactory != null) {
                return table.temporalValueFactory;
            }
        }
        return JavaTimeValueFactory.INSTANCE;
    }

    /**
     * True when values of this OID are to be requested in binary format. An array qualifies only if
     * its element type does too.
     */
    public boolean decodesBinary(int oid) {
        TypeReader reader = find(oid);
        if (reader == null || !reader.hasBinaryDecoder()) {
            return false;
        }
        Integer elementOid = PgTypeOids.getArrayElementOid(oid);
        return elementOid == null || decodesBinary(elementOid);
    }

    public Object decodeBinary(int oid, ByteBuf value) {
        TypeReader reader = find(oid);
        if (reader == null) {
            throw new UnknownTypeOidException(oid, "No reader registered for type OID " + oid + ".");
        }
        if (!reader.hasBinaryDecoder()) {
            throw new UnknownTypeOidException(oid, "Reader of type OID " + oid + " cannot decode binary values.");
        }
        return reader.getBinaryDecoder().decode(value, this);
    }

    /**
     * Decodes a text-format value. Without a text decoder for {@code oid} the text itself is returned.
     */
    public Object decodeText(int oid, String text) {
        TypeReader reader = find(oid);
        if (reader == null || !reader.hasTextDecoder()) {
            return text;
        }
        return reader.getTextDecoder().decode(text, this);
    }

    /**
     * Decodes one column value as received in a DataRow.
     *
     * @param value raw bytes, null for SQL NULL
     */
    public Object decode(int oid, short formatCode, byte[] value) {
        if (value == null) {
            return null;
        }
        ByteBuf buf = Unpooled.wrappedBuffer(value);
        if (formatCode == PostgresProtocolGeneralConstants.BINARY_FORMAT_CODE) {
            return decodeBinary(oid, buf);
        }
        return decodeText(oid, DecoderUtils.readStrictUtf8(buf, value.length));
    }

    private static class DefaultTableHolder {
        private static final ReadTable DEFAULT = new ReadTable(null, DefaultTypeReaders.create(), JavaTimeValueFactory.INSTANCE);
    }
}
