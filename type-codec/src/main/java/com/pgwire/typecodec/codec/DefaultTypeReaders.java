package com.pgwire.typecodec.codec;

import com.pgwire.typecodec.constant.PgTypeOids;
import com.pgwire.typecodec.reader.TypeReader;

import java.util.HashMap;
import java.util.Map;

/**
 * Readers of the built-in table. Every array type listed in {@link PgTypeOids} gets the generic array
 * reader of its element type.
 */
public class DefaultTypeReaders {

    public static Map<Integer, TypeReader> create() {
        Map<Integer, TypeReader> readers = new HashMap<>();

        readers.put(PgTypeOids.BOOL, TypeReader.of(PgScalarCodecs::decodeBool, PgScalarCodecs::parseBool));
        readers.put(PgTypeOids.BYTEA, TypeReader.of(PgScalarCodecs::decodeBytea, PgScalarCodecs::parseBytea));
        readers.put(PgTypeOids.INT2, TypeReader.of(PgScalarCodecs::decodeInt2, PgScalarCodecs::parseInt2));
        readers.put(PgTypeOids.INT4, TypeReader.of(PgScalarCodecs::decodeInt4, PgScalarCodecs::parseInt4));
        readers.put(PgTypeOids.INT8, TypeReader.of(PgScalarCodecs::decodeInt8, PgScalarCodecs::parseInt8));
        readers.put(PgTypeOids.OID, TypeReader.of(PgScalarCodecs::decodeOid, PgScalarCodecs::parseOid));
        readers.put(PgTypeOids.FLOAT4, TypeReader.of(PgScalarCodecs::decodeFloat4, PgScalarCodecs::parseFloat4));
        readers.put(PgTypeOids.FLOAT8, TypeReader.of(PgScalarCodecs::decodeFloat8, PgScalarCodecs::parseFloat8));
        readers.put(PgTypeOids.NUMERIC, TypeReader.of(PgNumericCodec::decode, PgNumericCodec::parse));
        readers.put(PgTypeOids.UUID, TypeReader.of(PgScalarCodecs::decodeUuid, PgScalarCodecs::parseUuid));
        readers.put(PgTypeOids.POINT, TypeReader.of(PgScalarCodecs::decodePoint, PgScalarCodecs::parsePoint));
        readers.put(PgTypeOids.BIT, TypeReader.of(PgBitStringCodec::decode, PgBitStringCodec::parse));
        readers.put(PgTypeOids.VARBIT, TypeReader.of(PgBitStringCodec::decode, PgBitStringCodec::parse));

        TypeReader stringReader = TypeReader.of(PgScalarCodecs::decodeString, PgScalarCodecs::parseString);
        readers.put(PgTypeOids.CHAR, stringReader);
        readers.put(PgTypeOids.NAME, stringReader);
        readers.put(PgTypeOids.TEXT, stringReader);
        readers.put(PgTypeOids.JSON, stringReader);
        readers.put(PgTypeOids.XML, stringReader);
        readers.put(PgTypeOids.UNKNOWN, stringReader);
        readers.put(PgTypeOids.BPCHAR, stringReader);
        readers.put(PgTypeOids.VARCHAR, stringReader);
        readers.put(PgTypeOids.JSONB, TypeReader.of(PgScalarCodecs::decodeJsonb, PgScalarCodecs::parseString));

        readers.put(PgTypeOids.DATE, TypeReader.of(PgDateTimeCodec::decodeDate, PgDateTimeCodec::parseDate));
        readers.put(PgTypeOids.TIME, TypeReader.of(PgDateTimeCodec::decodeTime, PgDateTimeCodec::parseTime));
        readers.put(PgTypeOids.TIMETZ, TypeReader.of(PgDateTimeCodec::decodeTimeTz, PgDateTimeCodec::parseTimeTz));
        readers.put(PgTypeOids.TIMESTAMP, TypeReader.of(PgDateTimeCodec::decodeTimestamp, PgDateTimeCodec::parseTimestamp));
        readers.put(PgTypeOids.TIMESTAMPTZ, TypeReader.of(PgDateTimeCodec::decodeTimestampTz, PgDateTimeCodec::parseTimestampTz));
        readers.put(PgTypeOids.INTERVAL, TypeReader.of(PgDateTimeCodec::decodeInterval, PgDateTimeCodec::parseInterval));

        readers.put(PgTypeOids.RECORD, TypeReader.of(PgCompositeCodec::decode, PgCompositeCodec::parse));

        PgTypeOids.getArrayElementOids().forEach((arrayOid, elementOid) ->
                readers.put(arrayOid, TypeReader.of(PgArrayCodec::decode, PgArrayCodec.textDecoder(elementOid)))
        );

        return readers;
    }

    private DefaultTypeReaders() {
    }
}
