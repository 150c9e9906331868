package com.pgwire.typecodec.constant;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * OIDs of built-in types, as listed in {@code pg_type.dat}.
 */
public class PgTypeOids {
    public static final int UNSPECIFIED = 0;

    public static final int BOOL = 16;
    public static final int BYTEA = 17;
    public static final int CHAR = 18;
    public static final int NAME = 19;
    public static final int INT8 = 20;
    public static final int INT2 = 21;
    public static final int INT4 = 23;
    public static final int TEXT = 25;
    public static final int OID = 26;
    public static final int JSON = 114;
    public static final int XML = 142;
    public static final int POINT = 600;
    public static final int FLOAT4 = 700;
    public static final int FLOAT8 = 701;
    public static final int UNKNOWN = 705;
    public static final int BPCHAR = 1042;
    public static final int VARCHAR = 1043;
    public static final int DATE = 1082;
    public static final int TIME = 1083;
    public static final int TIMESTAMP = 1114;
    public static final int TIMESTAMPTZ = 1184;
    public static final int INTERVAL = 1186;
    public static final int TIMETZ = 1266;
    public static final int BIT = 1560;
    public static final int VARBIT = 1562;
    public static final int NUMERIC = 1700;
    public static final int RECORD = 2249;
    public static final int UUID = 2950;
    public static final int JSONB = 3802;

    public static final int BOOL_ARRAY = 1000;
    public static final int BYTEA_ARRAY = 1001;
    public static final int CHAR_ARRAY = 1002;
    public static final int NAME_ARRAY = 1003;
    public static final int INT2_ARRAY = 1005;
    public static final int INT4_ARRAY = 1007;
    public static final int TEXT_ARRAY = 1009;
    public static final int BPCHAR_ARRAY = 1014;
    public static final int VARCHAR_ARRAY = 1015;
    public static final int INT8_ARRAY = 1016;
    public static final int POINT_ARRAY = 1017;
    public static final int FLOAT4_ARRAY = 1021;
    public static final int FLOAT8_ARRAY = 1022;
    public static final int OID_ARRAY = 1028;
    public static final int TIMESTAMP_ARRAY = 1115;
    public static final int DATE_ARRAY = 1182;
    public static final int TIME_ARRAY = 1183;
    public static final int TIMESTAMPTZ_ARRAY = 1185;
    public static final int INTERVAL_ARRAY = 1187;
    public static final int NUMERIC_ARRAY = 1231;
    public static final int TIMETZ_ARRAY = 1270;
    public static final int BIT_ARRAY = 1561;
    public static final int VARBIT_ARRAY = 1563;
    public static final int JSON_ARRAY = 199;
    public static final int XML_ARRAY = 143;
    public static final int RECORD_ARRAY = 2287;
    public static final int UUID_ARRAY = 2951;
    public static final int JSONB_ARRAY = 3807;

    private static final Map<Integer, Integer> ARRAY_ELEMENT_OIDS;

    static {
        Map<Integer, Integer> map = new HashMap<>();
        map.put(BOOL_ARRAY, BOOL);
        map.put(BYTEA_ARRAY, BYTEA);
        map.put(CHAR_ARRAY, CHAR);
        map.put(NAME_ARRAY, NAME);
        map.put(INT2_ARRAY, INT2);
        map.put(INT4_ARRAY, INT4);
        map.put(TEXT_ARRAY, TEXT);
        map.put(BPCHAR_ARRAY, BPCHAR);
        map.put(VARCHAR_ARRAY, VARCHAR);
        map.put(INT8_ARRAY, INT8);
        map.put(POINT_ARRAY, POINT);
        map.put(FLOAT4_ARRAY, FLOAT4);
        map.put(FLOAT8_ARRAY, FLOAT8);
        map.put(OID_ARRAY, OID);
        map.put(TIMESTAMP_ARRAY, TIMESTAMP);
        map.put(DATE_ARRAY, DATE);
        map.put(TIME_ARRAY, TIME);
        map.put(TIMESTAMPTZ_ARRAY, TIMESTAMPTZ);
        map.put(INTERVAL_ARRAY, INTERVAL);
        map.put(NUMERIC_ARRAY, NUMERIC);
        map.put(TIMETZ_ARRAY, TIMETZ);
        map.put(BIT_ARRAY, BIT);
        map.put(VARBIT_ARRAY, VARBIT);
        map.put(JSON_ARRAY, JSON);
        map.put(XML_ARRAY, XML);
        map.put(RECORD_ARRAY, RECORD);
        map.put(UUID_ARRAY, UUID);
        map.put(JSONB_ARRAY, JSONB);
        ARRAY_ELEMENT_OIDS = Collections.unmodifiableMap(map);
    }

    /**
     * @return element type OID of a built-in array type, null for any other OID
     */
    public static Integer getArrayElementOid(int arrayOid) {
        return ARRAY_ELEMENT_OIDS.get(arrayOid);
    }

    public static Map<Integer, Integer> getArrayElementOids() {
        return ARRAY_ELEMENT_OIDS;
    }

    private PgTypeOids() {
    }
}
