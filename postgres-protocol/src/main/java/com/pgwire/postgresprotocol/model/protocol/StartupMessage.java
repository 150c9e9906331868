package com.pgwire.postgresprotocol.model.protocol;

import com.pgwire.postgresprotocol.constant.PostgresProtocolGeneralConstants;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Untagged first message of a connection. Parameters are written in iteration order.
 */
@Getter
@AllArgsConstructor
public class StartupMessage {
    private final short majorVersion;
    private final short minorVersion;
    private final Map<String, String> parameters;

    public static StartupMessage forProtocolVersion3(Map<String, String> parameters) {
        return new StartupMessage(
                PostgresProtocolGeneralConstants.PROTOCOL_MAJOR_VERSION,
                PostgresProtocolGeneralConstants.PROTOCOL_MINOR_VERSION,
                Collections.unmodifiableMap(new LinkedHashMap<>(parameters))
        );
    }

    public int getProtocolVersion() {
        return (majorVersion << 16) | (minorVersion & 0xFFFF);
    }
}
