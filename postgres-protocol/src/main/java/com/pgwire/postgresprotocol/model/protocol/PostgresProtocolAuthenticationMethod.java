package com.pgwire.postgresprotocol.model.protocol;

import lombok.Getter;

public enum PostgresProtocolAuthenticationMethod {
    OK(0),
    KERBEROS_V5(2),
    PLAIN_TEXT(3),
    MD5(5),
    SCM_CREDENTIAL(6),
    GSS(7),
    GSS_CONTINUE(8),
    SSPI(9),
    SASL(10),
    SASL_CONTINUE(11),
    SASL_FINAL(12);

    @Getter
    private final int protocolMethodMarker;

    PostgresProtocolAuthenticationMethod(int protocolMethodMarker) {
        this.protocolMethodMarker = protocolMethodMarker;
    }

    public static PostgresProtocolAuthenticationMethod fromMarker(int marker) {
        for (PostgresProtocolAuthenticationMethod method : values()) {
            if (method.protocolMethodMarker == marker) {
                return method;
            }
        }
        return null;
    }
}
