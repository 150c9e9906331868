package com.pgwire.postgresprotocol.model.protocol;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuthenticationRequestMessage {
    /**
     * Null when the server asked for a subtype this client does not know.
     */
    private PostgresProtocolAuthenticationMethod method;
    private int methodMarker;
    // salt for MD5, mechanism list for SASL, challenge data for SASL continue/final
    private byte[] specificData;
}
