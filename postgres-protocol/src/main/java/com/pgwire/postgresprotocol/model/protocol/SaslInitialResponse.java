package com.pgwire.postgresprotocol.model.protocol;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * SASLInitialResponse: the chosen mechanism and the client-first-message, GS2 header included.
 */
@Getter
@AllArgsConstructor
public class SaslInitialResponse {
    private final String mechanism;
    private final String clientFirstMessage;
}
