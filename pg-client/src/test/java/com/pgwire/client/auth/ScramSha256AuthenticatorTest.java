package com.pgwire.client.auth;

import com.pgwire.postgresprotocol.exception.PgConnectionInitializationException;
import com.pgwire.postgresprotocol.model.protocol.SaslInitialResponse;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScramSha256AuthenticatorTest {
    private static final String CLIENT_NONCE = "rOprNGfwEbeRWgbNEkqO";
    private static final String SERVER_FIRST = "r=rOprNGfwEbeRWgbNEkqO%hvYDpWUa2RaTCAfuxFIlj)hNlF$k0,s=W22ZaJ0SNY7soEsUEjb6gQ==,i=4096";

    @Test
    void fullExchangeWithKnownNonce() {
        ScramSha256Authenticator authenticator = new ScramSha256Authenticator("pencil", CLIENT_NONCE);

        SaslInitialResponse initial = authenticator.createInitialResponse();
        assertThat(initial.getMechanism()).isEqualTo("SCRAM-SHA-256");
        assertThat(initial.getClientFirstMessage()).isEqualTo("n,,n=*,r=" + CLIENT_NONCE);

        assertThat(authenticator.createFinalResponse(SERVER_FIRST).getClientFinalMessage())
                .isEqualTo("c=biws,r=rOprNGfwEbeRWgbNEkqO%hvYDpWUa2RaTCAfuxFIlj)hNlF$k0,p=3M3hagGCCg+02mpnZ9fgyMWejs8yYlqFo7tFZyBIV5g=");

        authenticator.verifyServerFinalMessage("v=jBUU2ZmyQ4x+QJe05Kx6JFwPHDsiK3tfmR51qZfjEOY=");
    }

    @Test
    void wrongServerSignatureIsRejected() {
        ScramSha256Authenticator authenticator = new ScramSha256Authenticator("pencil", CLIENT_NONCE);
        authenticator.createInitialResponse();
        authenticator.createFinalResponse(SERVER_FIRST);

        assertThatThrownBy(() -> authenticator.verifyServerFinalMessage("v=AAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAA="))
                .isInstanceOf(PgConnectionInitializationException.class)
                .hasMessageContaining("signature");
    }

    @Test
    void serverErrorInFinalMessageIsReported() {
        ScramSha256Authenticator authenticator = new ScramSha256Authenticator("pencil", CLIENT_NONCE);
        authenticator.createInitialResponse();
        authenticator.createFinalResponse(SERVER_FIRST);

        assertThatThrownBy(() -> authenticator.verifyServerFinalMessage("e=invalid-proof"))
                .isInstanceOf(PgConnectionInitializationException.class)
                .hasMessageContaining("invalid-proof");
    }

    @Test
    void serverNonceMustExtendClientNonce() {
        ScramSha256Authenticator authenticator = new ScramSha256Authenticator("pencil", CLIENT_NONCE);
        authenticator.createInitialResponse();

        assertThatThrownBy(() -> authenticator.createFinalResponse("r=somethingElse,s=W22ZaJ0SNY7soEsUEjb6gQ==,i=4096"))
                .isInstanceOf(PgConnectionInitializationException.class);
    }

    @Test
    void messagesOutOfOrderAreRejected() {
        ScramSha256Authenticator authenticator = new ScramSha256Authenticator("pencil", CLIENT_NONCE);

        assertThatThrownBy(() -> authenticator.createFinalResponse(SERVER_FIRST))
                .isInstanceOf(PgConnectionInitializationException.class);
    }
}
