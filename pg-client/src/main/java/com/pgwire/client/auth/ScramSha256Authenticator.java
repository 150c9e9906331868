package com.pgwire.client.auth;

import com.pgwire.postgresprotocol.constant.PostgresProtocolScramConstants;
import com.pgwire.postgresprotocol.exception.PgConnectionInitializationException;
import com.pgwire.postgresprotocol.model.protocol.SaslInitialResponse;
import com.pgwire.postgresprotocol.model.protocol.SaslResponse;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.UUID;
import java.util.regex.Matcher;

/**
 * Client side of a SCRAM-SHA-256 exchange (RFC 5802 / RFC 7677) without channel binding.
 * Usage: {@link #createInitialResponse()}, then {@link #createFinalResponse(String)} for the server-first
 * message, then {@link #verifyServerFinalMessage(String)}.
 */
@Slf4j
public class ScramSha256Authenticator {

    private enum SaslAuthStatus {
        NOT_STARTED,
        FIRST_CLIENT_MESSAGE_SENT,
        LAST_CLIENT_MESSAGE_SENT,
        COMPLETED
    }

    private final String password;
    private final String clientNonce;
    private String clientFirstMessageBare;
    private byte[] expectedServerSignature;

    private SaslAuthStatus authStatus = SaslAuthStatus.NOT_STARTED;

    public ScramSha256Authenticator(String password) {
        this(password, UUID.randomUUID().toString());
    }

    public ScramSha256Authenticator(String password, String clientNonce) {
        this.password = password;
        this.clientNonce = clientNonce;
    }

    public SaslInitialResponse createInitialResponse() {
        checkStatus(SaslAuthStatus.NOT_STARTED);
        // user name is taken from the startup message by the server
        clientFirstMessageBare = "n=*,r=" + clientNonce;
        authStatus = SaslAuthStatus.FIRST_CLIENT_MESSAGE_SENT;

        return new SaslInitialResponse(
                PostgresProtocolScramConstants.SCRAM_SHA_256_MECHANISM_NAME,
                PostgresProtocolScramConstants.GS2_HEADER + clientFirstMessageBare
        );
    }

    public SaslResponse createFinalResponse(String serverFirstMessage) {
        checkStatus(SaslAuthStatus.FIRST_CLIENT_MESSAGE_SENT);

        Matcher serverFirstMessageMatcher = PostgresProtocolScramConstants.SERVER_FIRST_MESSAGE_PATTERN.matcher(serverFirstMessage);
        if (!serverFirstMessageMatcher.matches()) {
            throw new PgConnectionInitializationException("Malformed SCRAM server-first-message.");
        }

        String serverNonce = serverFirstMessageMatcher.group(PostgresProtocolScramConstants.SERVER_FIRST_MESSAGE_SERVER_NONCE_MATCHER_GROUP);
        if (!serverNonce.startsWith(clientNonce)) {
            throw new PgConnectionInitializationException("SCRAM server nonce does not start with the client nonce.");
        }
        byte[] salt = Base64.getDecoder().decode(serverFirstMessageMatcher.group(PostgresProtocolScramConstants.SERVER_FIRST_MESSAGE_SALT_MATCHER_GROUP));
        int iterations = Integer.parseInt(serverFirstMessageMatcher.group(PostgresProtocolScramConstants.SERVER_FIRST_MESSAGE_ITERATION_COUNT_MATCHER_GROUP));

        String g2HeaderEncoded = Base64.getEncoder().encodeToString(PostgresProtocolScramConstants.GS2_HEADER.getBytes(StandardCharsets.US_ASCII));
        String clientFinalMessageWithoutProof = "c=" + g2HeaderEncoded + ",r=" + serverNonce;
        String authMessage = clientFirstMessageBare + "," + serverFirstMessage + "," + clientFinalMessageWithoutProof;

        byte[] clientProof;
        try {
            byte[] saltedPassword = ScramUtils.generateSaltedPassword(password, salt, iterations, PostgresProtocolScramConstants.SHA256_HMAC_NAME);
            byte[] clientKey = ScramUtils.computeHmac(saltedPassword, PostgresProtocolScramConstants.SHA256_HMAC_NAME, PostgresProtocolScramConstants.CLIENT_KEY);
            byte[] storedKey = ScramUtils.computeDigest(clientKey, PostgresProtocolScramConstants.SHA256_DIGEST_NAME);
            byte[] clientSignature = ScramUtils.computeHmac(storedKey, PostgresProtocolScramConstants.SHA256_HMAC_NAME, authMessage);

            clientProof = clientKey.clone();
            for (int i = 0; i < clientProof.length; i++) {
                clientProof[i] ^= clientSignature[i];
            }

            byte[] serverKey = ScramUtils.computeHmac(saltedPassword, PostgresProtocolScramConstants.SHA256_HMAC_NAME, PostgresProtocolScramConstants.SERVER_KEY);
            expectedServerSignature = ScramUtils.computeHmac(serverKey, PostgresProtocolScramConstants.SHA256_HMAC_NAME, authMessage);
        } catch (GeneralSecurityException e) {
            throw new PgConnectionInitializationException("Failed to compute SCRAM client proof.", e);
        }

        authStatus = SaslAuthStatus.LAST_CLIENT_MESSAGE_SENT;
        return new SaslResponse(clientFinalMessageWithoutProof + ",p=" + Base64.getEncoder().encodeToString(clientProof));
    }

    /**
     * @throws PgConnectionInitializationException when the server reports an error or proves a different password
     */
    public void verifyServerFinalMessage(String serverFinalMessage) {
        checkStatus(SaslAuthStatus.LAST_CLIENT_MESSAGE_SENT);

        Matcher matcher = PostgresProtocolScramConstants.SERVER_FINAL_MESSAGE_PATTERN.matcher(serverFinalMessage);
        if (!matcher.matches()) {
            throw new PgConnectionInitializationException("Malformed SCRAM server-final-message.");
        }
        String error = matcher.group(PostgresProtocolScramConstants.SERVER_FINAL_MESSAGE_ERROR_MATCHER_GROUP);
        if (error != null) {
            throw new PgConnectionInitializationException("SCRAM authentication failed with server error '" + error + "'.");
        }

        byte[] serverSignature = Base64.getDecoder().decode(matcher.group(PostgresProtocolScramConstants.SERVER_FINAL_MESSAGE_VERIFIER_MATCHER_GROUP));
        if (!MessageDigest.isEqual(serverSignature, expectedServerSignature)) {
            throw new PgConnectionInitializationException("SCRAM server signature does not match. The server does not know the password.");
        }

        authStatus = SaslAuthStatus.COMPLETED;
        log.debug("SCRAM-SHA-256 server signature verified.");
    }

    private void checkStatus(SaslAuthStatus expected) {
        if (authStatus != expected) {
            throw new PgConnectionInitializationException("Unexpected SCRAM message in state " + authStatus + ".");
        }
    }
}
