package com.pgwire.client.startup;

import com.pgwire.client.auth.Md5PasswordUtils;
import com.pgwire.client.auth.ScramSha256Authenticator;
import com.pgwire.client.connection.PgSession;
import com.pgwire.client.model.PgConnectionSettings;
import com.pgwire.client.model.StartupState;
import com.pgwire.postgresprotocol.constant.PostgresProtocolGeneralConstants;
import com.pgwire.postgresprotocol.constant.PostgresProtocolScramConstants;
import com.pgwire.postgresprotocol.decoder.ServerPostgresProtocolMessageDecoder;
import com.pgwire.postgresprotocol.encoder.ClientPostgresProtocolMessageEncoder;
import com.pgwire.postgresprotocol.error.PgServerException;
import com.pgwire.postgresprotocol.exception.PgConnectionInitializationException;
import com.pgwire.postgresprotocol.exception.UnsupportedAuthenticationMethodException;
import com.pgwire.postgresprotocol.model.internal.PgMessageInfo;
import com.pgwire.postgresprotocol.model.protocol.AuthenticationRequestMessage;
import com.pgwire.postgresprotocol.model.protocol.StartupMessage;
import com.pgwire.postgresprotocol.stream.PgMessageStream;
import com.pgwire.postgresprotocol.utils.PostgresErrorMessageUtils;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.MapUtils;
import org.apache.commons.lang3.StringUtils;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the startup phase of a connection: StartupMessage, authentication and the backend parameter
 * messages up to the first ReadyForQuery.
 */
@Slf4j
public class PgStartupSequencer {

    private final PgConnectionSettings settings;
    private final PgSession session;
    private final PgMessageStream stream;

    @Getter
    private StartupState state = StartupState.CONNECTING;
    private ScramSha256Authenticator scramAuthenticator;

    public PgStartupSequencer(PgConnectionSettings settings, PgSession session) {
        this.settings = settings;
        this.session = session;
        this.stream = session.getStream();
    }

    /**
     * Blocks until the connection is ready for queries. On failure the stream is closed.
     */
    public void run() {
        try {
            sendStartupMessage();
            awaitReadyForQuery();
        } catch (RuntimeException e) {
            state = StartupState.FAILED;
            stream.markFailed(e);
            throw e;
        }
    }

    public Map<String, String> createStartupParameters() {
        Map<String, String> parameters = new LinkedHashMap<>();
        parameters.put(PostgresProtocolGeneralConstants.STARTUP_PARAMETER_USER, settings.getUser());
        parameters.put(PostgresProtocolGeneralConstants.STARTUP_PARAMETER_DATABASE, settings.getDatabase());
        parameters.put(PostgresProtocolGeneralConstants.STARTUP_PARAMETER_CLIENT_ENCODING, PostgresProtocolGeneralConstants.CLIENT_ENCODING_UTF8);
        parameters.put(PostgresProtocolGeneralConstants.STARTUP_PARAMETER_DATE_STYLE, PostgresProtocolGeneralConstants.DATE_STYLE_ISO);
        if (StringUtils.isNotEmpty(settings.getApplicationName())) {
            parameters.put(PostgresProtocolGeneralConstants.STARTUP_PARAMETER_APPLICATION_NAME, settings.getApplicationName());
        }
        if (MapUtils.isNotEmpty(settings.getStartupParameters())) {
            parameters.putAll(settings.getStartupParameters());
        }
        return parameters;
    }

    private void sendStartupMessage() {
        StartupMessage startupMessage = StartupMessage.forProtocolVersion3(createStartupParameters());

        stream.writeAndFlush(ClientPostgresProtocolMessageEncoder.encodeClientStartupMessage(startupMessage, stream.alloc()));
        state = StartupState.STARTUP_SENT;
    }

    private void awaitReadyForQuery() {
        while (true) {
            PgMessageInfo message = session.receive();
            try {
                switch (message.getStartByte()) {
                    case PostgresProtocolGeneralConstants.AUTH_REQUEST_START_CHAR -> handleAuthRequest(message);
                    case PostgresProtocolGeneralConstants.BACKEND_KEY_DATA_START_CHAR ->
                            session.setBackendKeyData(ServerPostgresProtocolMessageDecoder.decodeBackendKeyData(message));
                    case PostgresProtocolGeneralConstants.NEGOTIATE_PROTOCOL_VERSION_START_CHAR ->
                            log.info("Server does not support some requested protocol options; continuing with protocol 3.0.");
                    case PostgresProtocolGeneralConstants.ERROR_MESSAGE_START_CHAR -> {
                        PgServerException exception = session.classifyError(message);
                        log.error("Failed to initiate new Postgres connection due to error response from server. Error from server: {}",
                                PostgresErrorMessageUtils.getLoggableErrorMessageFromErrorResponse(exception.getErrorResponse()));
                        throw exception;
                    }
                    case PostgresProtocolGeneralConstants.READY_FOR_QUERY_MESSAGE_START_CHAR -> {
                        session.onReadyForQuery(message);
                        state = StartupState.READY_FOR_QUERY;
                        log.debug("Postgres connection is ready for queries.");
                        return;
                    }
                    default -> throw new PgConnectionInitializationException(
                            "Received unexpected message '" + (char) message.getStartByte() + "' during connection startup in state " + state + "."
                    );
                }
            } finally {
                message.release();
            }
        }
    }

    private void handleAuthRequest(PgMessageInfo message) {
        AuthenticationRequestMessage request = ServerPostgresProtocolMessageDecoder.decodeAuthRequestMessage(message);
        if (request.getMethod() == null) {
            throw new UnsupportedAuthenticationMethodException("Server requested unknown authentication method " + request.getMethodMarker() + ".");
        }

        switch (request.getMethod()) {
            case OK -> {
                state = StartupState.BACKEND_PARAMS_WAIT;
                log.debug("Authenticated as '{}'.", settings.getUser());
            }
            case PLAIN_TEXT -> {
                state = StartupState.AUTHENTICATING;
                stream.writeAndFlush(ClientPostgresProtocolMessageEncoder.encodePasswordMessage(requirePassword(), stream.alloc()));
            }
            case MD5 -> {
                state = StartupState.AUTHENTICATING;
                String encoded = Md5PasswordUtils.encodePassword(settings.getUser(), requirePassword(), request.getSpecificData());
                stream.writeAndFlush(ClientPostgresProtocolMessageEncoder.encodePasswordMessage(encoded, stream.alloc()));
            }
            case SASL -> {
                state = StartupState.AUTHENTICATING;
                List<String> mechanisms = parseMechanisms(request.getSpecificData());
                if (!mechanisms.contains(PostgresProtocolScramConstants.SCRAM_SHA_256_MECHANISM_NAME)) {
                    throw new UnsupportedAuthenticationMethodException("Server offered no supported SASL mechanism: " + mechanisms + ".");
                }
                scramAuthenticator = new ScramSha256Authenticator(requirePassword());
                stream.writeAndFlush(ClientPostgresProtocolMessageEncoder.encodeSaslInitialResponseMessage(scramAuthenticator.createInitialResponse(), stream.alloc()));
            }
            case SASL_CONTINUE -> {
                String serverFirstMessage = new String(request.getSpecificData(), StandardCharsets.UTF_8);
                stream.writeAndFlush(ClientPostgresProtocolMessageEncoder.encodeSaslResponseMessage(requireScram().createFinalResponse(serverFirstMessage), stream.alloc()));
            }
            case SASL_FINAL -> requireScram().verifyServerFinalMessage(new String(request.getSpecificData(), StandardCharsets.UTF_8));
            default -> throw new UnsupportedAuthenticationMethodException("Authentication method " + request.getMethod() + " is not supported.");
        }
    }

    private String requirePassword() {
        if (settings.getPassword() == null) {
            throw new PgConnectionInitializationException("Server requested password authentication but no password is configured.");
        }
        return settings.getPassword();
    }

    private ScramSha256Authenticator requireScram() {
        if (scramAuthenticator == null) {
            throw new PgConnectionInitializationException("Received SASL challenge before SASL authentication was started.");
        }
        return scramAuthenticator;
    }

    private static List<String> parseMechanisms(byte[] data) {
        List<String> ret = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < data.length; i++) {
            if (data[i] == PostgresProtocolGeneralConstants.DELIMITER_BYTE) {
                if (i > start) {
                    ret.add(new String(data, start, i - start, StandardCharsets.UTF_8));
                }
                start = i + 1;
            }
        }
        return ret;
    }
}
