package com.pgwire.postgresprotocol.error;

import com.pgwire.postgresprotocol.decoder.ServerPostgresProtocolMessageDecoder;
import com.pgwire.postgresprotocol.model.internal.PgMessageInfo;
import com.pgwire.postgresprotocol.model.protocol.ErrorResponse;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class PgErrorClassifierTest {

    private static PgMessageInfo errorMessage(String... fields) {
        ByteBuf payload = Unpooled.buffer();
        for (String field : fields) {
            payload.writeBytes(field.getBytes(StandardCharsets.UTF_8));
            payload.writeByte(0);
        }
        payload.writeByte(0);
        return PgMessageInfo.builder().startByte((byte) 'E').payload(payload).build();
    }

    @Test
    void uniqueViolationCarriesConstraintAndTable() {
        PgMessageInfo message = errorMessage(
                "SERROR", "VERROR", "C23505",
                "Mduplicate key value violates unique constraint \"users_pkey\"",
                "DKey (id)=(1) already exists.",
                "spublic", "tusers", "nusers_pkey", "Fnbtinsert.c", "L663", "R_bt_check_unique"
        );

        PgServerException exception = PgErrorClassifier.classify(message);
        message.release();

        assertThat(exception.getCondition()).isEqualTo(PgErrorCondition.UNIQUE_VIOLATION);
        assertThat(exception.getErrorClass()).isEqualTo(PgErrorClass.INTEGRITY_CONSTRAINT_VIOLATION);
        assertThat(exception.is(PgErrorCondition.UNIQUE_VIOLATION)).isTrue();
        assertThat(exception.getSqlState()).isEqualTo("23505");
        assertThat(exception.getConstraintName()).isEqualTo("users_pkey");
        assertThat(exception.getTableName()).isEqualTo("users");
        assertThat(exception.getDetail()).isEqualTo("Key (id)=(1) already exists.");
        assertThat(exception.getErrorResponse().getSchemaName()).isEqualTo("public");
        assertThat(exception.getErrorResponse().getLine()).isEqualTo(663);
        assertThat(exception.getErrorResponse().getRoutine()).isEqualTo("_bt_check_unique");
        assertThat(exception.isFatal()).isFalse();
    }

    @Test
    void syntaxErrorKeepsPosition() {
        PgMessageInfo message = errorMessage("SERROR", "VERROR", "C42601", "Msyntax error at or near \"SELEC\"", "P1");

        PgServerException exception = PgErrorClassifier.classify(message);
        message.release();

        assertThat(exception.getCondition()).isEqualTo(PgErrorCondition.SYNTAX_ERROR);
        assertThat(exception.getErrorClass()).isEqualTo(PgErrorClass.SYNTAX_ERROR_OR_ACCESS_RULE_VIOLATION);
        assertThat(exception.getErrorResponse().getPosition()).isEqualTo(1);
    }

    @Test
    void unknownCodeInKnownClassHasNoCondition() {
        PgServerException exception = PgErrorClassifier.classify(
                ErrorResponse.builder().severity("ERROR").code("23999").message("odd").build()
        );

        assertThat(exception.findCondition()).isEmpty();
        assertThat(exception.getErrorClass()).isEqualTo(PgErrorClass.INTEGRITY_CONSTRAINT_VIOLATION);
    }

    @Test
    void unknownClassMapsToUnknown() {
        PgServerException exception = PgErrorClassifier.classify(
                ErrorResponse.builder().severity("ERROR").code("ZZ123").message("odd").build()
        );

        assertThat(exception.getErrorClass()).isEqualTo(PgErrorClass.UNKNOWN);
        assertThat(exception.getCondition()).isNull();
    }

    @Test
    void fatalSeverityIsDetectedFromNonLocalizedField() {
        PgServerException exception = PgErrorClassifier.classify(
                ErrorResponse.builder().severity("FATAL").severityNotLocalized("FATAL").code("28P01").message("password authentication failed").build()
        );

        assertThat(exception.isFatal()).isTrue();
        assertThat(exception.getErrorClass()).isEqualTo(PgErrorClass.INVALID_AUTHORIZATION_SPECIFICATION);
    }

    @Test
    void noticeUsesSameFieldLayout() {
        ByteBuf payload = Unpooled.buffer();
        payload.writeBytes("SNOTICE\0C00000\0Mtable created\0\0".getBytes(StandardCharsets.UTF_8));
        PgMessageInfo message = PgMessageInfo.builder().startByte((byte) 'N').payload(payload).build();

        ErrorResponse notice = ServerPostgresProtocolMessageDecoder.decodeNoticeResponse(message);
        message.release();

        assertThat(notice.getSeverity()).isEqualTo("NOTICE");
        assertThat(notice.getMessage()).isEqualTo("table created");
    }
}
