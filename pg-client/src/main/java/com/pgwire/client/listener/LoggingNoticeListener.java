package com.pgwire.client.listener;

import com.pgwire.postgresprotocol.model.protocol.ErrorResponse;
import com.pgwire.postgresprotocol.utils.PostgresErrorMessageUtils;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LoggingNoticeListener implements PgNoticeListener {
    public static final LoggingNoticeListener INSTANCE = new LoggingNoticeListener();

    @Override
    public void onNotice(ErrorResponse notice) {
        log.info("Notice from Postgres: {}", PostgresErrorMessageUtils.getLoggableErrorMessageFromErrorResponse(notice));
    }
}
