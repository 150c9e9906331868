package com.pgwire.client.listener;

import com.pgwire.postgresprotocol.model.protocol.ErrorResponse;

@FunctionalInterface
public interface PgNoticeListener {
    void onNotice(ErrorResponse notice);
}
