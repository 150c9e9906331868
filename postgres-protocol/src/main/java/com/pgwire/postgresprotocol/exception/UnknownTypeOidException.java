package com.pgwire.postgresprotocol.exception;

import lombok.Getter;

@Getter
public class UnknownTypeOidException extends PgClientException {
    private final int typeOid;

    public UnknownTypeOidException(int typeOid, String message) {
        super(message);
        this.typeOid = typeOid;
    }
}
