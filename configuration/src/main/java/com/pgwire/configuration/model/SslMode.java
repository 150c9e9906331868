package com.pgwire.configuration.model;

public enum SslMode {
    DISABLE,
    // try SSL, fall back to plain text when the server declines
    PREFER,
    REQUIRE
}
