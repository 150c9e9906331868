package com.pgwire.typecodec.codec;

import com.pgwire.postgresprotocol.exception.MessageDecodingException;

/**
 * Position within an array or record literal.
 */
class LiteralCursor {
    private static final char END = '\0';

    final String text;
    int position;

    LiteralCursor(String text) {
        this.text = text;
    }

    boolean atEnd() {
        return position >= text.length();
    }

    char peek() {
        return atEnd() ? END : text.charAt(position);
    }

    char next() {
        if (atEnd()) {
            throw error("Unexpected end of literal");
        }
        return text.charAt(position++);
    }

    void expect(char expected) {
        if (next() != expected) {
            position--;
            throw error("Expected '" + expected + "'");
        }
    }

    void skipWhitespace() {
        while (!atEnd() && Character.isWhitespace(text.charAt(position))) {
            position++;
        }
    }

    /**
     * Reads a double-quoted element. Backslash escapes the next character, a doubled quote stands for
     * one quote.
     */
    String readQuoted() {
        expect('"');
        StringBuilder builder = new StringBuilder();
        while (true) {
            char c = next();
            if (c == '\\') {
                builder.append(next());
            } else if (c == '"') {
                if (peek() == '"') {
                    builder.append('"');
                    position++;
                } else {
                    return builder.toString();
                }
            } else {
                builder.append(c);
            }
        }
    }

    String readUntil(char first, char second) {
        int start = position;
        while (!atEnd()) {
            char c = text.charAt(position);
            if (c == first || c == second) {
                break;
            }
            position++;
        }
        return text.substring(start, position);
    }

    MessageDecodingException error(String message) {
        return new MessageDecodingException(message + " at position " + position + " of literal '" + text + "'.");
    }
}
