package com.pgwire.typecodec.reader;

@FunctionalInterface
public interface TextValueDecoder {
    Object decode(String text, ReadTable readTable);
}
