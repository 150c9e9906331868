package com.pgwire.client.auth;

import com.pgwire.postgresprotocol.exception.PgConnectionInitializationException;
import io.netty.buffer.ByteBufUtil;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public class Md5PasswordUtils {
    private static final String MD5_PREFIX = "md5";

    /**
     * @return {@code "md5" + md5hex(md5hex(password + user) + salt)}
     */
    public static String encodePassword(String user, String password, byte[] salt) {
        try {
            String inner = md5Hex((password + user).getBytes(StandardCharsets.UTF_8));
            return MD5_PREFIX + md5Hex(concat(inner.getBytes(StandardCharsets.US_ASCII), salt));
        } catch (NoSuchAlgorithmException e) {
            throw new PgConnectionInitializationException("MD5 is not available in this JVM.", e);
        }
    }

    private static String md5Hex(byte[] data) throws NoSuchAlgorithmException {
        return ByteBufUtil.hexDump(MessageDigest.getInstance("MD5").digest(data));
    }

    private static byte[] concat(byte[] first, byte[] second) {
        byte[] ret = new byte[first.length + second.length];
        System.arraycopy(first, 0, ret, 0, first.length);
        System.arraycopy(second, 0, ret, first.length, second.length);
        return ret;
    }

    private Md5PasswordUtils() {
    }
}
