package com.pgwire.client.auth;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public class ScramUtils {

    private static final byte[] INT_1 = new byte[]{0, 0, 0, 1};

    public static byte[] computeHmac(final byte[] keyBytes, String hmacName, final String string) throws InvalidKeyException, NoSuchAlgorithmException {
        return computeHmac(keyBytes, hmacName, string.getBytes(StandardCharsets.UTF_8));
    }

    public static byte[] computeHmac(final byte[] keyBytes, String hmacName, final byte[] data) throws InvalidKeyException, NoSuchAlgorithmException {
        Mac mac = createHmac(keyBytes, hmacName);
        mac.update(data);
        return mac.doFinal();
    }

    /**
     * Hi() of RFC 5802: PBKDF2 with HMAC as the pseudo random function.
     */
    public static byte[] generateSaltedPassword(final String password,
                                                byte[] salt,
                                                int iterationsCount,
                                                String hmacName) throws InvalidKeyException, NoSuchAlgorithmException {
        Mac mac = createHmac(password.getBytes(StandardCharsets.UTF_8), hmacName);

        mac.update(salt);
        mac.update(INT_1);
        byte[] result = mac.doFinal();

        byte[] previous = null;
        for (int i = 1; i < iterationsCount; i++) {
            mac.update(previous != null ? previous : result);
            previous = mac.doFinal();
            for (int x = 0; x < result.length; x++) {
                result[x] ^= previous[x];
            }
        }

        return result;
    }

    public static byte[] computeDigest(final byte[] data, String digestName) throws NoSuchAlgorithmException {
        return MessageDigest.getInstance(digestName).digest(data);
    }

    public static Mac createHmac(final byte[] keyBytes, String hmacName) throws NoSuchAlgorithmException,
            InvalidKeyException {

        SecretKeySpec key = new SecretKeySpec(keyBytes, hmacName);
        Mac mac = Mac.getInstance(hmacName);
        mac.init(key);
        return mac;
    }

    private ScramUtils() {
    }
}
