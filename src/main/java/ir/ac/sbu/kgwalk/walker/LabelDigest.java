package ir.ac.sbu.kgwalk.walker;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * MD5 digest of relabeling strings, rendered as 32 lower case hex characters.
 */
public final class LabelDigest {

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private LabelDigest() {}

    public static String digest(String label) {
        byte[] bytes = newDigest().digest(label.getBytes(StandardCharsets.UTF_8));
        char[] hex = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            hex[2 * i] = HEX[(bytes[i] >> 4) & 0xF];
            hex[2 * i + 1] = HEX[bytes[i] & 0xF];
        }
        return new String(hex);
    }

    // MessageDigest is not thread safe
    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
