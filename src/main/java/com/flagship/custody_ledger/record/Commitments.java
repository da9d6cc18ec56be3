package com.flagship.custody_ledger.record;

import com.flagship.custody_ledger.error.CustodyRejectedException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Secret commitments for hash-locked records.
 *
 * A commitment is the lowercase hex SHA-256 of the UTF-8 secret. Comparison runs
 * over the full digest regardless of where the first mismatch is.
 */
public final class Commitments {

    private static final String ALGORITHM = "SHA-256";
    private static final HexFormat HEX = HexFormat.of();

    private Commitments() {
    }

    public static String commit(String secret) {
        if (secret == null || secret.isEmpty()) {
            throw CustodyRejectedException.invalidInput("Secret is required");
        }
        return HEX.formatHex(digest(secret));
    }

    public static boolean matches(String secret, String commitment) {
        if (secret == null || secret.isEmpty() || !isWellFormed(commitment)) {
            return false;
        }
        byte[] expected = HEX.parseHex(commitment.toLowerCase(Locale.ROOT));
        return MessageDigest.isEqual(digest(secret), expected);
    }

    public static boolean isWellFormed(String commitment) {
        if (commitment == null || commitment.length() != 64) {
            return false;
        }
        for (int i = 0; i < commitment.length(); i++) {
            if (Character.digit(commitment.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }

    public static String normalize(String commitment) {
        if (!isWellFormed(commitment)) {
            throw CustodyRejectedException.invalidInput("Commitment must be 64 hex characters");
        }
        return commitment.toLowerCase(Locale.ROOT);
    }

    private static byte[] digest(String secret) {
        try {
            return MessageDigest.getInstance(ALGORITHM).digest(secret.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " not available", e);
        }
    }
}
