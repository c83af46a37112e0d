package com.mailsync.util;

import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Credential encryption and address utilities
 * - IMAP passwords are stored as "ivHex:cipherHex" (AES-256-CBC)
 * - The key is 64 hex characters (32 bytes)
 */
public final class CryptoUtil {

    private static final String TRANSFORMATION = "AES/CBC/PKCS5Padding";
    private static final int IV_LENGTH = 16;
    private static final SecureRandom RANDOM = new SecureRandom();

    private CryptoUtil() {}

    /**
     * Encrypt a password with a hex AES-256 key
     */
    public static String encryptPassword(String plainText, String hexKey) {
        try {
            byte[] iv = new byte[IV_LENGTH];
            RANDOM.nextBytes(iv);
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, keySpec(hexKey), new IvParameterSpec(iv));
            byte[] encrypted = cipher.doFinal(plainText.getBytes(StandardCharsets.UTF_8));
            HexFormat hex = HexFormat.of();
            return hex.formatHex(iv) + ":" + hex.formatHex(encrypted);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to encrypt password", e);
        }
    }

    /**
     * Decrypt an "ivHex:cipherHex" value with a hex AES-256 key
     */
    public static String decryptPassword(String encrypted, String hexKey) {
        if (encrypted == null) return null;
        int sep = encrypted.indexOf(':');
        if (sep <= 0 || sep == encrypted.length() - 1) {
            throw new IllegalArgumentException("Encrypted password is not in ivHex:cipherHex form");
        }
        try {
            HexFormat hex = HexFormat.of();
            byte[] iv = hex.parseHex(encrypted.substring(0, sep));
            byte[] cipherBytes = hex.parseHex(encrypted.substring(sep + 1));
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, keySpec(hexKey), new IvParameterSpec(iv));
            return new String(cipher.doFinal(cipherBytes), StandardCharsets.UTF_8);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to decrypt password", e);
        }
    }

    /**
     * Whether a value looks like the output of encryptPassword
     */
    public static boolean isEncrypted(String value) {
        if (value == null) return false;
        int sep = value.indexOf(':');
        return sep == IV_LENGTH * 2 && value.length() > sep + 1
                && value.chars().filter(c -> c != ':').allMatch(c -> Character.digit(c, 16) >= 0);
    }

    private static SecretKeySpec keySpec(String hexKey) {
        if (hexKey == null || hexKey.length() != 64) {
            throw new IllegalArgumentException("Encryption key must be 64 hex characters");
        }
        return new SecretKeySpec(HexFormat.of().parseHex(hexKey), "AES");
    }

    /**
     * Strip angle brackets (<>) from an email address
     */
    public static String stripAngleBrackets(String email) {
        if (email == null) return null;
        String stripped = email.trim();
        if (stripped.startsWith("<")) stripped = stripped.substring(1);
        if (stripped.endsWith(">")) stripped = stripped.substring(0, stripped.length() - 1);
        return stripped.trim();
    }

    /**
     * Extract local part from an email address
     */
    public static String extractLocalPart(String email) {
        if (email == null || !email.contains("@")) return email;
        return email.substring(0, email.lastIndexOf('@'));
    }
}
