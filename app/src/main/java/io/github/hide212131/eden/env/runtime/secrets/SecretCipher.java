package io.github.hide212131.eden.env.runtime.secrets;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.security.spec.InvalidKeySpecException;
import java.util.Arrays;
import java.util.HexFormat;
import javax.crypto.Cipher;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;

/**
 * AES-256-GCM over the whole secrets document. File layout: 12-byte IV followed by the ciphertext
 * and its 16-byte tag. Keys are derived with PBKDF2-HMAC-SHA256 and a fixed salt so the same
 * passphrase always yields the same key.
 */
final class SecretCipher {

    static final int KEY_LENGTH = 32;
    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final int GCM_IV_LENGTH = 12;
    private static final int GCM_TAG_LENGTH = 16;
    private static final int PBKDF2_ITERATIONS = 100_000;
    private static final byte[] SALT = "eden_env_secrets_salt_v1".getBytes(StandardCharsets.UTF_8);

    private final SecureRandom random = new SecureRandom();

    byte[] deriveKey(String passphrase) {
        PBEKeySpec spec = new PBEKeySpec(passphrase.toCharArray(), SALT, PBKDF2_ITERATIONS, KEY_LENGTH * 8);
        try {
            return SecretKeyFactory.getInstance("PBKDF2WithHmacSHA256").generateSecret(spec).getEncoded();
        } catch (NoSuchAlgorithmException | InvalidKeySpecException ex) {
            throw new IllegalStateException("PBKDF2WithHmacSHA256 is not available", ex);
        } finally {
            spec.clearPassword();
        }
    }

    byte[] encrypt(byte[] key, byte[] plaintext) {
        byte[] iv = new byte[GCM_IV_LENGTH];
        random.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"),
                    new GCMParameterSpec(GCM_TAG_LENGTH * 8, iv));
            byte[] encrypted = cipher.doFinal(plaintext);
            byte[] out = new byte[iv.length + encrypted.length];
            System.arraycopy(iv, 0, out, 0, iv.length);
            System.arraycopy(encrypted, 0, out, iv.length, encrypted.length);
            return out;
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("暗号化に失敗しました: " + ex.getMessage(), ex);
        }
    }

    /**
     * @throws GeneralSecurityException when the key does not authenticate the ciphertext
     */
    byte[] decrypt(byte[] key, byte[] data) throws GeneralSecurityException {
        Cipher cipher = Cipher.getInstance(ALGORITHM);
        cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"),
                new GCMParameterSpec(GCM_TAG_LENGTH * 8, Arrays.copyOfRange(data, 0, GCM_IV_LENGTH)));
        return cipher.doFinal(data, GCM_IV_LENGTH, data.length - GCM_IV_LENGTH);
    }

    /** Data shorter than IV plus tag cannot have been written by this cipher. */
    static boolean isWellFormed(byte[] data) {
        return data.length >= GCM_IV_LENGTH + GCM_TAG_LENGTH;
    }

    static String shortHash(byte[] data) {
        return HexFormat.of().formatHex(sha256(data)).substring(0, 16);
    }

    static byte[] sha256(byte[] data) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(data);
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 is not available", ex);
        }
    }
}
