package com.payoutengine.credentials;

import javax.crypto.Cipher;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;

/**
 * Password-based AES-256-GCM encryption for credentials at rest.
 *
 * Layout of the Base64 payload: {@code salt(64) | iv(16) | tag(16) | ciphertext}.
 * The key is derived with PBKDF2-HMAC-SHA512, 100 000 iterations.
 */
public final class CredentialCipher {

    private static final int SALT_LENGTH = 64;
    private static final int IV_LENGTH = 16;
    private static final int TAG_LENGTH = 16;
    private static final int KEY_BITS = 256;
    private static final int ITERATIONS = 100_000;

    private static final SecureRandom RANDOM = new SecureRandom();

    private CredentialCipher() {
    }

    public static String encrypt(String plaintext, String password) {
        requirePassword(password);
        byte[] salt = randomBytes(SALT_LENGTH);
        byte[] iv = randomBytes(IV_LENGTH);

        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.ENCRYPT_MODE, deriveKey(password, salt), new GCMParameterSpec(TAG_LENGTH * 8, iv));
            byte[] sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            // JCE appends the tag; the stored layout keeps it in front of the ciphertext
            int ciphertextLength = sealed.length - TAG_LENGTH;
            ByteBuffer out = ByteBuffer.allocate(SALT_LENGTH + IV_LENGTH + sealed.length);
            out.put(salt);
            out.put(iv);
            out.put(sealed, ciphertextLength, TAG_LENGTH);
            out.put(sealed, 0, ciphertextLength);
            return Base64.getEncoder().encodeToString(out.array());
        } catch (GeneralSecurityException e) {
            throw new CredentialStorageException("Failed to encrypt credential", e);
        }
    }

    public static String decrypt(String payload, String password) {
        requirePassword(password);
        byte[] buffer;
        try {
            buffer = Base64.getDecoder().decode(payload);
        } catch (IllegalArgumentException e) {
            throw new CredentialStorageException("Stored credential is not valid Base64", e);
        }
        if (buffer.length < SALT_LENGTH + IV_LENGTH + TAG_LENGTH) {
            throw new CredentialStorageException("Stored credential is truncated");
        }

        byte[] salt = Arrays.copyOfRange(buffer, 0, SALT_LENGTH);
        byte[] iv = Arrays.copyOfRange(buffer, SALT_LENGTH, SALT_LENGTH + IV_LENGTH);
        byte[] tag = Arrays.copyOfRange(buffer, SALT_LENGTH + IV_LENGTH, SALT_LENGTH + IV_LENGTH + TAG_LENGTH);
        byte[] ciphertext = Arrays.copyOfRange(buffer, SALT_LENGTH + IV_LENGTH + TAG_LENGTH, buffer.length);

        byte[] sealed = new byte[ciphertext.length + TAG_LENGTH];
        System.arraycopy(ciphertext, 0, sealed, 0, ciphertext.length);
        System.arraycopy(tag, 0, sealed, ciphertext.length, TAG_LENGTH);

        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.DECRYPT_MODE, deriveKey(password, salt), new GCMParameterSpec(TAG_LENGTH * 8, iv));
            return new String(cipher.doFinal(sealed), StandardCharsets.UTF_8);
        } catch (GeneralSecurityException e) {
            throw new CredentialStorageException("Failed to decrypt credential (wrong master password?)", e);
        }
    }

    private static SecretKeySpec deriveKey(String password, byte[] salt) throws GeneralSecurityException {
        PBEKeySpec spec = new PBEKeySpec(password.toCharArray(), salt, ITERATIONS, KEY_BITS);
        try {
            byte[] key = SecretKeyFactory.getInstance("PBKDF2WithHmacSHA512").generateSecret(spec).getEncoded();
            return new SecretKeySpec(key, "AES");
        } finally {
            spec.clearPassword();
        }
    }

    private static byte[] randomBytes(int length) {
        byte[] bytes = new byte[length];
        RANDOM.nextBytes(bytes);
        return bytes;
    }

    private static void requirePassword(String password) {
        if (password == null || password.isEmpty()) {
            throw new CredentialStorageException("Master password is not configured (payout-engine.credentials.master-password)");
        }
    }
}
