package com.libragraph.stash.formats.crypto;

import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;

/**
 * AES-256-GCM through the JCA provider. Instances are thread-safe; a
 * {@link Cipher} is created per call.
 */
public class AesGcmCipher implements AeadCipher {

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int KEY_HEX_LENGTH = 64;

    private final SecretKey key;
    private final SecureRandom random = new SecureRandom();

    public AesGcmCipher(byte[] key) {
        if (key == null || key.length != 32) {
            throw new IllegalArgumentException("AES-256 key must be 32 bytes");
        }
        this.key = new SecretKeySpec(key, "AES");
    }

    /**
     * Parses a key of exactly 64 hex characters.
     *
     * @throws IllegalArgumentException for any other length or non-hex input
     */
    public static AesGcmCipher fromHex(String hex) {
        String trimmed = hex == null ? "" : hex.trim();
        if (trimmed.length() != KEY_HEX_LENGTH) {
            throw new IllegalArgumentException(
                    "Encryption key must be " + KEY_HEX_LENGTH + " hex characters, got " + trimmed.length());
        }
        try {
            return new AesGcmCipher(Hex.decodeHex(trimmed));
        } catch (DecoderException e) {
            throw new IllegalArgumentException("Encryption key is not valid hex", e);
        }
    }

    @Override
    public byte[] newNonce() {
        byte[] nonce = new byte[NONCE_LENGTH];
        random.nextBytes(nonce);
        return nonce;
    }

    @Override
    public byte[] seal(byte[] nonce, byte[] plaintext) {
        requireNonce(nonce);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH * 8, nonce));
            return cipher.doFinal(plaintext);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM encryption failed", e);
        }
    }

    @Override
    public byte[] open(byte[] nonce, byte[] sealed) {
        requireNonce(nonce);
        if (sealed == null || sealed.length < TAG_LENGTH) {
            throw new UnsealException("Sealed data shorter than the authentication tag");
        }
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH * 8, nonce));
            return cipher.doFinal(sealed);
        } catch (AEADBadTagException e) {
            throw new UnsealException("Authentication tag mismatch", e);
        } catch (GeneralSecurityException e) {
            throw new UnsealException("AES-GCM decryption failed", e);
        }
    }

    private static void requireNonce(byte[] nonce) {
        if (nonce == null || nonce.length != NONCE_LENGTH) {
            throw new IllegalArgumentException("Nonce must be " + NONCE_LENGTH + " bytes");
        }
    }
}
