package com.unifiedinbox.service;

import com.unifiedinbox.exception.KeyMismatchException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.crypto.encrypt.Encryptors;
import org.springframework.security.crypto.encrypt.TextEncryptor;
import org.springframework.stereotype.Component;

/**
 * Encrypts refresh tokens at rest with AES-GCM keyed by the deployment secret.
 */
@Component
public class TokenCipher {

    private final TextEncryptor encryptor;

    public TokenCipher(@Value("${sync.crypto.password}") String password,
                       @Value("${sync.crypto.salt}") String hexSalt) {
        this.encryptor = Encryptors.delux(password, hexSalt);
    }

    public String encrypt(String plaintext) {
        return encryptor.encrypt(plaintext);
    }

    /**
     * @throws KeyMismatchException if the ciphertext was produced under another key
     */
    public String decrypt(String ciphertext) {
        try {
            return encryptor.decrypt(ciphertext);
        } catch (IllegalStateException | IllegalArgumentException e) {
            throw new KeyMismatchException("Stored token cannot be decrypted with the current key", e);
        }
    }
}
