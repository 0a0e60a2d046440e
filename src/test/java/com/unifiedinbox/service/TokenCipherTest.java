package com.unifiedinbox.service;

import com.unifiedinbox.exception.KeyMismatchException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenCipherTest {

    private static final String SALT = "5c0744940b5c369b";

    @Test
    void encryptsAndDecryptsWithTheSameKey() {
        TokenCipher cipher = new TokenCipher("deployment-secret", SALT);

        String ciphertext = cipher.encrypt("1//refresh-token");

        assertThat(ciphertext).doesNotContain("refresh-token");
        assertThat(cipher.decrypt(ciphertext)).isEqualTo("1//refresh-token");
    }

    @Test
    void rejectsCiphertextFromAnotherKey() {
        String ciphertext = new TokenCipher("old-secret", SALT).encrypt("1//refresh-token");
        TokenCipher rotated = new TokenCipher("new-secret", SALT);

        assertThatThrownBy(() -> rotated.decrypt(ciphertext))
            .isInstanceOf(KeyMismatchException.class);
    }

    @Test
    void rejectsGarbage() {
        TokenCipher cipher = new TokenCipher("deployment-secret", SALT);

        assertThatThrownBy(() -> cipher.decrypt("not-hex"))
            .isInstanceOf(KeyMismatchException.class);
    }
}
