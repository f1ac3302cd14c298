package de.t14d3.drawer.serialization;

/**
 * Hook applied to the serialized payload right before it is written and right after it is read.
 */
public interface ValueEncryptor {

    ValueEncryptor NONE = new ValueEncryptor() {
        @Override
        public String encrypt(String plaintext) {
            return plaintext;
        }

        @Override
        public String decrypt(String ciphertext) {
            return ciphertext;
        }
    };

    String encrypt(String plaintext);

    String decrypt(String ciphertext);
}
