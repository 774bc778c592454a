package gr.imsi.athenarc.telemetry.security;

/**
 * Protects secrets (tokens, passwords) stored in connection configurations.
 * <p>
 * Implementations must make {@link #encrypt(String)} idempotent on values that are already
 * encrypted, and {@link #decrypt(String)} must hand back plain text unchanged.
 */
public interface CredentialEncryptor {

    String encrypt(String plainText);

    String decrypt(String cipherText);

    boolean isEncrypted(String value);
}
