package gr.imsi.athenarc.telemetry.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pass-through encryptor for configurations that keep secrets in plain text, such as a local
 * {@code application.properties}.
 */
public class NoOpCredentialEncryptor implements CredentialEncryptor {

    private static final Logger LOG = LoggerFactory.getLogger(NoOpCredentialEncryptor.class);

    @Override
    public String encrypt(String plainText) {
        LOG.debug("Credential encryption disabled, storing value as plain text");
        return plainText;
    }

    @Override
    public String decrypt(String cipherText) {
        LOG.debug("Credential encryption disabled, using value as is");
        return cipherText;
    }

    @Override
    public boolean isEncrypted(String value) {
        return false;
    }
}
