package crm.sync.app.exception;

/**
 * Missing or invalid encryption key, or ciphertext that fails to decrypt.
 * Messages never include token or key material.
 */
public class TokenVaultException extends RuntimeException {
    public TokenVaultException(String message) {
        super(message);
    }

    public TokenVaultException(String message, Throwable cause) {
        super(message, cause);
    }
}
