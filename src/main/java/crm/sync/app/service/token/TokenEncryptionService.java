package crm.sync.app.service.token;

import crm.sync.app.exception.TokenVaultException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * AES-256-GCM encryption for OAuth tokens at rest.
 * Ciphertext is stored as lowercase hex {@code iv:tag:payload}.
 */
@Service
public class TokenEncryptionService {

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final int GCM_TAG_LENGTH = 128;
    private static final int GCM_TAG_BYTES = GCM_TAG_LENGTH / 8;
    private static final int GCM_IV_LENGTH = 12;
    private static final int KEY_BYTES = 32;
    private static final Pattern HEX_KEY = Pattern.compile("^[0-9a-fA-F]{64}$");
    private static final HexFormat HEX = HexFormat.of();

    private final String configuredKey;
    private final SecureRandom secureRandom = new SecureRandom();
    private volatile SecretKey secretKey;

    public TokenEncryptionService(@Value("${crm.security.token-encryption-key:}") String configuredKey) {
        this.configuredKey = configuredKey;
    }

    public String encrypt(String plainText) {
        if (plainText == null) {
            return null;
        }
        try {
            byte[] iv = new byte[GCM_IV_LENGTH];
            secureRandom.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, key(), new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            byte[] sealed = cipher.doFinal(plainText.getBytes(StandardCharsets.UTF_8));

            // JCE appends the tag to the ciphertext
            byte[] payload = Arrays.copyOfRange(sealed, 0, sealed.length - GCM_TAG_BYTES);
            byte[] tag = Arrays.copyOfRange(sealed, sealed.length - GCM_TAG_BYTES, sealed.length);

            return HEX.formatHex(iv) + ":" + HEX.formatHex(tag) + ":" + HEX.formatHex(payload);
        } catch (GeneralSecurityException e) {
            throw new TokenVaultException("Failed to encrypt token", e);
        }
    }

    public String decrypt(String cipherText) {
        if (cipherText == null) {
            return null;
        }
        String[] parts = cipherText.split(":", -1);
        if (parts.length != 3) {
            throw new TokenVaultException("Malformed encrypted token: expected iv:tag:payload");
        }

        byte[] iv;
        byte[] tag;
        byte[] payload;
        try {
            iv = HEX.parseHex(parts[0]);
            tag = HEX.parseHex(parts[1]);
            payload = HEX.parseHex(parts[2]);
        } catch (IllegalArgumentException e) {
            throw new TokenVaultException("Malformed encrypted token: segments are not hex");
        }
        if (iv.length != GCM_IV_LENGTH || tag.length != GCM_TAG_BYTES) {
            throw new TokenVaultException("Malformed encrypted token: bad iv or tag length");
        }

        byte[] sealed = new byte[payload.length + tag.length];
        System.arraycopy(payload, 0, sealed, 0, payload.length);
        System.arraycopy(tag, 0, sealed, payload.length, tag.length);

        try {
            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, key(), new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            return new String(cipher.doFinal(sealed), StandardCharsets.UTF_8);
        } catch (AEADBadTagException e) {
            throw new TokenVaultException("Failed to decrypt token: authentication tag mismatch");
        } catch (GeneralSecurityException e) {
            throw new TokenVaultException("Failed to decrypt token", e);
        }
    }

    private SecretKey key() {
        SecretKey key = secretKey;
        if (key == null) {
            key = new SecretKeySpec(decodeKey(configuredKey), "AES");
            secretKey = key;
        }
        return key;
    }

    private static byte[] decodeKey(String value) {
        if (value == null || value.isBlank() || value.startsWith("${")) {
            throw new TokenVaultException("Token encryption key is not configured. Please set crm.security.token-encryption-key");
        }
        String trimmed = value.trim();
        byte[] decoded;
        if (HEX_KEY.matcher(trimmed).matches()) {
            decoded = HEX.parseHex(trimmed);
        } else {
            try {
                decoded = Base64.getDecoder().decode(trimmed);
            } catch (IllegalArgumentException e) {
                throw new TokenVaultException("Token encryption key must be 64 hex characters or Base64 of 32 bytes");
            }
        }
        if (decoded.length != KEY_BYTES) {
            throw new TokenVaultException("Token encryption key must be 256 bits");
        }
        return decoded;
    }
}
