package quest.gekko.creatorstats.service.credential;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import quest.gekko.creatorstats.config.CreatorStatsProperties;
import quest.gekko.creatorstats.exception.CorruptCredentialException;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * AES-256-GCM encryption for credential payloads. Output is Base64 of IV followed by ciphertext and tag.
 */
@Component
@Slf4j
public class TokenCipher {

    private static final String ALGORITHM = "AES";
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int KEY_LENGTH_BYTES = 32;
    private static final int IV_LENGTH = 12; // 96-bit IV for GCM
    private static final int GCM_TAG_BITS = 128;

    private final SecretKey key;
    private final SecureRandom secureRandom = new SecureRandom();

    public TokenCipher(CreatorStatsProperties.Credentials properties) {
        this.key = resolveKey(properties.encryptionKey());
    }

    public String encrypt(String plaintext) {
        try {
            byte[] iv = new byte[IV_LENGTH];
            secureRandom.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, iv));
            byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            byte[] combined = new byte[iv.length + ciphertext.length];
            System.arraycopy(iv, 0, combined, 0, iv.length);
            System.arraycopy(ciphertext, 0, combined, iv.length, ciphertext.length);
            return Base64.getEncoder().encodeToString(combined);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to encrypt credential payload", e);
        }
    }

    /**
     * @throws CorruptCredentialException when the value is not valid Base64, is truncated, or fails authentication
     */
    public String decrypt(String encoded) {
        try {
            byte[] combined = Base64.getDecoder().decode(encoded);
            if (combined.length <= IV_LENGTH) {
                throw new CorruptCredentialException("Credential payload is truncated", null);
            }
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, combined, 0, IV_LENGTH));
            byte[] plaintext = cipher.doFinal(combined, IV_LENGTH, combined.length - IV_LENGTH);
            return new String(plaintext, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException | GeneralSecurityException e) {
            throw new CorruptCredentialException("Credential payload could not be decrypted", e);
        }
    }

    private static SecretKey resolveKey(String configured) {
        if (configured == null || configured.isBlank()) {
            log.warn("No credential encryption key configured; generating a per-process key. "
                    + "Stored credentials will be unreadable after a restart.");
            byte[] random = new byte[KEY_LENGTH_BYTES];
            new SecureRandom().nextBytes(random);
            return new SecretKeySpec(random, ALGORITHM);
        }
        byte[] raw = Base64.getDecoder().decode(configured.trim());
        if (raw.length != KEY_LENGTH_BYTES) {
            throw new IllegalStateException("creator-stats.credentials.encryption-key must decode to 32 bytes, got " + raw.length);
        }
        return new SecretKeySpec(raw, ALGORITHM);
    }
}
