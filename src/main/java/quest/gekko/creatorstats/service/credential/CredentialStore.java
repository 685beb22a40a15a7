package quest.gekko.creatorstats.service.credential;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.creatorstats.domain.Credential;
import quest.gekko.creatorstats.domain.CredentialEntity;
import quest.gekko.creatorstats.domain.CredentialKey;
import quest.gekko.creatorstats.exception.CorruptCredentialException;
import quest.gekko.creatorstats.repository.CredentialRepository;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Encrypted-at-rest storage of one credential per (user, platform). Writes are upserts.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CredentialStore {
    private final CredentialRepository credentialRepository;
    private final TokenCipher tokenCipher;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * @throws CorruptCredentialException when the stored payload cannot be decrypted or parsed
     */
    @Transactional(readOnly = true)
    public Optional<Credential> find(final String userId, final String platform) {
        return credentialRepository.findByUserIdAndPlatform(userId, platform).map(this::toCredential);
    }

    /**
     * Upsert on (userId, platform). When a concurrent first write inserts the row between the lookup and
     * the insert, the write is repeated as an update so the last writer wins. Each attempt commits on its own.
     */
    public Credential save(final Credential credential) {
        String payload = encode(credential);
        try {
            write(credential, payload);
        } catch (DataIntegrityViolationException e) {
            log.debug("Concurrent insert of {} credential for user {}, retrying as update",
                    credential.platform(), credential.userId());
            write(credential, payload);
        }
        return credential;
    }

    /** Idempotent; returns whether a row was removed. */
    @Transactional
    public boolean delete(final String userId, final String platform) {
        return credentialRepository.deleteByUserIdAndPlatform(userId, platform) > 0;
    }

    @Transactional(readOnly = true)
    public List<CredentialKey> listKeys() {
        return credentialRepository.findAll().stream()
                .map(e -> new CredentialKey(e.getUserId(), e.getPlatform(), e.getExpiresAt()))
                .toList();
    }

    private void write(final Credential credential, final String payload) {
        Instant now = clock.instant();
        CredentialEntity entity = credentialRepository.findByUserIdAndPlatform(credential.userId(), credential.platform())
                .orElseGet(() -> {
                    CredentialEntity created = new CredentialEntity();
                    created.setUserId(credential.userId());
                    created.setPlatform(credential.platform());
                    created.setCreatedAt(now);
                    return created;
                });
        entity.setPayload(payload);
        entity.setExpiresAt(credential.expiresAt());
        entity.setUpdatedAt(now);
        credentialRepository.saveAndFlush(entity);
    }

    private String encode(final Credential credential) {
        TokenPayload payload = new TokenPayload(credential.accessToken(), credential.refreshToken(),
                credential.scope(), credential.tokenType());
        try {
            return tokenCipher.encrypt(objectMapper.writeValueAsString(payload));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize credential payload", e);
        }
    }

    private Credential toCredential(final CredentialEntity entity) {
        String json = tokenCipher.decrypt(entity.getPayload());
        TokenPayload payload;
        try {
            payload = objectMapper.readValue(json, TokenPayload.class);
        } catch (JsonProcessingException e) {
            throw new CorruptCredentialException("Credential payload is not valid JSON", e);
        }
        if (payload.accessToken() == null || payload.accessToken().isBlank()) {
            throw new CorruptCredentialException("Credential payload has no access token", null);
        }
        return new Credential(entity.getUserId(), entity.getPlatform(), payload.accessToken(),
                payload.refreshToken(), entity.getExpiresAt(), payload.scope(), payload.tokenType());
    }

    public record TokenPayload(String accessToken, String refreshToken, String scope, String tokenType) {}
}
