package quest.gekko.creatorstats.service.credential;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import quest.gekko.creatorstats.config.CreatorStatsProperties;
import quest.gekko.creatorstats.domain.Credential;
import quest.gekko.creatorstats.domain.CredentialEntity;
import quest.gekko.creatorstats.repository.CredentialRepository;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CredentialStoreUpsertTest {
    static final Instant NOW = Instant.parse("2024-06-15T12:00:00Z");

    @Mock CredentialRepository repository;

    TokenCipher tokenCipher;
    CredentialStore store;

    @BeforeEach
    void setUp() {
        tokenCipher = new TokenCipher(new CreatorStatsProperties.Credentials(TokenCipherTest.KEY, null));
        store = new CredentialStore(repository, tokenCipher, new ObjectMapper(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static Credential credential(String accessToken) {
        return new Credential("u1", "youtube", accessToken, "refresh", NOW.plusSeconds(3600), null, null);
    }

    @Test
    @DisplayName("a concurrent first insert is overwritten instead of failing the write")
    void lostInsertRaceBecomesUpdate() {
        CredentialEntity inserted = new CredentialEntity();
        inserted.setUserId("u1");
        inserted.setPlatform("youtube");
        inserted.setPayload("written-by-other-caller");
        inserted.setCreatedAt(NOW.minusSeconds(1));
        when(repository.findByUserIdAndPlatform("u1", "youtube"))
                .thenReturn(Optional.empty(), Optional.of(inserted));
        when(repository.saveAndFlush(any(CredentialEntity.class)))
                .thenThrow(new DataIntegrityViolationException("uk_user_credential"))
                .thenAnswer(inv -> inv.getArgument(0));

        store.save(credential("mine"));

        verify(repository, times(2)).saveAndFlush(any(CredentialEntity.class));
        assertThat(tokenCipher.decrypt(inserted.getPayload())).contains("\"accessToken\":\"mine\"");
        assertThat(inserted.getExpiresAt()).isEqualTo(NOW.plusSeconds(3600));
        assertThat(inserted.getUpdatedAt()).isEqualTo(NOW);
        assertThat(inserted.getCreatedAt()).isEqualTo(NOW.minusSeconds(1));
    }

    @Test
    void secondFailureIsPropagated() {
        when(repository.findByUserIdAndPlatform("u1", "youtube")).thenReturn(Optional.empty());
        when(repository.saveAndFlush(any(CredentialEntity.class)))
                .thenThrow(new DataIntegrityViolationException("uk_user_credential"));

        assertThatThrownBy(() -> store.save(credential("mine")))
                .isInstanceOf(DataIntegrityViolationException.class);
        verify(repository, times(2)).saveAndFlush(any(CredentialEntity.class));
    }
}
