package quest.gekko.creatorstats.service.credential;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import quest.gekko.creatorstats.config.CreatorStatsProperties;
import quest.gekko.creatorstats.domain.Credential;
import quest.gekko.creatorstats.domain.CredentialEntity;
import quest.gekko.creatorstats.domain.CredentialKey;
import quest.gekko.creatorstats.exception.CorruptCredentialException;
import quest.gekko.creatorstats.repository.CredentialRepository;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import({CredentialStore.class, CredentialStoreTest.Crypto.class})
class CredentialStoreTest {
    static final Instant NOW = Instant.parse("2024-06-15T12:00:00Z");
    static final Instant EXPIRY = Instant.parse("2024-06-15T13:00:00Z");

    @TestConfiguration
    static class Crypto {
        @Bean
        TokenCipher tokenCipher() {
            return new TokenCipher(new CreatorStatsProperties.Credentials(TokenCipherTest.KEY, null));
        }

        @Bean
        ObjectMapper objectMapper() {
            return new ObjectMapper();
        }

        @Bean
        Clock clock() {
            return Clock.fixed(NOW, ZoneOffset.UTC);
        }
    }

    @Autowired CredentialStore store;
    @Autowired CredentialRepository repository;
    @Autowired TokenCipher tokenCipher;

    private static Credential credential(String accessToken, String refreshToken) {
        return new Credential("u1", "youtube", accessToken, refreshToken, EXPIRY, "yt.readonly", "Bearer");
    }

    @Test
    void savedCredentialReadsBack() {
        store.save(credential("access-1", "refresh-1"));

        assertThat(store.find("u1", "youtube")).contains(credential("access-1", "refresh-1"));
        assertThat(store.find("u1", "twitch")).isEmpty();
    }

    @Test
    void tokensAreNotStoredInClear() {
        store.save(credential("access-1", "refresh-1"));

        CredentialEntity row = repository.findByUserIdAndPlatform("u1", "youtube").orElseThrow();
        assertThat(row.getPayload()).doesNotContain("access-1").doesNotContain("refresh-1");
        assertThat(row.getExpiresAt()).isEqualTo(EXPIRY);
        assertThat(row.getCreatedAt()).isEqualTo(NOW);
        assertThat(row.getUpdatedAt()).isEqualTo(NOW);
    }

    @Test
    void saveReplacesExistingRecord() {
        store.save(credential("access-1", "refresh-1"));
        store.save(credential("access-2", null));

        assertThat(repository.count()).isEqualTo(1);
        assertThat(store.find("u1", "youtube")).get()
                .extracting(Credential::accessToken, Credential::refreshToken)
                .containsExactly("access-2", null);
    }

    @Test
    void unreadablePayloadIsReportedAsCorrupt() {
        store.save(credential("access-1", "refresh-1"));
        CredentialEntity row = repository.findByUserIdAndPlatform("u1", "youtube").orElseThrow();
        row.setPayload("definitely-not-ciphertext");
        repository.saveAndFlush(row);

        assertThatThrownBy(() -> store.find("u1", "youtube")).isInstanceOf(CorruptCredentialException.class);
    }

    @Test
    void payloadWithoutAccessTokenIsCorrupt() {
        store.save(credential("access-1", "refresh-1"));
        CredentialEntity row = repository.findByUserIdAndPlatform("u1", "youtube").orElseThrow();
        row.setPayload(tokenCipher.encrypt("{\"refreshToken\":\"r\"}"));
        repository.saveAndFlush(row);

        assertThatThrownBy(() -> store.find("u1", "youtube")).isInstanceOf(CorruptCredentialException.class);
    }

    @Test
    void deleteIsIdempotent() {
        store.save(credential("access-1", "refresh-1"));

        assertThat(store.delete("u1", "youtube")).isTrue();
        assertThat(store.delete("u1", "youtube")).isFalse();
        assertThat(store.find("u1", "youtube")).isEmpty();
    }

    @Test
    void listKeysExposesExpiryWithoutDecrypting() {
        store.save(credential("access-1", "refresh-1"));
        store.save(new Credential("u2", "twitch", "a", null, null, null, null));

        assertThat(store.listKeys()).containsExactlyInAnyOrder(
                new CredentialKey("u1", "youtube", EXPIRY),
                new CredentialKey("u2", "twitch", null));
    }
}
