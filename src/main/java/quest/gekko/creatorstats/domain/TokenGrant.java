package quest.gekko.creatorstats.domain;

import java.time.Instant;

/**
 * Token response from a provider's authorization or refresh endpoint.
 * {@code refreshToken} is null when the provider did not issue a new one;
 * {@code expiresInSeconds} is null for non-expiring tokens.
 */
public record TokenGrant(
        String accessToken,
        String refreshToken,
        Long expiresInSeconds,
        String scope,
        String tokenType
) {

    public Instant expiresAt(Instant now) {
        return expiresInSeconds == null ? null : now.plusSeconds(expiresInSeconds);
    }

    @Override
    public String toString() {
        return "TokenGrant[expiresInSeconds=" + expiresInSeconds + ", scope=" + scope + ", tokenType=" + tokenType + "]";
    }
}
