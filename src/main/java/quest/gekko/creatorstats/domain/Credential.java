package quest.gekko.creatorstats.domain;

import java.time.Instant;

/**
 * Decrypted OAuth credential for one (user, platform) pair.
 * A {@code null} expiresAt means the provider issued a non-expiring token.
 */
public record Credential(
        String userId,
        String platform,
        String accessToken,
        String refreshToken,
        Instant expiresAt,
        String scope,
        String tokenType
) {

    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }

    public boolean canRefresh() {
        return refreshToken != null && !refreshToken.isBlank();
    }

    /** Applies a refresh grant, keeping the current refresh token when the provider did not rotate it. */
    public Credential refreshedWith(TokenGrant grant, Instant now) {
        return new Credential(
                userId,
                platform,
                grant.accessToken(),
                grant.refreshToken() != null ? grant.refreshToken() : refreshToken,
                grant.expiresAt(now),
                grant.scope() != null ? grant.scope() : scope,
                grant.tokenType() != null ? grant.tokenType() : tokenType
        );
    }

    @Override
    public String toString() {
        return "Credential[userId=" + userId + ", platform=" + platform + ", expiresAt=" + expiresAt
                + ", scope=" + scope + ", tokenType=" + tokenType + "]";
    }
}
