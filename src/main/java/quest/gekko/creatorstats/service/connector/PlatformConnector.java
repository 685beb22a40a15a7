package quest.gekko.creatorstats.service.connector;

import quest.gekko.creatorstats.domain.Credential;
import quest.gekko.creatorstats.domain.PlatformSnapshot;
import quest.gekko.creatorstats.domain.TokenGrant;

public interface PlatformConnector {
    /** Lower-case platform name used as registry key, e.g. "youtube". */
    String platform();

    /**
     * Exchange a refresh token for a new access token.
     *
     * @throws quest.gekko.creatorstats.exception.ProviderAuthException when the token is revoked or the answer is unusable
     * @throws quest.gekko.creatorstats.exception.ProviderUnavailableException on transport failures
     */
    TokenGrant refresh(String refreshToken);

    /**
     * Fetch current statistics. {@code credential} is null for public lookups.
     *
     * @throws quest.gekko.creatorstats.exception.ProviderUnavailableException on transport failures
     */
    PlatformSnapshot fetchStats(String identifier, Credential credential);
}
