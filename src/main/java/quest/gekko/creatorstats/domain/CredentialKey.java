package quest.gekko.creatorstats.domain;

import java.time.Instant;

/** Identity and clear-text expiry of a stored credential, readable without decrypting it. */
public record CredentialKey(String userId, String platform, Instant expiresAt) {}
