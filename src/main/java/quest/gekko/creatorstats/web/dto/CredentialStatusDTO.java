package quest.gekko.creatorstats.web.dto;

import java.time.Instant;

/** Credential state as exposed over HTTP; token material never leaves the service. */
public record CredentialStatusDTO(String platform, boolean connected, Instant expiresAt) {}
