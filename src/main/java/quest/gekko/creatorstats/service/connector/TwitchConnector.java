package quest.gekko.creatorstats.service.connector;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import quest.gekko.creatorstats.config.CreatorStatsProperties;
import quest.gekko.creatorstats.domain.Credential;
import quest.gekko.creatorstats.domain.PlatformSnapshot;
import quest.gekko.creatorstats.domain.TokenGrant;
import quest.gekko.creatorstats.exception.ProviderUnavailableException;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static quest.gekko.creatorstats.service.connector.ProviderResponses.*;

/**
 * Twitch Helix connector. Public lookups use an app access token obtained through the client-credentials grant
 * and kept in memory until shortly before it expires.
 */
@Service
@Slf4j
public class TwitchConnector implements PlatformConnector {
    static final String PLATFORM = "twitch";
    static final double REVENUE_PER_FOLLOWER = 0.01;
    static final double REVENUE_PER_VIEWER = 0.05;

    private final WebClient http;
    private final CreatorStatsProperties.Twitch properties;

    private final AtomicReference<String> appToken = new AtomicReference<>();
    private final AtomicReference<Instant> appTokenExpiry = new AtomicReference<>(Instant.EPOCH);

    public TwitchConnector(WebClient http, CreatorStatsProperties.Twitch properties) {
        this.http = http;
        this.properties = properties;
    }

    @Override
    public String platform() { return PLATFORM; }

    @Override
    public TokenGrant refresh(String refreshToken) {
        requireClientCredentials();
        Map<?, ?> body = tokenCall(PLATFORM, () -> http.post()
                .uri(uri -> uri.scheme("https").host("id.twitch.tv").path("/oauth2/token").build())
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(BodyInserters.fromFormData("grant_type", "refresh_token")
                        .with("refresh_token", refreshToken)
                        .with("client_id", properties.clientId())
                        .with("client_secret", properties.clientSecret()))
                .retrieve()
                .bodyToMono(Map.class)
                .block());
        return toGrant(PLATFORM, body);
    }

    /** {@code identifier} is the channel login name. */
    @Override
    public PlatformSnapshot fetchStats(String identifier, Credential credential) {
        requireClientCredentials();
        String token = credential != null ? credential.accessToken() : appToken();

        List<Map<String, Object>> users = list(helix(token, "/helix/users", "login", identifier), "data");
        if (users.isEmpty()) {
            throw new ProviderUnavailableException(PLATFORM, "user not found: " + identifier);
        }
        Map<String, Object> user = users.get(0);
        String userId = (String) user.get("id");

        long followers = parseLong(helix(token, "/helix/channels/followers", "broadcaster_id", userId).get("total"));
        List<Map<String, Object>> streams = list(helix(token, "/helix/streams", "user_id", userId), "data");
        long viewers = streams.isEmpty() ? 0L : parseLong(streams.get(0).get("viewer_count"));

        return new PlatformSnapshot(PLATFORM, identifier, (String) user.getOrDefault("display_name", identifier),
                (String) user.get("profile_image_url"), 0L, followers, 0L, viewers,
                estimateRevenue(followers, viewers), 0.0, !streams.isEmpty(), Instant.now(), null);
    }

    static long estimateRevenue(long followers, long viewers) {
        return Math.round(followers * REVENUE_PER_FOLLOWER + viewers * REVENUE_PER_VIEWER);
    }

    private Map<?, ?> helix(String token, String path, String param, String value) {
        return apiCall(PLATFORM, () -> http.get()
                .uri(uri -> uri.scheme("https").host("api.twitch.tv").path(path).queryParam(param, value).build())
                .header("Client-Id", properties.clientId())
                .headers(h -> h.setBearerAuth(token))
                .retrieve()
                .bodyToMono(Map.class)
                .block());
    }

    private String appToken() {
        String cached = appToken.get();
        if (cached != null && Instant.now().isBefore(appTokenExpiry.get())) {
            return cached;
        }
        Map<?, ?> body = apiCall(PLATFORM, () -> http.post()
                .uri(uri -> uri.scheme("https").host("id.twitch.tv").path("/oauth2/token").build())
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(BodyInserters.fromFormData("grant_type", "client_credentials")
                        .with("client_id", properties.clientId())
                        .with("client_secret", properties.clientSecret()))
                .retrieve()
                .bodyToMono(Map.class)
                .block());
        if (!(body.get("access_token") instanceof String token) || token.isBlank()) {
            throw new ProviderUnavailableException(PLATFORM, "app token response carried no access token");
        }
        long expiresIn = parseLong(body.get("expires_in"));
        appToken.set(token);
        // renew a minute early
        appTokenExpiry.set(Instant.now().plusSeconds(Math.max(0, expiresIn - 60)));
        log.info("Obtained Twitch app access token (expires in {}s)", expiresIn);
        return token;
    }

    private void requireClientCredentials() {
        if (properties.clientId() == null || properties.clientId().isBlank()
                || properties.clientSecret() == null || properties.clientSecret().isBlank()) {
            throw new ProviderUnavailableException(PLATFORM, "Twitch client credentials not configured");
        }
    }
}
