package quest.gekko.creatorstats.service.connector;

import lombok.RequiredArgsConstructor;
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

import static quest.gekko.creatorstats.service.connector.ProviderResponses.*;

@Service
@RequiredArgsConstructor
public class YouTubeConnector implements PlatformConnector {
    static final String PLATFORM = "youtube";
    // rough ad CPM in USD per 1000 views
    static final double CPM_USD = 3.5;

    private final WebClient http;
    private final CreatorStatsProperties.YouTube properties;

    @Override
    public String platform() { return PLATFORM; }

    @Override
    public TokenGrant refresh(String refreshToken) {
        Map<?, ?> body = tokenCall(PLATFORM, () -> http.post()
                .uri(uri -> uri.scheme("https").host("oauth2.googleapis.com").path("/token").build())
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(BodyInserters.fromFormData("grant_type", "refresh_token")
                        .with("refresh_token", refreshToken)
                        .with("client_id", nullToEmpty(properties.clientId()))
                        .with("client_secret", nullToEmpty(properties.clientSecret())))
                .retrieve()
                .bodyToMono(Map.class)
                .block());
        return toGrant(PLATFORM, body);
    }

    /** {@code identifier} is a channel id. Authenticated calls use the bearer token, public ones the API key. */
    @Override
    public PlatformSnapshot fetchStats(String identifier, Credential credential) {
        String apiKey = properties.apiKey();
        if (credential == null && (apiKey == null || apiKey.isBlank())) {
            throw new ProviderUnavailableException(PLATFORM, "no API key configured for public lookups");
        }

        Map<?, ?> resp = apiCall(PLATFORM, () -> http.get()
                .uri(uri -> {
                    uri.scheme("https").host("www.googleapis.com").path("/youtube/v3/channels")
                            .queryParam("part", "snippet,statistics")
                            .queryParam("id", identifier);
                    if (credential == null) uri.queryParam("key", apiKey);
                    return uri.build();
                })
                .headers(h -> {
                    if (credential != null) h.setBearerAuth(credential.accessToken());
                })
                .retrieve()
                .bodyToMono(Map.class)
                .block());

        List<Map<String, Object>> items = list(resp, "items");
        if (items.isEmpty()) {
            throw new ProviderUnavailableException(PLATFORM, "channel not found: " + identifier);
        }
        Map<String, Object> channel = items.get(0);
        Map<String, Object> stats = map(channel, "statistics");
        Map<String, Object> snippet = map(channel, "snippet");

        long subscribers = parseLong(stats.get("subscriberCount"));
        long views = parseLong(stats.get("viewCount"));
        String thumbnail = (String) map(map(snippet, "thumbnails"), "default").get("url");

        return new PlatformSnapshot(PLATFORM, identifier, (String) snippet.getOrDefault("title", identifier), thumbnail,
                subscribers, 0L, views, 0L, estimateRevenue(views), 0.0, false, Instant.now(), null);
    }

    static long estimateRevenue(long views) {
        return Math.round(views / 1000.0 * CPM_USD);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
