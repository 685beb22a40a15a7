package quest.gekko.creatorstats.service.connector;

import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import quest.gekko.creatorstats.domain.TokenGrant;
import quest.gekko.creatorstats.exception.ProviderAuthException;
import quest.gekko.creatorstats.exception.ProviderUnavailableException;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Shared helpers for connector HTTP calls: error classification and loose JSON map access.
 */
final class ProviderResponses {

    private ProviderResponses() {
    }

    /** Token endpoint call: 400/401/403 mean the refresh token is no good. */
    static Map<?, ?> tokenCall(final String platform, final Supplier<Map<?, ?>> call) {
        try {
            return call.get();
        } catch (WebClientResponseException e) {
            int status = e.getStatusCode().value();
            if (status == 400 || status == 401 || status == 403) {
                throw new ProviderAuthException(platform, "token endpoint rejected the refresh token (" + status + ")", e);
            }
            throw new ProviderUnavailableException(platform, "token endpoint answered " + status, e);
        } catch (WebClientRequestException e) {
            throw new ProviderUnavailableException(platform, "token endpoint unreachable: " + e.getMessage(), e);
        }
    }

    static Map<?, ?> apiCall(final String platform, final Supplier<Map<?, ?>> call) {
        try {
            Map<?, ?> body = call.get();
            if (body == null) {
                throw new ProviderUnavailableException(platform, "empty response body");
            }
            return body;
        } catch (WebClientResponseException e) {
            throw new ProviderUnavailableException(platform, "API answered " + e.getStatusCode().value(), e);
        } catch (WebClientRequestException e) {
            throw new ProviderUnavailableException(platform, "API unreachable: " + e.getMessage(), e);
        }
    }

    static TokenGrant toGrant(final String platform, final Map<?, ?> body) {
        if (body == null || !(body.get("access_token") instanceof String accessToken) || accessToken.isBlank()) {
            throw new ProviderAuthException(platform, "malformed token response");
        }
        Object expiresIn = body.get("expires_in");
        return new TokenGrant(
                accessToken,
                body.get("refresh_token") instanceof String rt && !rt.isBlank() ? rt : null,
                expiresIn == null ? null : parseLong(expiresIn),
                scope(body.get("scope")),
                body.get("token_type") instanceof String tt ? tt : null
        );
    }

    @SuppressWarnings("unchecked")
    static List<Map<String, Object>> list(final Map<?, ?> obj, final String field) {
        if (obj == null) return List.of();
        Object value = obj.get(field);
        if (!(value instanceof List<?> list)) return List.of();
        return (List<Map<String, Object>>) (List<?>) list;
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> map(final Map<?, ?> obj, final String field) {
        if (obj == null) return Map.of();
        Object value = obj.get(field);
        return value instanceof Map<?, ?> m ? (Map<String, Object>) m : Map.of();
    }

    static long parseLong(final Object o) {
        if (o == null) return 0L;
        if (o instanceof Number n) return n.longValue();
        try {
            return Long.parseLong(o.toString());
        } catch (NumberFormatException e) {
            return 0L;
        }
    }

    private static String scope(final Object raw) {
        if (raw instanceof String s) return s;
        if (raw instanceof Collection<?> c) return String.join(" ", c.stream().map(Object::toString).toList());
        return null;
    }
}
