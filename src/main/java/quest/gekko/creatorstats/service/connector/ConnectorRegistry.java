package quest.gekko.creatorstats.service.connector;

import quest.gekko.creatorstats.exception.UnsupportedPlatformException;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Platform name to connector lookup. Adding a platform means registering another {@link PlatformConnector} bean.
 */
public class ConnectorRegistry {
    private final Map<String, PlatformConnector> connectors = new TreeMap<>();

    public ConnectorRegistry(List<PlatformConnector> connectors) {
        for (PlatformConnector connector : connectors) {
            String key = normalize(connector.platform());
            if (this.connectors.putIfAbsent(key, connector) != null) {
                throw new IllegalStateException("Duplicate connector for platform " + key);
            }
        }
    }

    public Optional<PlatformConnector> find(String platform) {
        if (platform == null) return Optional.empty();
        return Optional.ofNullable(connectors.get(normalize(platform)));
    }

    public PlatformConnector require(String platform) {
        return find(platform).orElseThrow(() -> new UnsupportedPlatformException(platform));
    }

    public Set<String> platforms() {
        return connectors.keySet();
    }

    public static String normalize(String platform) {
        return platform.trim().toLowerCase(Locale.ROOT);
    }
}
