package quest.gekko.creatorstats.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import quest.gekko.creatorstats.service.connector.ConnectorRegistry;
import quest.gekko.creatorstats.service.connector.PlatformConnector;

import java.util.List;

@Configuration
public class ConnectorConfig {

    @Bean
    public ConnectorRegistry connectorRegistry(List<PlatformConnector> connectors) {
        return new ConnectorRegistry(connectors);
    }
}
