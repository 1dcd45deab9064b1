package uz.greenwhite.exporter.oauth2;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import uz.greenwhite.exporter.metrics.ExporterMetrics;
import uz.greenwhite.exporter.notification.NotificationService;
import uz.greenwhite.exporter.oauth2.client.OAuth2Client;
import uz.greenwhite.exporter.oauth2.store.CredentialStore;
import uz.greenwhite.exporter.oauth2.store.FileCredentialStore;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Configuration
public class OAuth2Config {

    private final OAuth2Properties properties;
    private final Map<String, OAuth2Client> oAuth2ClientMap;

    public OAuth2Config(OAuth2Properties properties, List<OAuth2Client> oAuth2Clients) {
        this.properties = properties;
        this.oAuth2ClientMap = oAuth2Clients.stream()
                .collect(Collectors.toMap(OAuth2Client::getName, Function.identity()));
    }

    /**
     * The token client selected by exporter.oauth2.type
     */
    public OAuth2Client resolveClient() {
        OAuth2Client client = oAuth2ClientMap.get(properties.getType());
        if (client == null) {
            throw new IllegalStateException(
                    String.format("Invalid OAuth2 client type '%s'. Available types: %s",
                            properties.getType(), oAuth2ClientMap.keySet()));
        }
        return client;
    }

    @Bean
    public CredentialStore credentialStore(ObjectMapper objectMapper, ExporterMetrics metrics) {
        return new FileCredentialStore(Path.of(properties.getStateFile()), objectMapper, metrics);
    }

    @Bean
    public TokenManager tokenManager(CredentialStore credentialStore,
                                     ExporterMetrics metrics,
                                     NotificationService notificationService,
                                     Clock clock) {
        OAuth2Client client = resolveClient();
        log.info("OAuth2 configured: type={}, available={}", client.getName(), oAuth2ClientMap.keySet());
        return new TokenManager(client, credentialStore, properties, metrics, notificationService, clock);
    }

    @Bean
    public AuthorizationFlowService authorizationFlowService(TokenManager tokenManager,
                                                             ExporterMetrics metrics,
                                                             Clock clock) {
        return new AuthorizationFlowService(tokenManager, resolveClient(), properties, metrics, clock);
    }
}
