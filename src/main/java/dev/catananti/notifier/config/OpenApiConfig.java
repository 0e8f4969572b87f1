package dev.catananti.notifier.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration(proxyBeanMethods = false)
public class OpenApiConfig {

    @Value("${app.version:1.0.0}")
    private String appVersion;

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI notifierOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Restaurant Notifier API")
                        .description("""
                                Local API of the restaurant notification delivery service.
                                
                                ## Features
                                - Unacknowledged notifications and counters
                                - Acknowledge one, all, or all of a type
                                - Notification actions (e.g. restock)
                                - Live store snapshots over Server-Sent Events
                                - Delivery session control (live cable with polling fallback)
                                """)
                        .version(appVersion))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local Server")));
    }
}
