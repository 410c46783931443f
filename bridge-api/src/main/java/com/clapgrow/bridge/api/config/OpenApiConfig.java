package com.clapgrow.bridge.api.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Value("${bridge.chatwoot.public-base-url:}")
    private String publicBaseUrl;

    @Bean
    public OpenAPI helpdeskBridgeOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Helpdesk Bridge API")
                        .description("Bridges WhatsApp conversations into Chatwoot inboxes. " +
                                "Exposes the per-tenant Chatwoot configuration endpoints and the webhook " +
                                "endpoint Chatwoot calls for agent replies.")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("ClapGrow")
                                .email("support@clapgrow.com")))
                .servers(List.of(
                        new Server().url(publicBaseUrl.isBlank() ? "/" : publicBaseUrl).description("Helpdesk Bridge")
                ));
    }
}
