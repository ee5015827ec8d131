package com.samt.configservice.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI configServiceOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Config Service API")
                        .version("1.0.0")
                        .description("""
                                Centralized dynamic configuration for SAMT services.
                                
                                ## Features
                                - Versioned configuration values with change history (last 50 changes)
                                - JSON schema validation on every write
                                - Soft delete and restore
                                - Real-time change notifications over WebSocket (`/ws/config`)
                                
                                ## Actor
                                Mutations record the `X-Actor` header (default `api_user`) as the author.
                                """)
                        .contact(new Contact()
                                .name("SAMT Backend Team")
                                .email("backend@samt.com"))
                        .license(new License()
                                .name("MIT License")
                                .url("https://opensource.org/licenses/MIT")));
    }
}
