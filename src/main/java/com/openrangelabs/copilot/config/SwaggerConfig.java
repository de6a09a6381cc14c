package com.openrangelabs.copilot.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Configuration for OpenAPI 3 / Swagger documentation.
 *
 * @author OpenRange Labs
 * @version 1.0
 */
@Configuration
public class SwaggerConfig {

    @Value("${server.port:8080}")
    private String serverPort;

    /**
     * Configures the OpenAPI specification for the connector service.
     *
     * @return configured OpenAPI instance
     */
    @Bean
    public OpenAPI copilotConnectorsOpenAPI() {
        return new OpenAPI()
                .info(apiInfo())
                .servers(List.of(new Server()
                        .url("http://localhost:" + serverPort)
                        .description("Local development server")))
                .addSecurityItem(new SecurityRequirement().addList("bearerAuth"))
                .components(securityComponents());
    }

    private Info apiInfo() {
        return new Info()
                .title("Copilot CRM Connectors API")
                .description("""
                # Copilot CRM Connectors

                Agent tools over a sales CRM and a marketing-automation system.

                ## Tool results

                Every tool invocation returns a JSON object whose `status` field is
                `success`, `not_found` or `error`. Connector failures are reported in
                that object, not as HTTP errors.

                ## Security

                All endpoints except health and documentation require a JWT with the
                ADMIN or USER role.
                """)
                .version("0.1.0")
                .contact(new Contact()
                        .name("OpenRange Labs Development Team")
                        .email("dev@openrangelabs.com")
                        .url("https://openrangelabs.com"))
                .license(new License()
                        .name("Proprietary")
                        .url("https://openrangelabs.com/license"));
    }

    private Components securityComponents() {
        return new Components()
                .addSecuritySchemes("bearerAuth", new SecurityScheme()
                        .type(SecurityScheme.Type.HTTP)
                        .scheme("bearer")
                        .bearerFormat("JWT")
                        .description("JWT token obtained from authentication service"));
    }
}
