package dev.newsroom.config;

import dev.newsroom.security.StaffIdentityFilter;
import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
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
    public OpenAPI newsroomOpenAPI() {
        final String securitySchemeName = "staffId";

        return new OpenAPI()
                .info(new Info()
                        .title("Newsroom Editorial Workflow API")
                        .description("""
                                Editorial workflow engine for the newsroom platform.

                                ## Features
                                - Story stage transitions with role-gated routing
                                - Task inbox, completion and reassignment
                                - Per-language translation assignments and review
                                - Atomic group publish of a story with its translations
                                - Pipeline, workload and SLA metrics

                                ## Identity
                                Every call carries the acting staff member in the `X-Staff-Id` header,
                                set by the upstream identity provider.
                                """)
                        .version(appVersion))
                .servers(List.of(new Server()
                        .url("http://localhost:" + serverPort)
                        .description("Development Server")))
                .addSecurityItem(new SecurityRequirement().addList(securitySchemeName))
                .components(new Components()
                        .addSecuritySchemes(securitySchemeName, new SecurityScheme()
                                .name(StaffIdentityFilter.STAFF_ID_HEADER)
                                .type(SecurityScheme.Type.APIKEY)
                                .in(SecurityScheme.In.HEADER)
                                .description("Staff id of the acting user")));
    }
}
