package com.example.compliance.orchestrator.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Contact;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.servers.Server;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.License;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
    info = @Info(
        title = "Validation Orchestrator API",
        version = "v1",
        description = "Indexing callbacks, requirement result intake and session status streaming.",
        contact = @Contact(name = "Compliance Platform Team", email = "platform@compliance.local")
    ),
    servers = {
        @Server(url = "/", description = "Default server")
    }
)
public class OpenApiConfig {

  @Bean
  public OpenAPI baseOpenAPI() {
    return new OpenAPI()
        .info(new io.swagger.v3.oas.models.info.Info()
            .title("Validation Orchestrator API")
            .version("v1")
            .description("Session lifecycle from document indexing to aggregated requirement results.")
            .license(new License().name("Apache 2.0")));
  }

  @Bean
  public GroupedOpenApi orchestratorApi() {
    return GroupedOpenApi.builder()
        .group("orchestrator")
        .packagesToScan("com.example.compliance.orchestrator.controller")
        .pathsToMatch("/api/v1/**")
        .build();
  }

  @Bean
  public GroupedOpenApi healthApi() {
    return GroupedOpenApi.builder()
        .group("health")
        .pathsToMatch("/health/**", "/health")
        .build();
  }
}
