package com.example.datalake.thinking.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
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
        title = "Sequential Thinking API",
        version = "v1",
        description = "Session-aware sequential thinking tool over SSE, plus a plain REST form."
    ),
    servers = {
        @Server(url = "/", description = "Default server")
    }
)
public class OpenApiConfig {

  @Bean
  public OpenAPI baseOpenAPI(ThinkingProperties properties) {
    return new OpenAPI()
        .info(new io.swagger.v3.oas.models.info.Info()
            .title(properties.getServer().getName())
            .version(properties.getServer().getVersion())
            .description("Swagger UI for the thinking session endpoints and the SSE transport.")
            .license(new License().name("Apache 2.0")));
  }

  @Bean
  public GroupedOpenApi thinkingApi() {
    return GroupedOpenApi.builder()
        .group("thinking")
        .packagesToScan("com.example.datalake.thinking.controller")
        .build();
  }

  @Bean
  public GroupedOpenApi actuatorApi() {
    return GroupedOpenApi.builder()
        .group("actuator")
        .pathsToMatch("/actuator/**")
        .build();
  }
}
