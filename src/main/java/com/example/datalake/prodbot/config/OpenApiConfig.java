package com.example.datalake.prodbot.config;

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
        title = "ProdBot API",
        version = "v1",
        description = "Product questions in Swedish: structured commands and free-text chat over the product corpus."
    ),
    servers = {
        @Server(url = "/", description = "Default server")
    }
)
public class OpenApiConfig {

  @Bean
  public OpenAPI prodBotOpenAPI() {
    return new OpenAPI()
        .info(new io.swagger.v3.oas.models.info.Info()
            .title("ProdBot API")
            .version("v1")
            .description("Chat sessions, engine statistics and conversation state.")
            .license(new License().name("Apache 2.0")));
  }

  @Bean
  public GroupedOpenApi chatApi() {
    return GroupedOpenApi.builder()
        .group("chat")
        .packagesToScan("com.example.datalake.prodbot.controller")
        .pathsToMatch("/v1/**")
        .build();
  }
}
