package com.ospicorp.kpimonitor.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.ExternalDocumentation;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {
  static final String BEARER_SCHEME = "bearer-jwt";

  @Bean
  OpenAPI apiInfo(@Value("${security.admin.scope:kpi:refresh}") String adminScope) {
    return new OpenAPI()
        .info(new Info()
            .title("KPI Monitor API")
            .version("v1")
            .description("Daily KPI history ingestion, threshold evaluation and the serving snapshot. "
                + "Write endpoints need the '" + adminScope + "' scope when authentication is on.")
            .contact(new Contact().name("KPI Monitoring Team").email("kpi-support@example.com")))
        .servers(List.of(new Server().url("/")))
        .components(new Components().addSecuritySchemes(BEARER_SCHEME, new SecurityScheme()
            .type(SecurityScheme.Type.HTTP)
            .scheme("bearer")
            .bearerFormat("JWT")))
        .tags(List.of(
            new Tag().name("Snapshot").description("Latest alert status per metric and window"),
            new Tag().name("Metrics").description("Daily history and on-demand evaluation"),
            new Tag().name("Refresh").description("History ingestion and snapshot rebuilds")))
        .externalDocs(new ExternalDocumentation()
            .description("Alert threshold guide")
            .url("https://docs.kpi-monitor.dev/thresholds"));
  }
}
