package org.jstats.matchsync_api.core.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    OpenAPI apiInfo(@Value("${matchsync.sync.version:1.0.0}") String version) {
        return new OpenAPI()
                .info(new Info()
                        .title("MatchSync API")
                        .description("Synchronizes football fixtures from external providers into the local store.")
                        .version(version)
                        .license(new License().name("Apache 2.0")));
    }
}
