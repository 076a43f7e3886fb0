package com.mcpforge.wikiagent.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI wikipediaAgentOpenApi(@Value("${app.name:wikipedia-agent}") String name,
                                         @Value("${app.version:dev}") String version) {
        return new OpenAPI()
                .info(new Info()
                        .title(name)
                        .description("POST a topic, get back the lead summary of the matching Wikipedia article")
                        .version(version)
                        .license(new License()
                                .name("Wikipedia content: CC BY-SA 4.0")
                                .url("https://creativecommons.org/licenses/by-sa/4.0/")));
    }
}
