package com.wom.openings.config;

import io.swagger.v3.oas.models.ExternalDocumentation;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.*;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {
    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("New Openings Discovery API")
                        .description("Merges recently opened restaurants and cafes from OpenStreetMap, "
                                + "Google Places and the Finnish trade register into one scored list")
                        .version("v0.1.0")
                        .license(new License().name("Data: ODbL (OpenStreetMap), CC BY 4.0 (PRH)")))
                .externalDocs(new ExternalDocumentation().description("Swagger UI").url("/swagger-ui.html"));
    }
}
