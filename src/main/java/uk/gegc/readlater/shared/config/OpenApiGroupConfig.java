package uk.gegc.readlater.shared.config;

import io.swagger.v3.oas.annotations.enums.SecuritySchemeType;
import io.swagger.v3.oas.annotations.security.SecurityScheme;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * API documentation groups and the bearer scheme referenced by the controllers.
 */
@Configuration
@SecurityScheme(
        name = "Bearer Authentication",
        type = SecuritySchemeType.HTTP,
        bearerFormat = "JWT",
        scheme = "bearer"
)
public class OpenApiGroupConfig {

    @Bean
    public GroupedOpenApi libraryGroup() {
        return GroupedOpenApi.builder()
                .group("library")
                .displayName("Library Items")
                .pathsToMatch("/api/v1/library-items/**")
                .build();
    }
}
