package ch.wordgame.wordgamebackend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration for the OpenAPI / Swagger documentation.
 */
@Configuration
public class OpenApiConfig {

    /**
     * Creates the OpenAPI definition used by Swagger UI.
     *
     * @return configured {@link OpenAPI} instance with API metadata
     */
    @Bean
    public OpenAPI wordGameOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Word Game API")
                        .description("Create, join and play multiplayer word tile games")
                        .version("v1.0.0"));
    }
}
