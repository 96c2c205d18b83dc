package io.contimg.pipeline.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

import java.util.Optional;

@Configuration
@Profile("!prod")
@RequiredArgsConstructor
public class OpenApiConfig {

    private final Optional<BuildProperties> buildProperties;

    @Bean
    public OpenAPI customOpenAPI() {
        String version = buildProperties.map(BuildProperties::getVersion).orElse("<NOT_FOUND>");
        String appName = buildProperties.map(BuildProperties::getName).orElse("Continuum Imaging Pipeline API");

        return new OpenAPI()
                .info(new Info().title(appName)
                        .version(version)
                        .description("""
                                Operator surface of the streaming continuum imaging pipeline.

                                * **Artifacts:** query the registry and inspect lineage of every data product.
                                * **Dead letters:** list, resolve or replay permanently failed stage invocations.
                                * **Groups:** inspect emitted and abandoned processing groups.
                                * **Circuit breakers:** current state of each guarded engine operation.

                                **Note:** replaying a dead letter re-runs the stage from scratch.
                                """));
    }
}
