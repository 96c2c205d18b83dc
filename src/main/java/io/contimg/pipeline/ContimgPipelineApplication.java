package io.contimg.pipeline;

import io.contimg.pipeline.config.PipelineConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Environment;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * The main entry point for the continuum imaging pipeline.
 * <p>
 * Besides auto-configuration this enables:
 * <ul>
 *     <li>{@link EnableConfigurationProperties}: binds "app.pipeline" properties to {@link PipelineConfig}.</li>
 *     <li>{@link EnableScheduling}: the detection monitor loop, abandonment, lock heartbeat and stale-lock sweep.</li>
 *     <li>{@link EnableRetry}: {@code @Retryable} reads from the imaging engine.</li>
 * </ul>
 */
@Slf4j
@EnableScheduling
@SpringBootApplication
@EnableJpaRepositories(basePackages = "io.contimg.pipeline.repository")
@EnableConfigurationProperties(value = PipelineConfig.class)
@EnableRetry
public class ContimgPipelineApplication {

    public static void main(final String[] args) {
        log.info("Starting ContimgPipelineApplication...");

        final ConfigurableApplicationContext context = SpringApplication.run(ContimgPipelineApplication.class, args);
        final Environment env = context.getEnvironment();

        log.info("------------------------------------------------------------------");
        log.info("Application '{}' is now running!", env.getProperty("spring.application.name", "contimg-pipeline"));
        log.info("  - Local:      http://localhost:{}", env.getProperty("server.port", "8080"));
        log.info("  - Profile(s): {}", String.join(", ", env.getActiveProfiles().length > 0
                ? env.getActiveProfiles()
                : new String[]{"default"}));
        log.info("------------------------------------------------------------------");
    }
}
