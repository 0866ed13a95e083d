package io.github.sachinnimbal.filmes.core.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.util.List;

@Slf4j
@Configuration
@ConditionalOnClass(name = "org.springdoc.core.configuration.SpringDocConfiguration")
@ConditionalOnProperty(prefix = "filmes.swagger", name = "enabled", havingValue = "true", matchIfMissing = true)
public class FilmesSwaggerConfiguration {

    private final Environment environment;

    public FilmesSwaggerConfiguration(Environment environment) {
        this.environment = environment;
        log.info("✓ Filmes Swagger/OpenAPI enabled");
    }

    @Bean
    public OpenAPI filmesOpenAPI() {
        String version = environment.getProperty("filmes.version", "1.0.0");

        return new OpenAPI()
                .info(new Info()
                        .title("Filmes API")
                        .description("Paginated CRUD service for a movie catalogue.")
                        .version(version)
                        .contact(new Contact()
                                .name("Filmes API")
                                .email("sachinnimbal9@gmail.com"))
                        .license(new License()
                                .name("Apache 2.0")
                                .url("https://www.apache.org/licenses/LICENSE-2.0")))
                .servers(List.of(
                        new Server()
                                .url(getServerUrl())
                                .description("Current Server")
                ));
    }

    String getServerUrl() {
        String port = environment.getProperty("server.port", "8080");
        String contextPath = environment.getProperty("server.servlet.context-path", "");
        String host = environment.getProperty("server.address", "localhost");

        if (contextPath.endsWith("/")) {
            contextPath = contextPath.substring(0, contextPath.length() - 1);
        }

        return String.format("http://%s:%s%s", host, port, contextPath);
    }
}
