package io.github.sachinnimbal.filmes.core.config;

import io.github.sachinnimbal.filmes.core.enums.StorageType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "filmes")
public class FilmesProperties {

    // ==================== PAGINATION PROPERTIES ====================

    private Pagination pagination = new Pagination();

    @Data
    public static class Pagination {
        /**
         * Page size used when the client does not send one
         * Default: 10
         */
        private int defaultPageSize = 10;

        /**
         * Upper bound applied to any requested page size
         * Default: 100
         */
        private int maxPageSize = 100;
    }

    // ==================== STORAGE PROPERTIES ====================

    private Storage storage = new Storage();

    @Data
    public static class Storage {
        /**
         * Backend holding the movie records: MEMORY or JPA.
         * JPA uses the regular spring.datasource.* connection settings.
         * Default: MEMORY
         */
        private StorageType type = StorageType.MEMORY;
    }

    // ==================== API PROPERTIES ====================

    private Api api = new Api();

    @Data
    public static class Api {
        /**
         * Route prefix of the movie resource
         * Default: /resource
         */
        private String basePath = "/resource";
    }

    // ==================== LOGGING PROPERTIES ====================

    private Logging logging = new Logging();

    @Data
    public static class Logging {
        /**
         * Log one line per handled HTTP request
         * Default: true
         */
        private boolean requestsEnabled = true;
    }

    // ==================== SWAGGER/API DOCUMENTATION PROPERTIES ====================

    private Swagger swagger = new Swagger();

    @Data
    public static class Swagger {
        /**
         * Enable Swagger/OpenAPI documentation
         * Default: true
         */
        private boolean enabled = true;
    }
}
