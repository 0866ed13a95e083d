package io.github.sachinnimbal.filmes.core.performance;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.FilterConfig;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;

import static io.github.sachinnimbal.filmes.core.util.TimeUtils.formatExecutionTime;

/**
 * One log line per handled request: method, URI, status and execution time.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@ConditionalOnProperty(prefix = "filmes.logging", name = "requests-enabled", havingValue = "true", matchIfMissing = true)
public class FilmesLoggingFilter implements Filter {

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        if (!(request instanceof HttpServletRequest httpRequest)
                || !(response instanceof HttpServletResponse httpResponse)) {
            chain.doFilter(request, response);
            return;
        }

        // Skip logging for static resources and Swagger UI
        String uri = httpRequest.getRequestURI();
        if (shouldSkipLogging(uri)) {
            chain.doFilter(request, response);
            return;
        }

        long startTime = System.currentTimeMillis();
        try {
            chain.doFilter(request, response);
        } finally {
            long executionTimeMs = System.currentTimeMillis() - startTime;
            String query = httpRequest.getQueryString();

            log.info("{} {}{} -> {} | {}",
                    httpRequest.getMethod(),
                    uri,
                    query != null ? "?" + query : "",
                    httpResponse.getStatus(),
                    formatExecutionTime(executionTimeMs));
        }
    }

    boolean shouldSkipLogging(String uri) {
        return uri.contains("/swagger-ui") ||
                uri.contains("/v3/api-docs") ||
                uri.contains("/webjars/") ||
                uri.endsWith(".css") ||
                uri.endsWith(".js") ||
                uri.endsWith(".png") ||
                uri.endsWith(".ico");
    }

    @Override
    public void init(FilterConfig filterConfig) {
        log.info("Filmes request logging filter initialized");
    }
}
