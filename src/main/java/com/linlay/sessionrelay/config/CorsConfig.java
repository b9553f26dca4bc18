package com.linlay.sessionrelay.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.reactive.CorsWebFilter;
import org.springframework.web.cors.reactive.UrlBasedCorsConfigurationSource;

import java.util.List;

/**
 * Cross-origin access for browser clients, limited to {@code agent.cors.path-pattern}.
 */
@Configuration
public class CorsConfig {

    @Bean
    public CorsWebFilter corsWebFilter(CorsProperties properties) {
        CorsConfiguration configuration = new CorsConfiguration();
        configuration.setAllowedOriginPatterns(nonBlank(properties.getAllowedOriginPatterns()));
        configuration.setAllowedMethods(nonBlank(properties.getAllowedMethods()));
        configuration.setAllowedHeaders(nonBlank(properties.getAllowedHeaders()));
        configuration.setAllowCredentials(false);
        configuration.setMaxAge(Math.max(0L, properties.getMaxAgeSeconds()));

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        String pathPattern = StringUtils.hasText(properties.getPathPattern()) ? properties.getPathPattern().trim() : "/api/**";
        source.registerCorsConfiguration(pathPattern, configuration);
        return new CorsWebFilter(source);
    }

    private static List<String> nonBlank(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .filter(StringUtils::hasText)
                .map(String::trim)
                .toList();
    }
}
