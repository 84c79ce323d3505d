package com.crewflow.crewflow_backend.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;
import org.springframework.web.filter.CorsFilter;

import java.util.Arrays;
import java.util.List;

/**
 * Browser origins allowed to call {@code /api/**} and to open the {@code /ws} STOMP endpoint.
 */
@Configuration
public class CorsConfig {

    private final List<String> originPatterns;

    public CorsConfig(@Value("${crewflow.cors.allowed-origins:http://localhost:3000}") String allowedOrigins) {
        this.originPatterns = Arrays.stream(allowedOrigins.split(","))
                .map(String::trim)
                .filter(origin -> !origin.isEmpty())
                .toList();
    }

    public List<String> originPatterns() {
        return originPatterns;
    }

    @Bean
    public CorsFilter corsFilter() {
        CorsConfiguration api = new CorsConfiguration();
        api.setAllowedOriginPatterns(originPatterns);
        api.setAllowedMethods(List.of("GET", "POST", "PATCH", "DELETE", "OPTIONS"));
        api.setAllowedHeaders(List.of("*"));
        api.setAllowCredentials(true);
        api.setMaxAge(3600L);

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/api/**", api);
        return new CorsFilter(source);
    }
}
