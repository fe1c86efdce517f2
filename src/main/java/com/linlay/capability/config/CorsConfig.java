package com.linlay.capability.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.reactive.CorsWebFilter;
import org.springframework.web.cors.reactive.UrlBasedCorsConfigurationSource;

import java.util.List;

@Configuration
public class CorsConfig {

    @Bean
    public CorsWebFilter corsWebFilter(CatalogCorsProperties properties) {
        CorsConfiguration configuration = new CorsConfiguration();
        configuration.setAllowedOriginPatterns(compact(properties.getAllowedOriginPatterns()));
        configuration.setAllowedMethods(compact(properties.getAllowedMethods()));
        configuration.addAllowedHeader(CorsConfiguration.ALL);
        configuration.setAllowCredentials(false);
        configuration.setMaxAge(properties.getMaxAgeSeconds());

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration(properties.getPathPattern(), configuration);
        return new CorsWebFilter(source);
    }

    private List<String> compact(List<String> input) {
        if (input == null) {
            return List.of();
        }
        return input.stream()
                .filter(StringUtils::hasText)
                .map(String::trim)
                .toList();
    }
}
