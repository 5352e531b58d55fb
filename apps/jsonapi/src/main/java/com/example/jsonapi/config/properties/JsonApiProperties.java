package com.example.jsonapi.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "app.jsonapi")
public record JsonApiProperties(
        String basePath,
        String roleHeader,
        Boolean freezeOnStartup,
        ErrorLoggingProperties errorLogging,
        Map<String, ResourceProperties> resources
) {
    public JsonApiProperties {
        if (basePath == null || basePath.isBlank() || "/".equals(basePath.trim())) {
            basePath = "";
        } else {
            basePath = basePath.trim();
            if (!basePath.startsWith("/")) {
                basePath = "/" + basePath;
            }
            if (basePath.endsWith("/")) {
                basePath = basePath.substring(0, basePath.length() - 1);
            }
        }
        if (roleHeader == null) {
            roleHeader = "X-Role";
        }
        if (freezeOnStartup == null) {
            freezeOnStartup = true;
        }
        if (errorLogging == null) {
            errorLogging = new ErrorLoggingProperties(true, false);
        }
        if (resources == null) {
            resources = Map.of();
        }
    }

    public record ErrorLoggingProperties(
            boolean enabled,
            boolean includeClientErrors
    ) {}

    /**
     * Role and sideload entries of one resource. Keys of {@code roles} and {@code sideload}
     * are action names; relationship maps are keyed by relationship name, then action.
     */
    public record ResourceProperties(
            Map<String, List<String>> roles,
            Map<String, Map<String, List<String>>> hasOne,
            Map<String, Map<String, List<String>>> hasMany,
            Map<String, List<String>> sideload
    ) {
        public ResourceProperties {
            if (roles == null) {
                roles = Map.of();
            }
            if (hasOne == null) {
                hasOne = Map.of();
            }
            if (hasMany == null) {
                hasMany = Map.of();
            }
            if (sideload == null) {
                sideload = Map.of();
            }
        }
    }
}
