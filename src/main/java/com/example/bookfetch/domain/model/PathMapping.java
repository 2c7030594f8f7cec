package com.example.bookfetch.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Translates a path as seen by a download client into the path this service sees.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PathMapping {

    private boolean enabled;

    private String remotePath;

    private String localPath;

    public String transform(String path) {
        if (!enabled || path == null || isBlank(remotePath) || isBlank(localPath)) {
            return path;
        }
        String normalizedPath = path.replace('\\', '/');
        String remote = trimTrailingSlash(remotePath.replace('\\', '/'));
        String local = trimTrailingSlash(localPath.replace('\\', '/'));
        if (normalizedPath.equals(remote)) {
            return local;
        }
        if (normalizedPath.startsWith(remote + "/")) {
            return local + normalizedPath.substring(remote.length());
        }
        return path;
    }

    private static String trimTrailingSlash(String value) {
        String result = value;
        while (result.length() > 1 && result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
