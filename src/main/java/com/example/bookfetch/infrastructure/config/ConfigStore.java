package com.example.bookfetch.infrastructure.config;

import java.util.Optional;

/**
 * Read-only key-value view of runtime settings.
 */
public interface ConfigStore {

    Optional<String> get(String key);
}
