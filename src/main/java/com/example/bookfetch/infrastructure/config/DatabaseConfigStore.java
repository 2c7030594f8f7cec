package com.example.bookfetch.infrastructure.config;

import com.example.bookfetch.infrastructure.persistence.mapper.ConfigurationMapper;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class DatabaseConfigStore implements ConfigStore {

    private static final Logger log = LoggerFactory.getLogger(DatabaseConfigStore.class);

    private final ConfigurationMapper configurationMapper;

    public DatabaseConfigStore(ConfigurationMapper configurationMapper) {
        this.configurationMapper = configurationMapper;
    }

    @Override
    public Optional<String> get(String key) {
        try {
            String value = configurationMapper.selectValue(key);
            if (value == null || value.trim().isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(value.trim());
        } catch (RuntimeException e) {
            log.warn("Config read failed, falling back to defaults, key={}", key, e);
            return Optional.empty();
        }
    }
}
