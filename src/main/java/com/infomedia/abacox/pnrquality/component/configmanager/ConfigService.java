package com.infomedia.abacox.pnrquality.component.configmanager;

import lombok.RequiredArgsConstructor;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

@Service
@RequiredArgsConstructor
public class ConfigService {

    public static final String PROPERTY_PREFIX = "pnrquality.";

    private final Environment environment;

    /**
     * Resolves a key against the environment, falling back to the key's default value.
     */
    public Value getValue(ConfigKey configKey) {
        String value = environment.getProperty(configKey.getProperty(), configKey.getDefaultValue());
        return new Value(configKey.getKey(), value);
    }

    public Map<String, String> getConfigurationMap() {
        Map<String, String> configuration = new LinkedHashMap<>();
        Arrays.stream(ConfigKey.values())
                .forEach(key -> configuration.put(key.getKey(), getValue(key).asString()));
        return configuration;
    }
}
