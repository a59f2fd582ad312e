package io.cronlattice.core.config;

import com.google.inject.Inject;
import com.fasterxml.jackson.databind.ObjectMapper;

public class ConfigFactory
{
    private final ObjectMapper objectMapper;

    @Inject
    public ConfigFactory(ObjectMapper objectMapper)
    {
        this.objectMapper = objectMapper;
    }

    public Config create()
    {
        return new Config(objectMapper);
    }
}
