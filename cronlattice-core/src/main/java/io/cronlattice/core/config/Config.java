package io.cronlattice.core.config;

import java.util.List;
import java.util.Map;
import com.google.common.base.Optional;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import static java.util.Locale.ENGLISH;

/**
 * Tree of configuration parameters backed by a Jackson ObjectNode.
 *
 * System configuration is flat: keys such as {@code scheduler.lock_lease}
 * are stored as single field names. Values are converted to the requested
 * type on read, so a property file value "30s" can be read as a
 * {@link DurationParam} and "3" as an int.
 */
public class Config
{
    private final ObjectMapper mapper;
    private final ObjectNode object;

    Config(ObjectMapper mapper)
    {
        this.mapper = mapper;
        this.object = new ObjectNode(JsonNodeFactory.instance);
    }

    public Config set(String key, Object v)
    {
        if (v == null) {
            remove(key);
        }
        else {
            object.set(key, writeObject(v));
        }
        return this;
    }

    public Config remove(String key)
    {
        object.remove(key);
        return this;
    }

    private JsonNode writeObject(Object obj)
    {
        try {
            return mapper.readTree(mapper.writeValueAsString(obj));
        }
        catch (Exception ex) {
            Throwables.throwIfUnchecked(ex);
            throw new ConfigException(ex);
        }
    }

    public List<String> getKeys()
    {
        return ImmutableList.copyOf(object.fieldNames());
    }

    public boolean has(String key)
    {
        return object.has(key);
    }

    public <E> E get(String key, Class<E> type)
    {
        return get(key, mapper.getTypeFactory().constructType(type));
    }

    @SuppressWarnings("unchecked")
    private <E> E get(String key, JavaType type)
    {
        JsonNode value = object.get(key);
        if (value == null) {
            throw new ConfigException("Parameter '" + key + "' is required but not set");
        }
        else if (value.isNull()) {
            throw new ConfigException("Parameter '" + key + "' is required but null");
        }
        return (E) readObject(type, value, key);
    }

    public <E> E get(String key, Class<E> type, E defaultValue)
    {
        JsonNode value = object.get(key);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        return readObject(mapper.getTypeFactory().constructType(type), value, key);
    }

    public <E> Optional<E> getOptional(String key, Class<E> type)
    {
        JsonNode value = object.get(key);
        if (value == null || value.isNull()) {
            return Optional.absent();
        }
        return Optional.of(readObject(mapper.getTypeFactory().constructType(type), value, key));
    }

    private <E> E readObject(JavaType type, JsonNode value, String key)
    {
        try {
            return mapper.readValue(mapper.treeAsTokens(value), type);
        }
        catch (Exception ex) {
            if (ex instanceof ConfigException) {
                throw (ConfigException) ex;
            }
            String message = String.format(ENGLISH, "Expected %s for key '%s' but got %s (%s)",
                    typeNameOf(type), key, jsonSample(value), value.getNodeType().toString().toLowerCase(ENGLISH));
            throw new ConfigException(message, ex);
        }
    }

    private static String typeNameOf(JavaType type)
    {
        Class<?> raw = type.getRawClass();
        if (raw.equals(String.class)) {
            return "string type";
        }
        else if (raw.equals(int.class) || raw.equals(Integer.class)) {
            return "integer (int) type";
        }
        else if (raw.equals(long.class) || raw.equals(Long.class)) {
            return "integer (long) type";
        }
        else if (raw.equals(boolean.class) || raw.equals(Boolean.class)) {
            return "'true' or 'false'";
        }
        else if (raw.equals(DurationParam.class)) {
            return "duration (like '30s' or '1h 30m')";
        }
        else if (List.class.isAssignableFrom(raw)) {
            return "array type";
        }
        else if (Map.class.isAssignableFrom(raw)) {
            return "object type";
        }
        return type.toString();
    }

    private static String jsonSample(JsonNode value)
    {
        String json = value.toString();
        if (json.length() < 100) {
            return json;
        }
        else {
            return json.substring(0, 97) + "...";
        }
    }

    @Override
    public String toString()
    {
        return object.toString();
    }

    @Override
    public boolean equals(Object other)
    {
        if (!(other instanceof Config)) {
            return false;
        }
        return object.equals(((Config) other).object);
    }

    @Override
    public int hashCode()
    {
        return object.hashCode();
    }
}
