package com.ufilename.core.format;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.ufilename.core.policy.NamingException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Stable text encoding for arbitrary metadata values.
 *
 * Logically equal values always encode to the same string: map entries and
 * bean properties are written in key order and sets are written as lists
 * sorted by their own encodings.  Sequences keep their order.
 */
public final class CanonicalValueWriter {

    private static final ObjectMapper CANONICAL = JsonMapper.builder()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .findAndAddModules()
            .addModule(new SimpleModule("canonical-sets").addSerializer(new SortedSetSerializer()))
            .build();

    private CanonicalValueWriter() {}

    /**
     * @throws NamingException INVALID_METADATA when the value cannot be encoded
     */
    public static String write(Object value) {
        try {
            return CANONICAL.writeValueAsString(normalize(value));
        } catch (JsonProcessingException e) {
            throw new NamingException(NamingException.Kind.INVALID_METADATA,
                    "Cannot encode metadata value of type " + value.getClass().getName(), e);
        }
    }

    // Sets have no defined iteration order; give them one.
    private static Object normalize(Object value) throws JsonProcessingException {
        if (value instanceof Set<?> set) {
            List<Encoded> items = new ArrayList<>(set.size());
            for (Object item : set) {
                Object normalized = normalize(item);
                items.add(new Encoded(CANONICAL.writeValueAsString(normalized), normalized));
            }
            items.sort(Comparator.comparing(Encoded::json));
            return items.stream().map(Encoded::value).toList();
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : map.entrySet()) {
                copy.put(String.valueOf(e.getKey()), normalize(e.getValue()));
            }
            return copy;
        }
        if (value instanceof Collection<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(normalize(item));
            }
            return copy;
        }
        return value;
    }

    private record Encoded(String json, Object value) {}

    /** Writes any set, including one nested in a bean, as an array sorted by element encoding. */
    private static final class SortedSetSerializer extends StdSerializer<Set<?>> {

        SortedSetSerializer() {
            super(Set.class, false);
        }

        @Override
        public void serialize(Set<?> set, JsonGenerator gen, SerializerProvider provider) throws IOException {
            List<String> items = new ArrayList<>(set.size());
            for (Object item : set) {
                items.add(CANONICAL.writeValueAsString(item));
            }
            items.sort(Comparator.naturalOrder());
            gen.writeStartArray(set, items.size());
            for (String item : items) {
                gen.writeRawValue(item);
            }
            gen.writeEndArray();
        }
    }
}
