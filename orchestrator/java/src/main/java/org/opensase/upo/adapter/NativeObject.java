package org.opensase.upo.adapter;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * One object in a target's native configuration, identified by (kind, name).
 *
 * <p>Spec values are restricted to strings, integers, booleans, lists and maps of those,
 * so that an object read back from a target's JSON state compares equal to the compiled one.
 */
public record NativeObject(String kind, String name, Map<String, Object> spec) {
    public NativeObject {
        spec = spec != null ? Collections.unmodifiableMap(new TreeMap<>(spec)) : Map.of();
    }

    public String id() {
        return kind + "/" + name;
    }

    public Object get(String key) {
        return spec.get(key);
    }
}
