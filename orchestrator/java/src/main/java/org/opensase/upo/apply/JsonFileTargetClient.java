package org.opensase.upo.apply;

import com.fasterxml.jackson.core.type.TypeReference;
import org.opensase.upo.adapter.NativeObject;
import org.opensase.upo.adapter.TargetKind;
import org.opensase.upo.util.JsonCodec;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Emulated target persisted as {@code <stateDir>/<target>.json}, so that plan and apply can
 * be exercised across CLI runs without a live control plane. Each mutation rewrites the file.
 */
public class JsonFileTargetClient implements TargetClient {

    private static final TypeReference<List<Map<String, Object>>> ENTRIES = new TypeReference<>() {};

    private final TargetKind target;
    private final Path file;

    public JsonFileTargetClient(TargetKind target, Path stateDir) {
        this.target = target;
        this.file = stateDir.resolve(target.id() + ".json");
    }

    public Path file() {
        return file;
    }

    @Override
    public TargetKind target() {
        return target;
    }

    @Override
    public synchronized List<NativeObject> readState() throws TargetException {
        return new ArrayList<>(load().values());
    }

    @Override
    public synchronized void add(NativeObject object) throws TargetException {
        Map<String, NativeObject> state = load();
        if (state.putIfAbsent(object.id(), object) != null) {
            throw new TargetException(target, object.id() + " already exists");
        }
        store(state);
    }

    @Override
    public synchronized void modify(NativeObject object) throws TargetException {
        Map<String, NativeObject> state = load();
        if (state.replace(object.id(), object) == null) {
            throw new TargetException(target, object.id() + " does not exist");
        }
        store(state);
    }

    @Override
    public synchronized void remove(NativeObject object) throws TargetException {
        Map<String, NativeObject> state = load();
        if (state.remove(object.id()) == null) {
            throw new TargetException(target, object.id() + " does not exist");
        }
        store(state);
    }

    @SuppressWarnings("unchecked")
    private Map<String, NativeObject> load() throws TargetException {
        Map<String, NativeObject> state = new LinkedHashMap<>();
        if (!Files.exists(file)) {
            return state;
        }
        try {
            List<Map<String, Object>> entries = JsonCodec.mapper().readValue(file.toFile(), ENTRIES);
            for (Map<String, Object> entry : entries) {
                NativeObject object = new NativeObject((String) entry.get("kind"), (String) entry.get("name"),
                        (Map<String, Object>) entry.get("spec"));
                state.put(object.id(), object);
            }
            return state;
        } catch (IOException | ClassCastException e) {
            throw new TargetException(target, "cannot read state file " + file, e);
        }
    }

    private void store(Map<String, NativeObject> state) throws TargetException {
        List<Map<String, Object>> entries = new ArrayList<>();
        for (NativeObject object : state.values()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("kind", object.kind());
            entry.put("name", object.name());
            entry.put("spec", object.spec());
            entries.add(entry);
        }
        try {
            Files.createDirectories(file.getParent());
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            Files.writeString(tmp, JsonCodec.writePretty(entries), StandardCharsets.UTF_8);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new TargetException(target, "cannot write state file " + file, e);
        }
    }
}
