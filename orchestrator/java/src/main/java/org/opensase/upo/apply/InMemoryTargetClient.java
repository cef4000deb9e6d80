package org.opensase.upo.apply;

import org.opensase.upo.adapter.NativeObject;
import org.opensase.upo.adapter.TargetKind;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Emulated target holding its objects in memory. Rejects adds of existing objects and
 * modifications or removals of missing ones, the way a real control plane API does.
 * A failure predicate lets callers inject target errors.
 */
public class InMemoryTargetClient implements TargetClient {

    private final TargetKind target;
    private final Map<String, NativeObject> objects = new LinkedHashMap<>();
    private final List<String> calls = new ArrayList<>();
    private Predicate<NativeObject> failWhen = o -> false;

    public InMemoryTargetClient(TargetKind target) {
        this.target = target;
    }

    public InMemoryTargetClient(TargetKind target, Collection<NativeObject> initial) {
        this(target);
        for (NativeObject object : initial) {
            objects.put(object.id(), object);
        }
    }

    /** Makes every mutation of an object matching {@code predicate} fail. */
    public synchronized InMemoryTargetClient failWhen(Predicate<NativeObject> predicate) {
        this.failWhen = predicate;
        return this;
    }

    /** Makes the {@code n}-th mutation (1-based) fail, counting from now. */
    public synchronized InMemoryTargetClient failOnMutation(int n) {
        int[] seen = {0};
        return failWhen(o -> ++seen[0] == n);
    }

    @Override
    public TargetKind target() {
        return target;
    }

    @Override
    public synchronized List<NativeObject> readState() {
        return List.copyOf(objects.values());
    }

    @Override
    public synchronized void add(NativeObject object) throws TargetException {
        mutate("add", object);
        if (objects.containsKey(object.id())) {
            throw new TargetException(target, object.id() + " already exists");
        }
        objects.put(object.id(), object);
    }

    @Override
    public synchronized void modify(NativeObject object) throws TargetException {
        mutate("modify", object);
        if (!objects.containsKey(object.id())) {
            throw new TargetException(target, object.id() + " does not exist");
        }
        objects.put(object.id(), object);
    }

    @Override
    public synchronized void remove(NativeObject object) throws TargetException {
        mutate("remove", object);
        if (objects.remove(object.id()) == null) {
            throw new TargetException(target, object.id() + " does not exist");
        }
    }

    /** Every mutation attempted so far, as {@code "<verb> <kind>/<name>"}. */
    public synchronized List<String> calls() {
        return List.copyOf(calls);
    }

    private void mutate(String verb, NativeObject object) throws TargetException {
        calls.add(verb + " " + object.id());
        if (failWhen.test(object)) {
            throw new TargetException(target, verb + " " + object.id() + " rejected");
        }
    }
}
