package org.opensase.upo.adapter;

import org.opensase.upo.apply.ApplyOrdering;
import org.opensase.upo.apply.DependencyOrdering;
import org.opensase.upo.graph.NormalizedPolicyGraph;
import org.opensase.upo.graph.ResolvedRule;
import org.opensase.upo.model.InspectionLevel;
import org.opensase.upo.util.JsonCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Shared compile loop: capability checks, inspection-level substitution and bookkeeping of
 * gaps and errors. Subclasses emit native objects for the rules that survive the checks.
 */
public abstract class AbstractTargetAdapter implements TargetAdapter {

    private static final Logger log = LoggerFactory.getLogger(AbstractTargetAdapter.class);

    private final CapabilityTable capabilities;

    protected AbstractTargetAdapter(CapabilityTable capabilities) {
        this.capabilities = capabilities;
    }

    @Override
    public CapabilityTable capabilities() {
        return capabilities;
    }

    @Override
    public ApplyOrdering ordering() {
        return new DependencyOrdering(managedKinds(), Set.of(ruleKind()), this::isBlocking);
    }

    /** Whether a rule object of this target drops traffic. */
    protected abstract boolean isBlocking(NativeObject rule);

    @Override
    public final CompiledConfig compile(NormalizedPolicyGraph graph) {
        Compilation c = new Compilation(graph);
        for (ResolvedRule rule : graph.rules()) {
            compileRule(rule, c);
        }
        emitSupportObjects(c);
        List<NativeObject> objects = c.objects();
        log.debug("{}: compiled {} rule(s) into {} object(s), {} gap(s), {} error(s)",
                target(), graph.rules().size(), objects.size(), c.gaps.size(), c.errors.size());
        return new CompiledConfig(target(), graph.policyName(), graph.policyVersion(), ruleKind(),
                objects, c.gaps, c.errors, render(graph, objects));
    }

    /**
     * Checks one rule against the capability table, substitutes its inspection level if
     * needed and hands it to {@link #emitRule}. Subclasses override to handle constructs
     * the table alone cannot decide.
     */
    protected void compileRule(ResolvedRule rule, Compilation c) {
        Optional<CapabilityError> error = checkExpressible(rule, c.graph());
        if (error.isPresent()) {
            c.error(error.get());
            return;
        }
        InspectionLevel level = rule.inspectionLevel();
        if (rule.action().permits()) {
            Optional<InspectionLevel> substitute = capabilities.substitute(level);
            if (substitute.isEmpty()) {
                c.error(new CapabilityError(rule.ruleId(), "inspection:" + level.value(),
                        target() + " supports no inspection level at or above '" + level.value() + "'"));
                return;
            }
            if (substitute.get() != level) {
                c.gap(new CapabilityGap(rule.ruleId(), CapabilityGap.Kind.INSPECTION_LEVEL, level, substitute.get(),
                        target() + " cannot enforce '" + level.value() + "'; enforcing '"
                                + substitute.get().value() + "' instead"));
                level = substitute.get();
            }
        }
        emitRule(rule, level, c);
    }

    /** Source, destination and action checks against the capability table. */
    protected Optional<CapabilityError> checkExpressible(ResolvedRule rule, NormalizedPolicyGraph graph) {
        if (!capabilities.supports(rule.source().kind())) {
            return Optional.of(unsupported(rule, "source:" + kindName(rule.source().kind()),
                    target() + " cannot match " + kindName(rule.source().kind()) + " sources"));
        }
        if (!capabilities.supports(rule.destination().kind())) {
            return Optional.of(unsupported(rule, "destination:" + kindName(rule.destination().kind()),
                    target() + " cannot match " + kindName(rule.destination().kind()) + " destinations"));
        }
        if (!capabilities.supports(rule.action())) {
            return Optional.of(unsupported(rule, "action:" + rule.action().value(),
                    target() + " cannot express '" + rule.action().value() + "'"));
        }
        return Optional.empty();
    }

    protected static CapabilityError unsupported(ResolvedRule rule, String construct, String message) {
        return new CapabilityError(rule.ruleId(), construct, message);
    }

    private static String kindName(Enum<?> kind) {
        return kind.name().toLowerCase();
    }

    /** Emits the native rule object for a rule already known to be expressible at {@code level}. */
    protected abstract void emitRule(ResolvedRule rule, InspectionLevel level, Compilation c);

    /** Emits objects the rules depend on (interfaces, aliases, services). */
    protected abstract void emitSupportObjects(Compilation c);

    protected abstract String render(NormalizedPolicyGraph graph, List<NativeObject> objects);

    /** JSON document with the objects grouped by kind, in {@link #managedKinds()} order. */
    protected String renderJson(NormalizedPolicyGraph graph, List<NativeObject> objects) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("target", target().id());
        doc.put("policy", graph.policyName());
        doc.put("version", graph.policyVersion());
        for (String kind : managedKinds()) {
            List<Map<String, Object>> entries = new ArrayList<>();
            for (NativeObject object : objects) {
                if (object.kind().equals(kind)) {
                    Map<String, Object> entry = new LinkedHashMap<>();
                    entry.put("name", object.name());
                    entry.putAll(object.spec());
                    entries.add(entry);
                }
            }
            doc.put(kind, entries);
        }
        return JsonCodec.writePretty(doc);
    }

    /**
     * Mutable state of one {@link #compile} call. Never shared between calls.
     */
    protected static final class Compilation {
        private final NormalizedPolicyGraph graph;
        private final Map<String, NativeObject> support = new LinkedHashMap<>();
        private final Map<String, NativeObject> rules = new LinkedHashMap<>();
        private final List<ResolvedRule> emitted = new ArrayList<>();
        private final List<CapabilityGap> gaps = new ArrayList<>();
        private final List<CapabilityError> errors = new ArrayList<>();

        Compilation(NormalizedPolicyGraph graph) {
            this.graph = graph;
        }

        public NormalizedPolicyGraph graph() {
            return graph;
        }

        /** Rules that produced a native object, in graph order. */
        public List<ResolvedRule> emitted() {
            return emitted;
        }

        /** Number of rule objects emitted so far. */
        public int ruleCount() {
            return rules.size();
        }

        /** Adds a rule object; a name clash gets a numeric suffix so no rule is overwritten. */
        public void addRule(ResolvedRule rule, String kind, String name, Map<String, Object> spec) {
            String unique = name;
            for (int n = 2; rules.containsKey(kind + "/" + unique); n++) {
                unique = name + "-" + n;
            }
            NativeObject object = new NativeObject(kind, unique, spec);
            rules.put(object.id(), object);
            emitted.add(rule);
        }

        /** Adds a support object; the first definition of a (kind, name) wins. */
        public void addSupport(String kind, String name, Map<String, Object> spec) {
            NativeObject object = new NativeObject(kind, name, spec);
            support.putIfAbsent(object.id(), object);
        }

        public boolean hasSupport(String kind, String name) {
            return support.containsKey(kind + "/" + name);
        }

        public void gap(CapabilityGap gap) {
            gaps.add(gap);
        }

        public void error(CapabilityError error) {
            errors.add(error);
        }

        List<NativeObject> objects() {
            List<NativeObject> out = new ArrayList<>(support.values());
            out.addAll(rules.values());
            return out;
        }
    }
}
