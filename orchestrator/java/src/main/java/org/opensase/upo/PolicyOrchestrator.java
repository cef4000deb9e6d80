package org.opensase.upo;

import org.opensase.upo.adapter.CapabilityError;
import org.opensase.upo.adapter.CompiledConfig;
import org.opensase.upo.adapter.TargetAdapter;
import org.opensase.upo.adapter.TargetAdapters;
import org.opensase.upo.adapter.TargetKind;
import org.opensase.upo.apply.ApplyOrchestrator;
import org.opensase.upo.apply.ApplyPlan;
import org.opensase.upo.apply.ApplyPlanner;
import org.opensase.upo.apply.ApplyReport;
import org.opensase.upo.apply.CancellationSignal;
import org.opensase.upo.apply.HttpTargetClient;
import org.opensase.upo.apply.TargetClient;
import org.opensase.upo.apply.TargetException;
import org.opensase.upo.graph.NormalizedPolicyGraph;
import org.opensase.upo.graph.PolicyGraphResolver;
import org.opensase.upo.intent.IntentParser;
import org.opensase.upo.intent.IntentValidator;
import org.opensase.upo.intent.ValidationException;
import org.opensase.upo.intent.ValidationResult;
import org.opensase.upo.model.IntentPolicy;
import org.opensase.upo.util.JsonCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Entry point to the pipeline: validate, resolve, compile for every target, plan and apply.
 *
 * <p>Compiles run concurrently, one task per adapter, over the same immutable graph. With the
 * cache enabled, compiled configs are reused for a policy whose canonical JSON fingerprint
 * was already compiled; results are identical either way.
 */
public class PolicyOrchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PolicyOrchestrator.class);

    private final UpoSettings settings;
    private final Map<TargetKind, TargetAdapter> adapters = new EnumMap<>(TargetKind.class);
    private final ExecutorService compileExecutor;
    private final ExecutorService applyExecutor;
    private final ApplyOrchestrator applyOrchestrator;
    private final Map<String, CompiledConfig> cache = new ConcurrentHashMap<>();

    public PolicyOrchestrator(UpoSettings settings) {
        this(settings, TargetAdapters.all(settings));
    }

    public PolicyOrchestrator(UpoSettings settings, List<TargetAdapter> adapters) {
        this.settings = settings;
        for (TargetAdapter adapter : adapters) {
            this.adapters.put(adapter.target(), adapter);
        }
        this.compileExecutor = Executors.newFixedThreadPool(settings.compileThreads());
        this.applyExecutor = Executors.newFixedThreadPool(settings.applyThreads());
        this.applyOrchestrator = new ApplyOrchestrator(applyExecutor);
    }

    public UpoSettings settings() {
        return settings;
    }

    public Collection<TargetAdapter> adapters() {
        return adapters.values();
    }

    public TargetAdapter adapter(TargetKind target) {
        TargetAdapter adapter = adapters.get(target);
        if (adapter == null) {
            throw new IllegalArgumentException("No adapter for target: " + target);
        }
        return adapter;
    }

    // ── validate ──

    /** Reads and validates a document. Malformed YAML comes back as an error at {@code $}. */
    public ValidationResult validate(Path path) throws IOException {
        try {
            return IntentValidator.validate(IntentParser.load(path));
        } catch (ValidationException e) {
            return new ValidationResult(e.issues(), List.of(), null);
        }
    }

    /**
     * @throws ValidationException when the document is malformed or invalid
     */
    public IntentPolicy load(Path path) throws IOException {
        return IntentValidator.requireValid(IntentParser.load(path));
    }

    // ── resolve / compile ──

    public NormalizedPolicyGraph resolve(IntentPolicy policy) {
        return PolicyGraphResolver.resolve(policy);
    }

    public Map<TargetKind, CompiledConfig> compile(IntentPolicy policy) {
        return compile(policy, adapters.keySet());
    }

    /**
     * Resolves once and compiles for each requested target concurrently.
     *
     * @return configs in {@link TargetKind} order
     * @throws org.opensase.upo.graph.ResolutionException when the policy is ambiguous
     */
    public Map<TargetKind, CompiledConfig> compile(IntentPolicy policy, Collection<TargetKind> targets) {
        String fingerprint = settings.cacheEnabled() ? JsonCodec.fingerprint(policy) : null;
        Map<TargetKind, CompiledConfig> out = new EnumMap<>(TargetKind.class);
        List<TargetKind> missing = new ArrayList<>();
        for (TargetKind target : targets) {
            CompiledConfig cached = fingerprint != null ? cache.get(cacheKey(fingerprint, target)) : null;
            if (cached != null) {
                log.debug("{}: compile cache hit for policy '{}'", target, policy.name());
                out.put(target, cached);
            } else {
                missing.add(target);
            }
        }
        if (missing.isEmpty()) {
            return out;
        }

        NormalizedPolicyGraph graph = resolve(policy);
        Map<TargetKind, CompletableFuture<CompiledConfig>> futures = new LinkedHashMap<>();
        for (TargetKind target : missing) {
            TargetAdapter adapter = adapter(target);
            futures.put(target, CompletableFuture
                    .supplyAsync(() -> adapter.compile(graph), compileExecutor)
                    .exceptionally(e -> failedCompile(adapter, graph, e)));
        }
        futures.forEach((target, future) -> {
            CompiledConfig config = future.join();
            if (fingerprint != null && !config.hasErrors()) {
                cache.put(cacheKey(fingerprint, target), config);
            }
            out.put(target, config);
        });
        return out;
    }

    private static CompiledConfig failedCompile(TargetAdapter adapter, NormalizedPolicyGraph graph, Throwable e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        log.error("{}: compile failed", adapter.target(), cause);
        return new CompiledConfig(adapter.target(), graph.policyName(), graph.policyVersion(), adapter.ruleKind(),
                List.of(), List.of(), List.of(new CapabilityError("*", "adapter", "compile failed: " + cause)), "");
    }

    private static String cacheKey(String fingerprint, TargetKind target) {
        return fingerprint + "/" + target.id();
    }

    // ── plan / apply ──

    public ApplyPlan plan(CompiledConfig config, TargetClient client) throws TargetException {
        return ApplyPlanner.plan(config, client.readState(), adapter(config.target()));
    }

    /** Applies each config to the client of its target, concurrently. */
    public ApplyReport apply(Map<TargetKind, CompiledConfig> configs, Map<TargetKind, TargetClient> clients,
                             boolean dryRun, CancellationSignal signal) {
        List<ApplyOrchestrator.Target> targets = new ArrayList<>();
        configs.forEach((target, config) -> {
            TargetClient client = clients.get(target);
            if (client == null) {
                throw new IllegalArgumentException("No client for target: " + target);
            }
            targets.add(new ApplyOrchestrator.Target(config, adapter(target), client));
        });
        return applyOrchestrator.applyAll(targets, dryRun, signal);
    }

    /** HTTP client for {@code target} at its configured URL. */
    public TargetClient httpClient(TargetKind target) {
        return new HttpTargetClient(target, settings.targetUrl(target), Duration.ofSeconds(settings.httpTimeoutSeconds()));
    }

    @Override
    public void close() {
        compileExecutor.shutdown();
        applyExecutor.shutdown();
    }
}
