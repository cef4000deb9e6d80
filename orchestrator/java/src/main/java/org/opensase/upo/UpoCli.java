package org.opensase.upo;

import org.opensase.upo.adapter.CapabilityTable;
import org.opensase.upo.adapter.CompiledConfig;
import org.opensase.upo.adapter.TargetAdapter;
import org.opensase.upo.adapter.TargetKind;
import org.opensase.upo.apply.ApplyPlan;
import org.opensase.upo.apply.ApplyReport;
import org.opensase.upo.apply.ApplyResult;
import org.opensase.upo.apply.CancellationSignal;
import org.opensase.upo.apply.JsonFileTargetClient;
import org.opensase.upo.apply.TargetClient;
import org.opensase.upo.apply.TargetException;
import org.opensase.upo.graph.ResolutionException;
import org.opensase.upo.intent.ValidationException;
import org.opensase.upo.intent.ValidationResult;
import org.opensase.upo.model.IntentPolicy;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Command-line interface for UPO.
 *
 * <pre>
 * Usage: upo validate &lt;policy.yaml&gt;
 *        upo compile  &lt;policy.yaml&gt; [--target t] [--output dir]
 *        upo plan     &lt;policy.yaml&gt; [--target t] [--state-dir dir]
 *        upo apply    &lt;policy.yaml&gt; [--target t] [--state-dir dir] [--dry-run]
 *        upo adapters
 *        upo init     [policy.yaml]
 * </pre>
 *
 * Without {@code --state-dir}, plan and apply talk to the targets' HTTP APIs at the
 * configured URLs; with it, each target is emulated by a JSON file in that directory.
 */
public class UpoCli {

    static final String USAGE = String.join("\n",
            "Usage: upo <command> [options]",
            "  validate <policy.yaml>                      check a policy document",
            "  compile  <policy.yaml> [--target t] [--output dir]",
            "  plan     <policy.yaml> [--target t] [--state-dir dir]",
            "  apply    <policy.yaml> [--target t] [--state-dir dir] [--dry-run]",
            "  adapters                                    list targets and their capabilities",
            "  init     [policy.yaml]                      write a sample policy");

    private final PrintStream out;
    private final PrintStream err;
    private final UpoSettings settings;

    UpoCli(PrintStream out, PrintStream err, UpoSettings settings) {
        this.out = out;
        this.err = err;
        this.settings = settings;
    }

    public static void main(String[] args) {
        int code;
        try {
            code = new UpoCli(System.out, System.err, UpoSettings.fromEnv()).run(args);
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            code = 1;
        }
        System.exit(code);
    }

    /** Options shared by the commands; positional arguments land in {@code file}. */
    static final class Options {
        Path file;
        Path output = Path.of("compiled");
        Path stateDir;
        List<TargetKind> targets = List.of(TargetKind.values());
        boolean dryRun;

        static Options parse(String[] args, int from) {
            Options o = new Options();
            for (int i = from; i < args.length; i++) {
                switch (args[i]) {
                    case "--dry-run" -> o.dryRun = true;
                    case "--output", "-o" -> o.output = Path.of(value(args, ++i, "--output"));
                    case "--state-dir" -> o.stateDir = Path.of(value(args, ++i, "--state-dir"));
                    case "--target", "-t" -> {
                        String id = value(args, ++i, "--target");
                        o.targets = List.of(TargetKind.fromId(id).orElseThrow(() ->
                                new IllegalArgumentException("unknown target '" + id + "' (expected one of "
                                        + List.of(TargetKind.values()) + ")")));
                    }
                    default -> {
                        if (args[i].startsWith("-")) {
                            throw new IllegalArgumentException("unknown option " + args[i]);
                        }
                        o.file = Path.of(args[i]);
                    }
                }
            }
            return o;
        }

        private static String value(String[] args, int i, String option) {
            if (i >= args.length) {
                throw new IllegalArgumentException(option + " needs a value");
            }
            return args[i];
        }
    }

    int run(String[] args) {
        if (args.length < 1) {
            err.println(USAGE);
            return 1;
        }
        Options options = Options.parse(args, 1);
        return switch (args[0]) {
            case "validate" -> validate(options);
            case "compile" -> withPolicy(options, this::compile);
            case "plan" -> withPolicy(options, this::plan);
            case "apply" -> withPolicy(options, this::apply);
            case "adapters" -> adapters();
            case "init" -> init(options.file != null ? options.file : Path.of("upo-policy.yaml"));
            default -> {
                err.println("Unknown command: " + args[0]);
                err.println(USAGE);
                yield 1;
            }
        };
    }

    @FunctionalInterface
    private interface PolicyCommand {
        int run(PolicyOrchestrator orchestrator, IntentPolicy policy, Options options) throws IOException;
    }

    private int withPolicy(Options options, PolicyCommand command) {
        if (!requireFile(options)) {
            return 1;
        }
        try (PolicyOrchestrator orchestrator = new PolicyOrchestrator(settings)) {
            IntentPolicy policy = orchestrator.load(options.file);
            return command.run(orchestrator, policy, options);
        } catch (ValidationException e) {
            err.println("Validation failed — " + e.issues().size() + " error(s):");
            e.issues().forEach(i -> err.println("  • " + i));
            return 1;
        } catch (ResolutionException e) {
            err.println("Resolution failed: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private boolean requireFile(Options options) {
        if (options.file == null) {
            err.println("Error: no policy file given");
            err.println(USAGE);
            return false;
        }
        if (!Files.exists(options.file)) {
            err.println("Error: file not found: " + options.file);
            return false;
        }
        return true;
    }

    // ── validate ──

    private int validate(Options options) {
        if (!requireFile(options)) {
            return 1;
        }
        try (PolicyOrchestrator orchestrator = new PolicyOrchestrator(settings)) {
            ValidationResult result = orchestrator.validate(options.file);
            result.warnings().forEach(w -> err.println("  ⚠ " + w));
            if (!result.isValid()) {
                err.println("Validation failed — " + result.errors().size() + " error(s):");
                result.errors().forEach(e -> err.println("  • " + e));
                return 1;
            }
            IntentPolicy policy = result.policy();
            out.printf("✓ %s is valid — policy '%s' v%s, %d identit%s, %d application(s), %d segment(s), %d rule(s)%n",
                    options.file,
                    policy.name(),
                    policy.metadata().version(),
                    policy.identities().size(),
                    policy.identities().size() == 1 ? "y" : "ies",
                    policy.applications().size(),
                    policy.segments().size(),
                    policy.egressRules().size());
            return 0;
        } catch (IOException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    // ── compile ──

    private int compile(PolicyOrchestrator orchestrator, IntentPolicy policy, Options options) throws IOException {
        Map<TargetKind, CompiledConfig> configs = orchestrator.compile(policy, options.targets);
        Files.createDirectories(options.output);
        boolean failed = false;
        for (CompiledConfig config : configs.values()) {
            Path file = options.output.resolve(config.target().id() + extension(config.target()));
            Files.writeString(file, config.rendered());
            out.printf("%s %s: %d object(s), %d rule(s) -> %s%n",
                    config.hasErrors() ? "✗" : "✓", config.target(), config.objects().size(),
                    config.rules().size(), file);
            failed |= printCapabilities(config);
        }
        return failed ? 1 : 0;
    }

    private static String extension(TargetKind target) {
        return target == TargetKind.OPNSENSE ? ".nft" : ".json";
    }

    private boolean printCapabilities(CompiledConfig config) {
        config.capabilityGaps().forEach(g -> out.println("  ⚠ gap " + g.ruleId() + ": " + g.detail()));
        config.capabilityErrors().forEach(e -> err.println("  • error " + e));
        return config.hasErrors();
    }

    // ── plan / apply ──

    private Map<TargetKind, TargetClient> clients(PolicyOrchestrator orchestrator, Options options) {
        Map<TargetKind, TargetClient> clients = new EnumMap<>(TargetKind.class);
        for (TargetKind target : options.targets) {
            clients.put(target, options.stateDir != null
                    ? new JsonFileTargetClient(target, options.stateDir)
                    : orchestrator.httpClient(target));
        }
        return clients;
    }

    private int plan(PolicyOrchestrator orchestrator, IntentPolicy policy, Options options) {
        Map<TargetKind, CompiledConfig> configs = orchestrator.compile(policy, options.targets);
        Map<TargetKind, TargetClient> clients = clients(orchestrator, options);
        boolean failed = false;
        for (CompiledConfig config : configs.values()) {
            try {
                ApplyPlan plan = orchestrator.plan(config, clients.get(config.target()));
                out.printf("%s: %d operation(s)%n", config.target(), plan.operations().size());
                plan.operations().forEach(op -> out.println("  " + op.index() + ". " + op.describe()));
                failed |= printCapabilities(config);
            } catch (TargetException e) {
                err.println(config.target() + ": " + e.getMessage());
                failed = true;
            }
        }
        return failed ? 1 : 0;
    }

    private int apply(PolicyOrchestrator orchestrator, IntentPolicy policy, Options options) {
        Map<TargetKind, CompiledConfig> configs = orchestrator.compile(policy, options.targets);
        CancellationSignal signal = new CancellationSignal();
        Thread hook = new Thread(signal::cancel);
        Runtime.getRuntime().addShutdownHook(hook);
        ApplyReport report;
        try {
            report = orchestrator.apply(configs, clients(orchestrator, options), options.dryRun, signal);
        } finally {
            Runtime.getRuntime().removeShutdownHook(hook);
        }
        for (ApplyResult result : report.results()) {
            out.printf("%s %s: %s, %d applied, %d not attempted%n",
                    result.isSuccess() ? "✓" : "✗", result.target(), result.status().value(),
                    result.applied().size(), result.notAttempted());
            if (options.dryRun) {
                result.planned().forEach(op -> out.println("  would " + op.describe()));
            }
            if (result.failed() != null) {
                err.println("  • failed: " + result.failed().describe());
            }
            if (result.error() != null) {
                err.println("  • " + result.error());
            }
            printCapabilities(configs.get(result.target()));
        }
        return report.isSuccess() ? 0 : 1;
    }

    // ── adapters / init ──

    private int adapters() {
        try (PolicyOrchestrator orchestrator = new PolicyOrchestrator(settings)) {
            for (TargetAdapter adapter : orchestrator.adapters()) {
                CapabilityTable c = adapter.capabilities();
                out.printf("%-9s %s%n", adapter.target().id(), adapter.target().description());
                out.printf("          url: %s%n", settings.targetUrl(adapter.target()));
                out.printf("          inspection: %s; sources: %s; destinations: %s; actions: %s%n",
                        join(c.inspectionLevels()), join(c.sourceKinds()), join(c.destinationKinds()), join(c.actions()));
            }
        }
        return 0;
    }

    private static String join(Collection<? extends Enum<?>> values) {
        List<String> names = new ArrayList<>();
        for (Enum<?> v : values) {
            names.add(v.name().toLowerCase());
        }
        return names.stream().sorted().collect(Collectors.joining(","));
    }

    private int init(Path file) {
        if (Files.exists(file)) {
            err.println("Error: " + file + " already exists");
            return 1;
        }
        try (InputStream sample = UpoCli.class.getResourceAsStream("sample-intent.yaml")) {
            if (sample == null) {
                err.println("Error: sample policy missing from the classpath");
                return 1;
            }
            Files.write(file, sample.readAllBytes());
        } catch (IOException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
        out.println("✓ wrote sample policy to " + file);
        return 0;
    }
}
