package org.opensase.upo.mcp;

import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.spec.McpSchema;
import io.modelcontextprotocol.spec.McpServerTransportProvider;
import org.opensase.upo.PolicyOrchestrator;
import org.opensase.upo.UpoSettings;
import org.opensase.upo.adapter.CompiledConfig;
import org.opensase.upo.adapter.TargetKind;
import org.opensase.upo.apply.ApplyPlan;
import org.opensase.upo.apply.JsonFileTargetClient;
import org.opensase.upo.apply.TargetException;
import org.opensase.upo.graph.NormalizedPolicyGraph;
import org.opensase.upo.graph.ResolutionException;
import org.opensase.upo.intent.ValidationResult;
import org.opensase.upo.model.IntentPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds and returns a configured MCP server for a UPO intent policy.
 */
public final class UpoServer {

    private static final Logger log = LoggerFactory.getLogger(UpoServer.class);

    private UpoServer() {}

    // ── Internal helpers (package-private for tests) ──────────────────────────────

    /**
     * Holds the static resource list and per-URI read handlers built from a policy.
     * Package-private so tests can invoke handlers directly without a transport.
     */
    record ResourceSet(
        String policyName,
        List<McpSchema.Resource> resources,
        Map<String, ResourceHandler> handlers
    ) {}

    @FunctionalInterface
    interface ResourceHandler {
        McpSchema.ReadResourceResult handle(String uri);
    }

    /**
     * Validates, resolves and compiles the policy and builds all resources and their read
     * handlers. An invalid policy still gets its index and validation report; an ambiguous one
     * gets a graph resource describing the conflict.
     *
     * @param stateDir directory of emulated target state; plan resources are added only when set
     */
    static ResourceSet buildResources(Path policyPath, Path stateDir, UpoSettings settings) throws IOException {
        try (PolicyOrchestrator orchestrator = new PolicyOrchestrator(settings)) {
            ValidationResult validation = orchestrator.validate(policyPath);
            IntentPolicy policy = validation.policy();
            String name = policy != null ? policy.name() : stem(policyPath);
            String version = policy != null ? policy.metadata().version() : null;
            String slug = UpoMapper.policySlug(name);

            List<McpSchema.Resource> resources = new ArrayList<>();
            Map<String, ResourceHandler> handlers = new LinkedHashMap<>();

            // ── index and validation ──────────────────────────────────────────────────
            resources.add(UpoMapper.indexResource(slug));
            resources.add(UpoMapper.validationResource(slug));
            put(handlers, UpoMapper.validationUri(slug), UpoMapper.validationJson(validation));

            // ── graph and compiled configs ────────────────────────────────────────────
            if (policy != null) {
                resources.add(UpoMapper.graphResource(slug));
                try {
                    NormalizedPolicyGraph graph = orchestrator.resolve(policy);
                    put(handlers, UpoMapper.graphUri(slug), UpoMapper.graphJson(graph));

                    Map<TargetKind, CompiledConfig> configs = orchestrator.compile(policy);
                    for (CompiledConfig config : configs.values()) {
                        resources.add(UpoMapper.compiledResource(slug, config.target()));
                        put(handlers, UpoMapper.compiledUri(slug, config.target()), UpoMapper.compiledJson(config));
                        if (stateDir != null) {
                            resources.add(UpoMapper.planResource(slug, config.target()));
                            handlers.put(UpoMapper.planUri(slug, config.target()),
                                    uri -> readPlan(uri, config, stateDir, settings));
                        }
                    }
                } catch (ResolutionException e) {
                    put(handlers, UpoMapper.graphUri(slug), UpoMapper.errorJson(e.getMessage(), e.location()));
                }
            }

            String index = UpoMapper.indexJson(name, version, validation, resources);
            handlers.put(UpoMapper.indexUri(slug), uri -> text(uri, index));
            return new ResourceSet(name, resources, handlers);
        }
    }

    /** Plans are read on every request, so they follow the emulated state as it changes. */
    private static McpSchema.ReadResourceResult readPlan(String uri, CompiledConfig config, Path stateDir,
                                                         UpoSettings settings) {
        try (PolicyOrchestrator orchestrator = new PolicyOrchestrator(settings)) {
            ApplyPlan plan = orchestrator.plan(config, new JsonFileTargetClient(config.target(), stateDir));
            return text(uri, UpoMapper.planJson(plan));
        } catch (TargetException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static void put(Map<String, ResourceHandler> handlers, String uri, String json) {
        handlers.put(uri, u -> text(u, json));
    }

    private static McpSchema.ReadResourceResult text(String uri, String json) {
        return new McpSchema.ReadResourceResult(
            List.of(new McpSchema.TextResourceContents(uri, UpoMapper.JSON, json, null)),
            null
        );
    }

    private static String stem(Path path) {
        String file = path.getFileName().toString();
        int dot = file.lastIndexOf('.');
        return dot > 0 ? file.substring(0, dot) : file;
    }

    // ── Public factory ────────────────────────────────────────────────────────────

    /**
     * Builds the resources for the policy at {@code policyPath} and returns a configured
     * MCP sync server ready to accept connections.
     *
     * @param policyPath path to the intent YAML
     * @param stateDir   emulated target state for plan resources, or {@code null}
     * @param transport  MCP transport provider (e.g. StdioServerTransportProvider)
     */
    public static McpSyncServer createServer(
            Path policyPath,
            Path stateDir,
            UpoSettings settings,
            McpServerTransportProvider transport) throws IOException {

        ResourceSet rs = buildResources(policyPath, stateDir, settings);
        String slug = UpoMapper.policySlug(rs.policyName());
        log.info("Serving policy '{}' with {} resource(s); start with {}",
            rs.policyName(), rs.resources().size(), UpoMapper.indexUri(slug));

        McpSyncServer server = McpServer.sync(transport)
            .serverInfo("upo-" + slug, "0.1.0")
            .capabilities(McpSchema.ServerCapabilities.builder()
                .resources(null, null)
                .build())
            .build();

        for (McpSchema.Resource resource : rs.resources()) {
            ResourceHandler handler = rs.handlers().get(resource.uri());
            server.addResource(new McpServerFeatures.SyncResourceSpecification(
                resource,
                (exchange, request) -> handler.handle(request.uri())
            ));
        }

        return server;
    }
}
