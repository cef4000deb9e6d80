package org.opensase.upo.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.json.jackson.JacksonMcpJsonMapper;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import org.opensase.upo.UpoSettings;

import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;

/**
 * CLI entry point for upo-mcp.
 *
 * <pre>
 * Usage: upo-mcp [policy.yaml] [--state-dir dir]
 * </pre>
 */
public class UpoMcpCli {

    public static void main(String[] args) {
        Path policyPath = Path.of("upo-policy.yaml");
        Path stateDir   = null;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--state-dir" -> {
                    if (i + 1 >= args.length) {
                        System.err.println("[upo-mcp] Error: --state-dir needs a value");
                        System.exit(1);
                    }
                    stateDir = Path.of(args[++i]);
                }
                default -> {
                    if (!args[i].startsWith("-")) {
                        policyPath = Path.of(args[i]);
                    }
                }
            }
        }

        if (!policyPath.toFile().exists()) {
            System.err.println("[upo-mcp] Error: policy not found at " + policyPath);
            System.exit(1);
        }

        StdioServerTransportProvider transport =
            new StdioServerTransportProvider(new JacksonMcpJsonMapper(new ObjectMapper()));

        McpSyncServer server;
        try {
            server = UpoServer.createServer(policyPath, stateDir, UpoSettings.fromEnv(), transport);
        } catch (Exception e) {
            System.err.println("[upo-mcp] Startup error: " + e.getMessage());
            System.exit(1);
            return;
        }

        // Block the main thread; transport handles I/O on daemon threads.
        CountDownLatch latch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.close();
            latch.countDown();
        }));
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
