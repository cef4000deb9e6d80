package org.opensase.upo.apply;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.opensase.upo.adapter.NativeObject;
import org.opensase.upo.adapter.TargetKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class HttpTargetClientTest {

    private HttpServer server;
    private final List<String> requests = new CopyOnWriteArrayList<>();
    private volatile int status = 200;
    private volatile String stateBody = "[]";

    @BeforeEach
    void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/api/state", exchange -> respond(exchange, stateBody));
        server.createContext("/api/objects", exchange -> {
            String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
            requests.add(exchange.getRequestMethod() + " " + exchange.getRequestURI().getRawPath()
                    + (body.isEmpty() ? "" : " " + body));
            respond(exchange, "");
        });
        server.start();
    }

    @AfterEach
    void stop() {
        server.stop(0);
    }

    private void respond(HttpExchange exchange, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        if (bytes.length > 0) {
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        }
        exchange.close();
    }

    private HttpTargetClient client() {
        return new HttpTargetClient(TargetKind.OPENZITI,
                "http://127.0.0.1:" + server.getAddress().getPort() + "/api/", Duration.ofSeconds(5));
    }

    @Test
    void readsStateEntries() throws Exception {
        stateBody = "[{\"kind\":\"service\",\"name\":\"crm\",\"spec\":{\"terminatorStrategy\":\"smartrouting\"}}]";
        List<NativeObject> state = client().readState();
        assertEquals(List.of(new NativeObject("service", "crm", Map.of("terminatorStrategy", "smartrouting"))), state);
    }

    @Test
    void mutationsMapToVerbsOnObjectPaths() throws Exception {
        HttpTargetClient client = client();
        NativeObject object = new NativeObject("dial-policy", "hq to crm", Map.of("type", "Dial"));
        client.add(object);
        client.modify(object);
        client.remove(object);
        assertEquals(List.of(
                "POST /api/objects/dial-policy/hq%20to%20crm {\"type\":\"Dial\"}",
                "PUT /api/objects/dial-policy/hq%20to%20crm {\"type\":\"Dial\"}",
                "DELETE /api/objects/dial-policy/hq%20to%20crm"), requests);
    }

    @Test
    void nonSuccessStatusIsATargetError() {
        status = 409;
        TargetException e = assertThrows(TargetException.class,
                () -> client().add(new NativeObject("service", "crm", Map.of())));
        assertTrue(e.getMessage().startsWith("openziti: POST "), e.getMessage());
        assertTrue(e.getMessage().contains("HTTP 409"), e.getMessage());
    }

    @Test
    void malformedStateIsATargetError() {
        stateBody = "{\"objects\": 1}";
        assertThrows(TargetException.class, () -> client().readState());
    }

    @Test
    void unreachableTargetIsATargetError() {
        HttpTargetClient client = new HttpTargetClient(TargetKind.OPENZITI, "http://127.0.0.1:1", Duration.ofSeconds(2));
        assertThrows(TargetException.class, client::readState);
    }
}
