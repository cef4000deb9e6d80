package org.opensase.upo.apply;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import org.opensase.upo.adapter.NativeObject;
import org.opensase.upo.adapter.TargetKind;
import org.opensase.upo.util.JsonCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Target reached over a JSON HTTP API:
 *
 * <pre>
 * GET    {base}/state                  -> [{"kind": ..., "name": ..., "spec": {...}}, ...]
 * POST   {base}/objects/{kind}/{name}  body: spec
 * PUT    {base}/objects/{kind}/{name}  body: spec
 * DELETE {base}/objects/{kind}/{name}
 * </pre>
 *
 * Any non-2xx answer is a {@link TargetException}.
 */
public class HttpTargetClient implements TargetClient {

    private static final Logger log = LoggerFactory.getLogger(HttpTargetClient.class);
    private static final TypeReference<List<Map<String, Object>>> ENTRIES = new TypeReference<>() {};

    private final TargetKind target;
    private final String baseUrl;
    private final Duration timeout;
    private final HttpClient httpClient;

    public HttpTargetClient(TargetKind target, String baseUrl, Duration timeout) {
        this.target = target;
        this.baseUrl = normalizeUrl(baseUrl);
        this.timeout = timeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
    }

    @Override
    public TargetKind target() {
        return target;
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<NativeObject> readState() throws TargetException {
        String body = send(request("/state").GET().build());
        try {
            List<NativeObject> out = new ArrayList<>();
            for (Map<String, Object> entry : JsonCodec.mapper().readValue(body, ENTRIES)) {
                out.add(new NativeObject((String) entry.get("kind"), (String) entry.get("name"),
                        (Map<String, Object>) entry.get("spec")));
            }
            return out;
        } catch (JsonProcessingException | ClassCastException e) {
            throw new TargetException(target, "unreadable state from " + baseUrl, e);
        }
    }

    @Override
    public void add(NativeObject object) throws TargetException {
        send(request(objectPath(object)).POST(specBody(object)).build());
    }

    @Override
    public void modify(NativeObject object) throws TargetException {
        send(request(objectPath(object)).PUT(specBody(object)).build());
    }

    @Override
    public void remove(NativeObject object) throws TargetException {
        send(request(objectPath(object)).DELETE().build());
    }

    private HttpRequest.Builder request(String path) {
        return HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json");
    }

    private HttpRequest.BodyPublisher specBody(NativeObject object) throws TargetException {
        try {
            return HttpRequest.BodyPublishers.ofString(JsonCodec.writeString(object.spec()), StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new TargetException(target, "cannot encode " + object.id(), e);
        }
    }

    private String send(HttpRequest request) throws TargetException {
        log.debug("{} {} {}", target, request.method(), request.uri());
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new TargetException(target, request.method() + " " + request.uri() + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TargetException(target, request.method() + " " + request.uri() + " interrupted", e);
        }
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new TargetException(target, request.method() + " " + request.uri() + " returned HTTP " + status
                    + (response.body().isBlank() ? "" : ": " + response.body()));
        }
        return response.body();
    }

    private static String objectPath(NativeObject object) {
        return "/objects/" + encode(object.kind()) + "/" + encode(object.name());
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static String normalizeUrl(String baseUrl) {
        String u = baseUrl.trim();
        return u.endsWith("/") ? u.substring(0, u.length() - 1) : u;
    }
}
