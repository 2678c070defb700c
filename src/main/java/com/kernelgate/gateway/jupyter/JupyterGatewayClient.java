package com.kernelgate.gateway.jupyter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.kernelgate.core.model.ConnectionOptions;
import com.kernelgate.core.model.FailureKind;
import com.kernelgate.core.model.KernelModel;
import com.kernelgate.core.model.KernelSpec;
import com.kernelgate.core.model.SessionModel;
import com.kernelgate.core.model.StartSessionRequest;
import com.kernelgate.gateway.GatewayClient;
import com.kernelgate.gateway.GatewayException;
import com.kernelgate.gateway.GatewaySession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.net.http.WebSocket;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletionException;

/**
 * {@link GatewayClient} for the Jupyter server / kernel gateway REST API.
 *
 * <p>Spec discovery and session management go over HTTP with {@link HttpClient};
 * kernels are reached through the {@code /api/kernels/{id}/channels} WebSocket.
 * Only the connection is opened here, the kernel messaging protocol is left to
 * whoever owns the resulting {@link GatewaySession}.
 *
 * <p>Failures are classified into a {@link FailureKind} right here, so callers
 * never inspect raw payloads.
 */
public class JupyterGatewayClient implements GatewayClient {

    private static final Logger log = LoggerFactory.getLogger(JupyterGatewayClient.class);

    static final String TIMEOUT_MARKER = "ETIMEDOUT";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public JupyterGatewayClient(HttpClient httpClient, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<KernelSpec> getKernelSpecs(ConnectionOptions options) {
        var root = send(options, "GET", "/api/kernelspecs", null);
        var specs = new ArrayList<KernelSpec>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.path("kernelspecs").fields();
        while (fields.hasNext()) {
            var entry = fields.next();
            var node = entry.getValue();
            var spec = node.path("spec");
            specs.add(new KernelSpec(
                    node.path("name").asText(entry.getKey()),
                    textOrNull(spec, "display_name"),
                    textOrNull(spec, "language")));
        }
        log.debug("Gateway {} reported {} kernel specs", options.baseUrl(), specs.size());
        return specs;
    }

    @Override
    public List<SessionModel> listSessions(ConnectionOptions options) {
        var root = send(options, "GET", "/api/sessions", null);
        if (!root.isArray()) {
            throw GatewayException.transport("Session listing is not a JSON array", null);
        }
        var sessions = new ArrayList<SessionModel>();
        for (JsonNode node : root) {
            sessions.add(parseSession(node));
        }
        return sessions;
    }

    @Override
    public GatewaySession connectToSession(String sessionId, ConnectionOptions options) {
        var model = parseSession(send(options, "GET", "/api/sessions/" + encode(sessionId), null));
        return openKernelChannel(model, options);
    }

    @Override
    public GatewaySession startSession(StartSessionRequest request) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("path", request.path());
        body.put("type", "notebook");
        body.put("name", "");
        body.putObject("kernel").put("name", request.kernelName());

        var model = parseSession(send(request.options(), "POST", "/api/sessions", body.toString()));
        log.info("Started session {} with kernel '{}'", model.id(), request.kernelName());
        return openKernelChannel(model, request.options());
    }

    GatewaySession openKernelChannel(SessionModel model, ConnectionOptions options) {
        if (model.kernel() == null || model.kernel().id() == null) {
            throw new GatewayException(FailureKind.STRUCTURED, GatewayException.NO_STATUS, null,
                    "Session " + model.id() + " has no kernel");
        }
        URI target = channelsUri(options, model.kernel().id());
        WebSocket.Builder builder = httpClient.newWebSocketBuilder();
        if (options.webSocketFactory() != null) {
            builder = options.webSocketFactory().configure(builder, target);
        }
        try {
            WebSocket socket = builder.buildAsync(target, new KernelChannelListener(model.kernel().id())).join();
            log.info("Connected to kernel {} of session {}", model.kernel().id(), model.id());
            return new JupyterGatewaySession(model, options, socket, this);
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw classifyIoFailure(cause, "Kernel channel connection failed for session " + model.id());
        }
    }

    static URI channelsUri(ConnectionOptions options, String kernelId) {
        var uri = new StringBuilder(trimTrailingSlash(options.webSocketBase().toString()))
                .append("/api/kernels/").append(encode(kernelId))
                .append("/channels?session_id=").append(UUID.randomUUID());
        if (options.token() != null) {
            uri.append("&token=").append(encode(options.token()));
        }
        return URI.create(uri.toString());
    }

    private JsonNode send(ConnectionOptions options, String method, String path, String body) {
        URI uri = URI.create(trimTrailingSlash(options.baseUrl()) + path);
        HttpRequest.Builder builder = options.httpRequestFactory() != null
                ? options.httpRequestFactory().newRequest(uri)
                : HttpRequest.newBuilder(uri);
        options.requestHeaders().forEach(builder::setHeader);
        if (options.token() != null) {
            builder.setHeader("Authorization", "token " + options.token());
        }
        if (body != null) {
            builder.header("Content-Type", "application/json");
            builder.method(method, HttpRequest.BodyPublishers.ofString(body));
        } else {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw GatewayException.transport("Interrupted during " + method + " " + path, e);
        } catch (IOException e) {
            throw classifyIoFailure(e, method + " " + path + " failed");
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw classifyStatus(status, response.body(), method + " " + path);
        }
        try {
            return objectMapper.readTree(response.body() == null ? "" : response.body());
        } catch (JsonProcessingException e) {
            throw GatewayException.transport("Malformed response from " + method + " " + path, e);
        }
    }

    static GatewayException classifyStatus(int status, String body, String call) {
        String message = call + " returned HTTP " + status;
        if (status == 403) {
            return new GatewayException(FailureKind.PERMISSION_DENIED, status, body, message);
        }
        if (body != null && body.contains(TIMEOUT_MARKER)) {
            return new GatewayException(FailureKind.TIMEOUT, status, body, message);
        }
        return new GatewayException(FailureKind.STRUCTURED, status, body, message);
    }

    static GatewayException classifyIoFailure(Throwable failure, String message) {
        String payload = failure.toString();
        if (failure instanceof HttpTimeoutException || payload.contains(TIMEOUT_MARKER)) {
            return new GatewayException(FailureKind.TIMEOUT, GatewayException.NO_STATUS, payload, message, failure);
        }
        // Refused connections are ambiguous: several gateways answer bad credentials this way.
        if (failure instanceof ConnectException) {
            return new GatewayException(FailureKind.STRUCTURED, GatewayException.NO_STATUS, payload, message, failure);
        }
        return GatewayException.transport(message, failure);
    }

    private static SessionModel parseSession(JsonNode node) {
        KernelModel kernel = null;
        var kernelNode = node.path("kernel");
        if (kernelNode.isObject()) {
            kernel = new KernelModel(textOrNull(kernelNode, "id"), textOrNull(kernelNode, "name"));
        }
        return new SessionModel(
                textOrNull(node, "id"),
                textOrNull(node, "path"),
                textOrNull(node.path("notebook"), "path"),
                kernel);
    }

    private static String textOrNull(JsonNode node, String field) {
        var value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static String trimTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
