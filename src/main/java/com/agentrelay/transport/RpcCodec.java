package com.agentrelay.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Set;

import static com.agentrelay.transport.CommunicationException.Kind.PROTOCOL_ERROR;
import static com.agentrelay.transport.CommunicationException.Kind.REMOTE_ERROR;

/**
 * JSON-RPC 2.0 envelope for the {@code task.delegate} method.
 */
public final class RpcCodec {

    public static final String METHOD = "task.delegate";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Set<Integer> TRANSIENT_STATUS = Set.of(502, 503, 504);

    private RpcCodec() {}

    public static String encode(String taskText, String correlationId, long id) {
        var req = MAPPER.createObjectNode();
        req.put("jsonrpc", "2.0");
        req.put("method", METHOD);
        var params = req.putObject("params");
        params.put("task_text", taskText);
        params.put("correlation_id", correlationId);
        req.put("id", id);
        try {
            return MAPPER.writeValueAsString(req);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode delegation request", e);
        }
    }

    public static String decode(int status, String body, long expectedId) {
        JsonNode root = null;
        if (body != null && body.trim().startsWith("{")) {
            try {
                root = MAPPER.readTree(body);
            } catch (JsonProcessingException e) {
                if (status / 100 == 2) {
                    throw new CommunicationException(PROTOCOL_ERROR, "malformed JSON response", false, e);
                }
            }
        }

        if (root != null && root.hasNonNull("error")) {
            var err = root.get("error");
            var code = err.path("code").asInt(0);
            var message = err.path("message").asText("Unknown error");
            throw new CommunicationException(REMOTE_ERROR, "agent returned error " + code + ": " + message, false, null);
        }
        if (status / 100 != 2) {
            throw new CommunicationException(PROTOCOL_ERROR, "HTTP " + status + ": " + truncate(body),
                    TRANSIENT_STATUS.contains(status), null);
        }
        if (root == null) {
            throw new CommunicationException(PROTOCOL_ERROR, "response is not a JSON object", false, null);
        }

        var id = root.get("id");
        if (id != null && !id.isNull() && id.asLong(-1) != expectedId) {
            throw new CommunicationException(PROTOCOL_ERROR,
                    "response id " + id + " does not match request id " + expectedId, false, null);
        }
        var result = root.get("result");
        if (result != null && result.isTextual()) return result.asText();
        if (result == null || !result.path("text").isTextual()) {
            throw new CommunicationException(PROTOCOL_ERROR, "response has no result.text", false, null);
        }
        return result.get("text").asText();
    }

    private static String truncate(String s) {
        if (s == null) return "";
        return s.length() > 200 ? s.substring(0, 200) + "..." : s;
    }
}
