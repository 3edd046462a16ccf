package com.agentrelay.transport;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static com.agentrelay.transport.CommunicationException.Kind.*;
import static org.junit.jupiter.api.Assertions.*;

class RpcCodecTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void encodesDelegateEnvelope() throws Exception {
        var node = mapper.readTree(RpcCodec.encode("refund order 42", "cid-7", 3));

        assertEquals("2.0", node.get("jsonrpc").asText());
        assertEquals("task.delegate", node.get("method").asText());
        assertEquals("refund order 42", node.at("/params/task_text").asText());
        assertEquals("cid-7", node.at("/params/correlation_id").asText());
        assertEquals(3, node.get("id").asLong());
    }

    @Test
    void decodesResultText() {
        assertEquals("done", RpcCodec.decode(200, "{\"jsonrpc\":\"2.0\",\"result\":{\"text\":\"done\"},\"id\":1}", 1));
        assertEquals("plain", RpcCodec.decode(200, "{\"result\":\"plain\",\"id\":1}", 1));
    }

    @Test
    void agentErrorIsRemoteAndNotRetryable() {
        var ex = assertThrows(CommunicationException.class, () -> RpcCodec.decode(500,
                "{\"error\":{\"code\":-32000,\"message\":\"unknown order\"},\"id\":1}", 1));
        assertEquals(REMOTE_ERROR, ex.kind());
        assertFalse(ex.retryable());
        assertTrue(ex.detail().contains("unknown order"));
    }

    @Test
    void gatewayStatusesAreRetryable() {
        var unavailable = assertThrows(CommunicationException.class,
                () -> RpcCodec.decode(503, "Service Unavailable", 1));
        assertEquals(PROTOCOL_ERROR, unavailable.kind());
        assertTrue(unavailable.retryable());

        var badRequest = assertThrows(CommunicationException.class, () -> RpcCodec.decode(400, "nope", 1));
        assertFalse(badRequest.retryable());
        assertTrue(badRequest.detail().startsWith("HTTP 400"));

        var tooMany = assertThrows(CommunicationException.class, () -> RpcCodec.decode(429, "slow down", 1));
        assertFalse(tooMany.retryable());
    }

    @Test
    void rejectsMalformedOrMismatchedResponses() {
        var malformed = assertThrows(CommunicationException.class, () -> RpcCodec.decode(200, "{not json", 1));
        assertEquals(PROTOCOL_ERROR, malformed.kind());

        var wrongId = assertThrows(CommunicationException.class,
                () -> RpcCodec.decode(200, "{\"result\":{\"text\":\"x\"},\"id\":9}", 1));
        assertTrue(wrongId.detail().contains("does not match"));

        var noText = assertThrows(CommunicationException.class,
                () -> RpcCodec.decode(200, "{\"result\":{\"value\":1},\"id\":1}", 1));
        assertTrue(noText.detail().contains("result.text"));

        assertThrows(CommunicationException.class, () -> RpcCodec.decode(200, "ok", 1));
    }
}
