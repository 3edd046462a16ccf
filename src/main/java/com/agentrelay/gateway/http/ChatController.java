package com.agentrelay.gateway.http;

import com.agentrelay.router.AgentRouter;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class ChatController {

    private final AgentRouter router;

    public ChatController(AgentRouter router) {
        this.router = router;
    }

    @PostMapping("/v1/chat")
    public Map<String, Object> chat(@RequestBody Map<String, String> body) {
        var message = body.getOrDefault("message", "");
        if (message.isBlank()) {
            throw new IllegalArgumentException("message must not be blank");
        }
        var result = router.route(message);
        var reply = new LinkedHashMap<String, Object>();
        reply.put("reply", result.content());
        reply.put("kind", result.kind().name());
        reply.put("agent", result.agent());
        reply.put("intent", result.intent());
        return reply;
    }
}
