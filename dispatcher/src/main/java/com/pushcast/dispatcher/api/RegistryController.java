package com.pushcast.dispatcher.api;

import com.pushcast.dispatcher.api.dto.TokenRegistrationRequest;
import com.pushcast.dispatcher.api.dto.TokenResponse;
import com.pushcast.dispatcher.api.dto.TopicSubscriptionRequest;
import com.pushcast.dispatcher.model.InvalidPayloadException;
import com.pushcast.dispatcher.registry.TargetRegistry;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST API for device tokens and topic membership.
 *
 * POST   /registry/tokens                — register (or move) a device token
 * DELETE /registry/tokens/{token}        — forget a token and its subscriptions
 * POST   /registry/topics/subscribe      — add tokens to a topic
 * POST   /registry/topics/unsubscribe    — remove tokens from a topic
 * GET    /registry/tokens/{token}/topics — topics a token belongs to
 */
@RestController
@RequestMapping("/registry")
public class RegistryController {

    private final TargetRegistry registry;

    public RegistryController(TargetRegistry registry) {
        this.registry = registry;
    }

    @PostMapping("/tokens")
    public ResponseEntity<TokenResponse> register(@RequestBody TokenRegistrationRequest req) {
        TokenResponse body = TokenResponse.from(registry.registerToken(req.token(), req.userId(), req.platform()));
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    @DeleteMapping("/tokens/{token}")
    public Map<String, Object> remove(@PathVariable String token) {
        return Map.of("removed", registry.removeToken(token));
    }

    @PostMapping("/topics/subscribe")
    public Map<String, Object> subscribe(@RequestBody TopicSubscriptionRequest req) {
        return Map.of("topic", req.topic(), "subscribed", registry.subscribe(tokens(req), req.topic()));
    }

    @PostMapping("/topics/unsubscribe")
    public Map<String, Object> unsubscribe(@RequestBody TopicSubscriptionRequest req) {
        return Map.of("topic", req.topic(), "unsubscribed", registry.unsubscribe(tokens(req), req.topic()));
    }

    @GetMapping("/tokens/{token}/topics")
    public Map<String, Object> topics(@PathVariable String token) {
        return Map.of("token", token, "topics", registry.topicsOf(token));
    }

    private static List<String> tokens(TopicSubscriptionRequest req) {
        if (req.tokens() == null || req.tokens().isEmpty() || req.topic() == null) {
            throw new InvalidPayloadException("tokens and topic are required");
        }
        return req.tokens();
    }
}
