package com.example.datalake.thinking.controller;

import com.example.datalake.thinking.session.SessionStore;
import com.example.datalake.thinking.stream.ConnectionRegistry;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

    private final SessionStore sessionStore;
    private final ConnectionRegistry connectionRegistry;

    @GetMapping
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return Mono.just(ResponseEntity.ok(Map.of(
                "status", "up",
                "sessions", sessionStore.size(),
                "connections", connectionRegistry.activeConnections())));
    }
}
