package com.example.datalake.thinking.controller;

import com.example.datalake.thinking.protocol.JsonRpcError;
import com.example.datalake.thinking.protocol.JsonRpcMessage;
import com.example.datalake.thinking.stream.ConnectionRegistry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@Tag(name = "Streaming transport", description = "SSE event stream plus the endpoint for posting inbound frames")
@RequiredArgsConstructor
public class StreamController {

    private final ConnectionRegistry connectionRegistry;
    private final ObjectMapper objectMapper;

    @Operation(
            summary = "Open an event stream",
            description = "Binds the stream to the session named by 'session' (or a new one) and emits endpoint, session, reply and ping events."
    )
    @GetMapping(value = "/sse", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<?>> connect(@RequestParam(value = "session", required = false) String sessionHint) {
        return connectionRegistry.open(sessionHint);
    }

    @Operation(
            summary = "Post an inbound frame",
            description = "Queues one JSON-RPC message for the connection; the reply arrives on its event stream."
    )
    @PostMapping(value = {ConnectionRegistry.MESSAGE_PATH, "/messages"}, consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Object>> post(@RequestParam("connection_id") String connectionId,
                                             @RequestBody String body) {
        JsonRpcMessage message;
        try {
            message = objectMapper.readValue(body, JsonRpcMessage.class);
        } catch (JsonProcessingException ex) {
            log.debug("Unparseable frame for connection {}: {}", connectionId, ex.getOriginalMessage());
            return Mono.just(ResponseEntity.badRequest().<Object>body(JsonRpcMessage.error(null,
                    JsonRpcError.of(JsonRpcError.PARSE_ERROR, "Parse error: " + ex.getOriginalMessage()))));
        }

        if (!connectionRegistry.deliver(connectionId, message)) {
            return Mono.just(ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .<Object>body("Could not find connection " + connectionId));
        }
        return Mono.just(ResponseEntity.accepted().<Object>body("Accepted"));
    }
}
