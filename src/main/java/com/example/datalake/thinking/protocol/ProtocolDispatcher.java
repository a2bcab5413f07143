package com.example.datalake.thinking.protocol;

import com.example.datalake.thinking.config.ThinkingProperties;
import com.example.datalake.thinking.session.SessionHandle;
import com.example.datalake.thinking.session.SessionStore;
import com.example.datalake.thinking.tool.SequentialThinkingTool;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Routes inbound JSON-RPC frames to the tool and answers the handful of lifecycle methods a
 * client needs. Calls always apply to the session the connection is bound to.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProtocolDispatcher {

  public static final String PROTOCOL_VERSION = "2024-11-05";

  static final String INITIALIZE = "initialize";
  static final String INITIALIZED = "notifications/initialized";
  static final String PING = "ping";
  static final String TOOLS_LIST = "tools/list";
  static final String TOOLS_CALL = "tools/call";

  private final SequentialThinkingTool tool;
  private final SessionStore sessionStore;
  private final ThinkingProperties properties;

  /**
   * Handles one inbound frame. Completes empty when the frame needs no reply (notifications and
   * replies to our own pings).
   */
  public Mono<JsonRpcMessage> dispatch(JsonRpcMessage message, SessionHandle session) {
    return Mono.fromCallable(() -> handle(message, session))
        .onErrorResume(ex -> {
          log.error("Unexpected failure while dispatching {} for session {}",
              message.method(), session.id(), ex);
          if (message.id() == null) {
            return Mono.empty();
          }
          return Mono.just(JsonRpcMessage.error(message.id(),
              JsonRpcError.of(JsonRpcError.INTERNAL_ERROR, "Internal error: " + ex.getMessage())));
        });
  }

  private JsonRpcMessage handle(JsonRpcMessage message, SessionHandle session) {
    if (!JsonRpcMessage.VERSION.equals(message.jsonrpc())) {
      return invalidRequest(message, "Unsupported jsonrpc version: " + message.jsonrpc());
    }
    if (message.isResponse()) {
      log.debug("Ignoring reply {} on session {}", message.id(), session.id());
      return null;
    }
    if (message.method() == null) {
      return invalidRequest(message, "Missing method");
    }
    if (message.isNotification()) {
      if (!INITIALIZED.equals(message.method())) {
        log.debug("Ignoring notification {} on session {}", message.method(), session.id());
      }
      return null;
    }

    log.debug("Dispatching {} (id={}) on session {}", message.method(), message.id(), session.id());
    return switch (message.method()) {
      case INITIALIZE -> JsonRpcMessage.result(message.id(), initializeResult(message.params()));
      case PING -> JsonRpcMessage.result(message.id(), Map.of());
      case TOOLS_LIST -> JsonRpcMessage.result(message.id(), Map.of("tools", List.of(tool.definition())));
      case TOOLS_CALL -> callTool(message, session);
      default -> JsonRpcMessage.error(message.id(),
          JsonRpcError.of(JsonRpcError.METHOD_NOT_FOUND, "Method not found: " + message.method()));
    };
  }

  private Map<String, Object> initializeResult(Map<String, Object> params) {
    Object requested = params == null ? null : params.get("protocolVersion");
    Map<String, Object> result = new LinkedHashMap<>();
    result.put("protocolVersion", requested instanceof String version ? version : PROTOCOL_VERSION);
    result.put("capabilities", Map.of("tools", Map.of("listChanged", false)));
    result.put("serverInfo", Map.of(
        "name", properties.getServer().getName(),
        "version", properties.getServer().getVersion()));
    return result;
  }

  @SuppressWarnings("unchecked")
  private JsonRpcMessage callTool(JsonRpcMessage message, SessionHandle session) {
    Map<String, Object> params = message.params() == null ? Map.of() : message.params();
    Object name = params.get("name");
    if (!SequentialThinkingTool.NAME.equals(name)) {
      return JsonRpcMessage.error(message.id(),
          JsonRpcError.of(JsonRpcError.INVALID_PARAMS, "Unknown tool: " + name));
    }
    if (!(params.get("arguments") instanceof Map<?, ?> arguments)) {
      return JsonRpcMessage.error(message.id(),
          JsonRpcError.of(JsonRpcError.INVALID_PARAMS, "Missing arguments for " + name));
    }

    sessionStore.touch(session.id());
    return JsonRpcMessage.result(message.id(),
        tool.call(session.session(), (Map<String, Object>) arguments));
  }

  private static JsonRpcMessage invalidRequest(JsonRpcMessage message, String reason) {
    return JsonRpcMessage.error(message.id(), JsonRpcError.of(JsonRpcError.INVALID_REQUEST, reason));
  }
}
