package com.example.datalake.thinking.stream;

import com.example.datalake.thinking.config.ThinkingProperties;
import com.example.datalake.thinking.protocol.JsonRpcMessage;
import com.example.datalake.thinking.protocol.ProtocolDispatcher;
import com.example.datalake.thinking.session.SessionHandle;
import com.example.datalake.thinking.session.SessionStore;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/** Accepts streaming connections and routes posted frames to the connection they belong to. */
@Slf4j
@Component
public class ConnectionRegistry {

  public static final String MESSAGE_PATH = "/messages/";

  private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

  private final SessionStore sessionStore;
  private final ProtocolDispatcher dispatcher;
  private final ThinkingProperties properties;
  private final Scheduler heartbeatScheduler;
  private final Scheduler dispatchScheduler;
  private final Map<String, StreamConnectionHandler> connections = new ConcurrentHashMap<>();

  public ConnectionRegistry(SessionStore sessionStore,
                            ProtocolDispatcher dispatcher,
                            ThinkingProperties properties,
                            @Qualifier("heartbeatScheduler") Scheduler heartbeatScheduler,
                            @Qualifier("dispatchScheduler") Scheduler dispatchScheduler) {
    this.sessionStore = sessionStore;
    this.dispatcher = dispatcher;
    this.properties = properties;
    this.heartbeatScheduler = heartbeatScheduler;
    this.dispatchScheduler = dispatchScheduler;
  }

  /**
   * Opens a connection bound to the session named by {@code sessionHint} (or a new one). The
   * returned flux is the event stream; cancelling it tears the connection down.
   */
  public Flux<ServerSentEvent<?>> open(String sessionHint) {
    return Flux.<ServerSentEvent<?>, StreamConnectionHandler>usingWhen(
        Mono.fromCallable(() -> connect(sessionHint)),
        StreamConnectionHandler::events,
        handler -> handler.close()
            .doFinally(signal -> connections.remove(handler.getConnectionId())));
  }

  /**
   * Hands an inbound frame to its connection.
   *
   * @return false when no established connection has that id
   */
  public boolean deliver(String connectionId, JsonRpcMessage message) {
    StreamConnectionHandler handler = connections.get(connectionId);
    if (handler == null) {
      log.warn("Message posted for unknown connection {}", connectionId);
      return false;
    }
    return handler.submit(message);
  }

  public Optional<StreamConnectionHandler> find(String connectionId) {
    return Optional.ofNullable(connections.get(connectionId));
  }

  public int activeConnections() {
    return connections.size();
  }

  @PreDestroy
  public void shutdown() {
    List<StreamConnectionHandler> open = List.copyOf(connections.values());
    if (open.isEmpty()) {
      return;
    }
    log.info("Closing {} open connections", open.size());
    Flux.fromIterable(open)
        .flatMap(StreamConnectionHandler::close)
        .then()
        .block(SHUTDOWN_TIMEOUT);
  }

  StreamConnectionHandler connect(String sessionHint) {
    SessionHandle session = sessionStore.getOrCreate(sessionHint);
    if (!session.resumed() && StringUtils.hasText(sessionHint)) {
      log.warn("Session hint '{}' names no live session; bound new session {}", sessionHint,
          session.id());
    }

    String connectionId = UUID.randomUUID().toString();
    StreamConnectionHandler handler = new StreamConnectionHandler(
        connectionId,
        session,
        dispatcher,
        properties.getHeartbeat().getInterval(),
        heartbeatScheduler,
        dispatchScheduler);
    connections.put(connectionId, handler);
    handler.establish(MESSAGE_PATH);
    log.info("Connection {} established on session {} (resumed={})", connectionId, session.id(),
        session.resumed());
    return handler;
  }
}
