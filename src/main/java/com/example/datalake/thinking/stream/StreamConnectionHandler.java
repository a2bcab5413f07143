package com.example.datalake.thinking.stream;

import com.example.datalake.thinking.protocol.JsonRpcMessage;
import com.example.datalake.thinking.protocol.ProtocolDispatcher;
import com.example.datalake.thinking.session.SessionHandle;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.codec.ServerSentEvent;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SignalType;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

/**
 * Binds one SSE connection to a thinking session for its whole lifetime.
 *
 * <p>While established, two activities share the outbound channel: the primary loop, which
 * dispatches inbound frames one at a time and writes the replies, and the {@link HeartbeatLoop}.
 * When the primary loop ends, for whatever reason, the heartbeat is stopped and its
 * cancellation awaited before the outbound stream is completed and the connection reports
 * closed. The bound session stays in the store so a client can reconnect to it.
 */
@Slf4j
public class StreamConnectionHandler {

  public static final String ENDPOINT_EVENT = "endpoint";
  public static final String SESSION_EVENT = "session";
  public static final String MESSAGE_EVENT = "message";

  private final String connectionId;
  private final SessionHandle session;
  private final ProtocolDispatcher dispatcher;
  private final Scheduler dispatchScheduler;
  private final SinkOutboundChannel outbound = new SinkOutboundChannel();
  private final HeartbeatLoop heartbeat;

  private final Sinks.Many<JsonRpcMessage> inbound = Sinks.many().unicast().onBackpressureBuffer();
  private final Sinks.Empty<Void> closed = Sinks.empty();
  private final AtomicReference<ConnectionState> state =
      new AtomicReference<>(ConnectionState.CONNECTING);

  public StreamConnectionHandler(String connectionId, SessionHandle session,
      ProtocolDispatcher dispatcher, Duration heartbeatInterval, Scheduler heartbeatScheduler,
      Scheduler dispatchScheduler) {
    this.connectionId = connectionId;
    this.session = session;
    this.dispatcher = dispatcher;
    this.dispatchScheduler = dispatchScheduler;
    this.heartbeat = new HeartbeatLoop(connectionId, outbound, heartbeatInterval, heartbeatScheduler);
  }

  public String getConnectionId() {
    return connectionId;
  }

  public SessionHandle getSession() {
    return session;
  }

  public ConnectionState getState() {
    return state.get();
  }

  public HeartbeatLoop getHeartbeat() {
    return heartbeat;
  }

  /** Frames to stream to the client, in write order. Completes when the connection closes. */
  public Flux<ServerSentEvent<?>> events() {
    return outbound.frames();
  }

  /**
   * Moves to ESTABLISHED: announces where to post inbound frames and which session is bound,
   * then starts the primary loop and the heartbeat.
   */
  public void establish(String messagePath) {
    if (!state.compareAndSet(ConnectionState.CONNECTING, ConnectionState.ESTABLISHED)) {
      throw new IllegalStateException("Connection " + connectionId + " is " + state.get());
    }

    outbound.send(ServerSentEvent.builder(messagePath + "?connection_id=" + connectionId)
        .event(ENDPOINT_EVENT)
        .build());
    Map<String, Object> binding = new LinkedHashMap<>();
    binding.put("sessionId", session.id());
    binding.put("resumed", session.resumed());
    outbound.send(ServerSentEvent.builder(binding).event(SESSION_EVENT).build());

    heartbeat.start();

    inbound.asFlux()
        .publishOn(dispatchScheduler)
        .concatMap(message -> dispatcher.dispatch(message, session))
        .doOnNext(this::respond)
        .then()
        .doFinally(this::teardown)
        .subscribe(null, ex -> log.warn("Primary loop of connection {} failed: {}",
            connectionId, ex.getMessage()));
  }

  /**
   * Queues an inbound frame for the primary loop.
   *
   * @return false when the connection is not established and the frame was dropped
   */
  public boolean submit(JsonRpcMessage message) {
    if (state.get() != ConnectionState.ESTABLISHED) {
      return false;
    }
    synchronized (inbound) {
      return inbound.tryEmitNext(message).isSuccess();
    }
  }

  /**
   * Ends the primary loop, which triggers teardown. Completes once the connection is CLOSED.
   * Safe to call more than once and from any state.
   */
  public Mono<Void> close() {
    if (state.compareAndSet(ConnectionState.CONNECTING, ConnectionState.CLOSED)) {
      outbound.close();
      closed.tryEmitEmpty();
    } else {
      synchronized (inbound) {
        inbound.tryEmitComplete();
      }
    }
    return closed.asMono();
  }

  private void respond(JsonRpcMessage reply) {
    try {
      outbound.send(ServerSentEvent.builder(reply).event(MESSAGE_EVENT).build());
    } catch (TransportWriteException ex) {
      log.warn("Reply {} on connection {} not delivered: {}", reply.id(), connectionId,
          ex.getMessage());
      throw ex;
    }
  }

  private void teardown(SignalType signal) {
    if (!state.compareAndSet(ConnectionState.ESTABLISHED, ConnectionState.CLOSING)) {
      return;
    }
    log.debug("Connection {} closing after primary loop {}", connectionId, signal);
    heartbeat.stop()
        .doFinally(done -> {
          outbound.close();
          state.set(ConnectionState.CLOSED);
          log.info("Connection {} closed (session {}, {} pings sent)", connectionId, session.id(),
              heartbeat.sentCount());
          closed.tryEmitEmpty();
        })
        .subscribe(null, ex -> log.warn("Heartbeat of connection {} did not stop cleanly",
            connectionId, ex));
  }
}
