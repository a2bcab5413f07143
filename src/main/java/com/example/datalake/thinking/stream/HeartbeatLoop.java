package com.example.datalake.thinking.stream;

import com.example.datalake.thinking.protocol.JsonRpcMessage;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.codec.ServerSentEvent;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

/**
 * Writes a reply-less ping frame to a connection at a fixed interval so idle intermediaries keep
 * the stream open. A failed write is logged and the next tick tries again; only {@link #stop()}
 * ends the loop.
 *
 * <p>Ticks and cancellation share one monitor: once {@code stop()} has been subscribed, no tick
 * is running and none will write again.
 */
@Slf4j
public class HeartbeatLoop {

  static final String PING_METHOD = "ping";

  private final String connectionId;
  private final OutboundChannel channel;
  private final Duration interval;
  private final Scheduler scheduler;
  private final Sinks.Empty<Void> stopped = Sinks.empty();
  private final AtomicLong sent = new AtomicLong();

  private Disposable task;
  private boolean cancelled;
  private volatile boolean terminated;

  public HeartbeatLoop(String connectionId, OutboundChannel channel, Duration interval,
      Scheduler scheduler) {
    if (interval == null || interval.isZero() || interval.isNegative()) {
      throw new IllegalArgumentException("interval must be positive");
    }
    this.connectionId = connectionId;
    this.channel = channel;
    this.interval = interval;
    this.scheduler = scheduler;
  }

  public synchronized void start() {
    if (task != null || cancelled) {
      return;
    }
    task = Flux.interval(interval, interval, scheduler)
        .doFinally(signal -> {
          terminated = true;
          stopped.tryEmitEmpty();
        })
        .subscribe(tick -> beat(),
            ex -> log.error("Heartbeat loop for connection {} failed", connectionId, ex));
  }

  /** Cancels the loop; completes once the loop has acknowledged the cancellation. */
  public Mono<Void> stop() {
    return Mono.defer(() -> {
      cancel();
      return stopped.asMono();
    });
  }

  public long sentCount() {
    return sent.get();
  }

  public boolean isTerminated() {
    return terminated;
  }

  private synchronized void cancel() {
    if (cancelled) {
      return;
    }
    cancelled = true;
    if (task == null) {
      terminated = true;
      stopped.tryEmitEmpty();
    } else {
      task.dispose();
    }
  }

  private synchronized void beat() {
    if (cancelled) {
      return;
    }
    String pingId = "ping-" + UUID.randomUUID();
    try {
      channel.send(pingFrame(pingId));
      sent.incrementAndGet();
      log.debug("Sent {} on connection {}", pingId, connectionId);
    } catch (TransportWriteException ex) {
      log.warn("Heartbeat {} on connection {} not delivered: {}", pingId, connectionId, ex.getMessage());
    }
  }

  static ServerSentEvent<JsonRpcMessage> pingFrame(String pingId) {
    return ServerSentEvent.builder(JsonRpcMessage.request(pingId, PING_METHOD, null))
        .event(StreamConnectionHandler.MESSAGE_EVENT)
        .build();
  }
}
