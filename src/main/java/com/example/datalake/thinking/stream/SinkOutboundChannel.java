package com.example.datalake.thinking.stream;

import org.springframework.http.codec.ServerSentEvent;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/** Outbound channel backed by a unicast sink whose flux becomes the SSE response body. */
public class SinkOutboundChannel implements OutboundChannel {

  private final Sinks.Many<ServerSentEvent<?>> sink = Sinks.many().unicast().onBackpressureBuffer();
  private boolean open = true;

  @Override
  public synchronized void send(ServerSentEvent<?> frame) {
    if (!open) {
      throw new TransportWriteException("Outbound channel is closed");
    }
    Sinks.EmitResult result = sink.tryEmitNext(frame);
    if (result.isFailure()) {
      throw new TransportWriteException("Frame not emitted: " + result);
    }
  }

  @Override
  public synchronized void close() {
    if (!open) {
      return;
    }
    open = false;
    sink.tryEmitComplete();
  }

  public Flux<ServerSentEvent<?>> frames() {
    return sink.asFlux();
  }
}
