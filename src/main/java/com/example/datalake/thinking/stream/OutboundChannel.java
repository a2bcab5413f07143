package com.example.datalake.thinking.stream;

import org.springframework.http.codec.ServerSentEvent;

/**
 * The single write path of a connection. Implementations serialize concurrent senders so frames
 * never interleave.
 */
public interface OutboundChannel {

  /**
   * Writes one frame.
   *
   * @throws TransportWriteException if the channel is closed or the frame cannot be emitted
   */
  void send(ServerSentEvent<?> frame);

  /** Completes the stream; later sends fail. Idempotent. */
  void close();
}
