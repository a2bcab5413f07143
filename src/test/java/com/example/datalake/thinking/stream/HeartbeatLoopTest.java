package com.example.datalake.thinking.stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.datalake.thinking.protocol.JsonRpcMessage;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.codec.ServerSentEvent;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

class HeartbeatLoopTest {

  private final VirtualTimeScheduler scheduler = VirtualTimeScheduler.create();
  private final RecordingChannel channel = new RecordingChannel();

  @AfterEach
  void tearDown() {
    scheduler.dispose();
  }

  @Test
  void sendsOnePingPerInterval() {
    HeartbeatLoop loop = new HeartbeatLoop("c1", channel, Duration.ofSeconds(15), scheduler);
    loop.start();

    scheduler.advanceTimeBy(Duration.ofSeconds(14));
    assertThat(channel.frames).isEmpty();

    scheduler.advanceTimeBy(Duration.ofSeconds(1));
    assertThat(channel.frames).hasSize(1);

    scheduler.advanceTimeBy(Duration.ofSeconds(30));
    assertThat(channel.frames).hasSize(3);
    assertThat(loop.sentCount()).isEqualTo(3);

    ServerSentEvent<?> frame = channel.frames.get(0);
    assertThat(frame.event()).isEqualTo(StreamConnectionHandler.MESSAGE_EVENT);
    JsonRpcMessage ping = (JsonRpcMessage) frame.data();
    assertThat(ping.method()).isEqualTo("ping");
    assertThat(ping.isRequest()).isTrue();

    Set<Object> ids = channel.frames.stream()
        .map(f -> ((JsonRpcMessage) f.data()).id())
        .collect(Collectors.toSet());
    assertThat(ids).hasSize(3);
  }

  @Test
  void failedWriteIsSkippedAndLoopContinues() {
    channel.failuresLeft = 1;
    HeartbeatLoop loop = new HeartbeatLoop("c1", channel, Duration.ofSeconds(15), scheduler);
    loop.start();

    scheduler.advanceTimeBy(Duration.ofSeconds(30));

    assertThat(channel.frames).hasSize(1);
    assertThat(loop.sentCount()).isEqualTo(1);
    assertThat(loop.isTerminated()).isFalse();
  }

  @Test
  void noPingAfterStopCompletes() {
    HeartbeatLoop loop = new HeartbeatLoop("c1", channel, Duration.ofSeconds(15), scheduler);
    loop.start();
    scheduler.advanceTimeBy(Duration.ofSeconds(15));

    StepVerifier.create(loop.stop()).verifyComplete();
    scheduler.advanceTimeBy(Duration.ofMinutes(5));

    assertThat(loop.isTerminated()).isTrue();
    assertThat(channel.frames).hasSize(1);
  }

  @Test
  void stopBeforeStartCompletesAndStartIsThenIgnored() {
    HeartbeatLoop loop = new HeartbeatLoop("c1", channel, Duration.ofSeconds(15), scheduler);

    StepVerifier.create(loop.stop()).verifyComplete();
    loop.start();
    scheduler.advanceTimeBy(Duration.ofMinutes(1));

    assertThat(channel.frames).isEmpty();
  }

  @Test
  void rejectsNonPositiveInterval() {
    assertThatThrownBy(() -> new HeartbeatLoop("c1", channel, Duration.ZERO, scheduler))
        .isInstanceOf(IllegalArgumentException.class);
  }

  static final class RecordingChannel implements OutboundChannel {
    final List<ServerSentEvent<?>> frames = new ArrayList<>();
    int failuresLeft;

    @Override
    public synchronized void send(ServerSentEvent<?> frame) {
      if (failuresLeft > 0) {
        failuresLeft--;
        throw new TransportWriteException("broken pipe");
      }
      frames.add(frame);
    }

    @Override
    public void close() {
    }
  }
}
