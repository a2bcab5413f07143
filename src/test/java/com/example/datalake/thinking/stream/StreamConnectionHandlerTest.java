package com.example.datalake.thinking.stream;

import static com.example.datalake.thinking.support.TestFixtures.thought;
import static com.example.datalake.thinking.support.TestFixtures.toolCall;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.datalake.thinking.protocol.JsonRpcMessage;
import com.example.datalake.thinking.session.SessionHandle;
import com.example.datalake.thinking.session.SessionStore;
import com.example.datalake.thinking.support.TestFixtures;
import com.example.datalake.thinking.tool.ToolCallResult;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.codec.ServerSentEvent;
import reactor.core.Disposable;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

class StreamConnectionHandlerTest {

  private static final Duration INTERVAL = Duration.ofSeconds(15);

  private final VirtualTimeScheduler heartbeatScheduler = VirtualTimeScheduler.create();
  private final SessionStore store = new SessionStore(10);
  private final List<ServerSentEvent<?>> received = new CopyOnWriteArrayList<>();
  private final AtomicBoolean completed = new AtomicBoolean();

  private SessionHandle session;
  private StreamConnectionHandler handler;
  private Disposable subscription;

  @BeforeEach
  void setUp() {
    session = store.getOrCreate(null);
    handler = new StreamConnectionHandler("conn-1", session, TestFixtures.dispatcher(store),
        INTERVAL, heartbeatScheduler, Schedulers.immediate());
    subscription = handler.events().subscribe(received::add, ex -> { }, () -> completed.set(true));
  }

  @AfterEach
  void tearDown() {
    subscription.dispose();
    heartbeatScheduler.dispose();
  }

  @Test
  @SuppressWarnings("unchecked")
  void establishAnnouncesEndpointAndBoundSession() {
    handler.establish("/messages/");

    assertThat(handler.getState()).isEqualTo(ConnectionState.ESTABLISHED);
    assertThat(received).hasSize(2);
    assertThat(received.get(0).event()).isEqualTo(StreamConnectionHandler.ENDPOINT_EVENT);
    assertThat(received.get(0).data()).isEqualTo("/messages/?connection_id=conn-1");
    assertThat(received.get(1).event()).isEqualTo(StreamConnectionHandler.SESSION_EVENT);
    Map<String, Object> binding = (Map<String, Object>) received.get(1).data();
    assertThat(binding)
        .containsEntry("sessionId", session.id())
        .containsEntry("resumed", false);
  }

  @Test
  void establishTwiceFails() {
    handler.establish("/messages/");

    assertThatThrownBy(() -> handler.establish("/messages/"))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void repliesFollowSubmissionOrderOnTheSameStream() {
    handler.establish("/messages/");

    assertThat(handler.submit(JsonRpcMessage.request(1, "initialize", Map.of()))).isTrue();
    assertThat(handler.submit(JsonRpcMessage.notification("notifications/initialized", null))).isTrue();
    assertThat(handler.submit(toolCall(2, thought("step1", 1, 3, true)))).isTrue();
    assertThat(handler.submit(toolCall(3, thought("step2", 2, 3, true)))).isTrue();

    List<JsonRpcMessage> replies = replies();
    assertThat(replies).extracting(JsonRpcMessage::id).containsExactly(1, 2, 3);
    ToolCallResult last = (ToolCallResult) replies.get(2).result();
    assertThat(TestFixtures.readJson(last.firstText())).containsEntry("logLength", 2);
    assertThat(session.session().logLength()).isEqualTo(2);
  }

  @Test
  void heartbeatFramesInterleaveWithReplies() {
    handler.establish("/messages/");

    heartbeatScheduler.advanceTimeBy(INTERVAL);
    handler.submit(toolCall(7, thought("step1", 1, 1, false)));
    heartbeatScheduler.advanceTimeBy(INTERVAL);

    List<String> methods = received.stream()
        .skip(2)
        .map(frame -> (JsonRpcMessage) frame.data())
        .map(message -> message.method() == null ? "reply" : message.method())
        .toList();
    assertThat(methods).containsExactly("ping", "reply", "ping");
    assertThat(handler.getHeartbeat().sentCount()).isEqualTo(2);
  }

  @Test
  void closeStopsHeartbeatBeforeReportingClosed() {
    handler.establish("/messages/");
    heartbeatScheduler.advanceTimeBy(INTERVAL);

    StepVerifier.create(handler.close()).verifyComplete();
    int framesAtClose = received.size();
    heartbeatScheduler.advanceTimeBy(Duration.ofMinutes(2));

    assertThat(handler.getState()).isEqualTo(ConnectionState.CLOSED);
    assertThat(handler.getHeartbeat().isTerminated()).isTrue();
    assertThat(received).hasSize(framesAtClose);
    assertThat(completed).isTrue();
    assertThat(handler.submit(JsonRpcMessage.request(9, "ping", null))).isFalse();
  }

  @Test
  void sessionOutlivesItsConnection() {
    handler.establish("/messages/");
    handler.submit(toolCall(1, thought("kept", 1, 2, true)));

    handler.close().block(Duration.ofSeconds(1));

    assertThat(store.find(session.id())).isPresent();
    assertThat(store.getOrCreate(String.valueOf(session.id())).session().logLength()).isEqualTo(1);
  }

  @Test
  void closeIsIdempotent() {
    handler.establish("/messages/");

    handler.close().block(Duration.ofSeconds(1));
    StepVerifier.create(handler.close()).verifyComplete();

    assertThat(handler.getState()).isEqualTo(ConnectionState.CLOSED);
  }

  @Test
  void closeBeforeEstablishGoesStraightToClosed() {
    StepVerifier.create(handler.close()).verifyComplete();

    assertThat(handler.getState()).isEqualTo(ConnectionState.CLOSED);
    assertThat(completed).isTrue();
  }

  @Test
  void undeliverableReplyEndsTheConnection() {
    handler.establish("/messages/");
    subscription.dispose();

    handler.submit(JsonRpcMessage.request(1, "ping", null));

    assertThat(handler.getState()).isEqualTo(ConnectionState.CLOSED);
    assertThat(handler.getHeartbeat().isTerminated()).isTrue();
  }

  private List<JsonRpcMessage> replies() {
    return received.stream()
        .filter(frame -> StreamConnectionHandler.MESSAGE_EVENT.equals(frame.event()))
        .map(frame -> (JsonRpcMessage) frame.data())
        .filter(JsonRpcMessage::isResponse)
        .toList();
  }
}
