package com.example.datalake.thinking.service;

import static com.example.datalake.thinking.support.TestFixtures.thought;
import static org.assertj.core.api.Assertions.assertThat;

import com.example.datalake.thinking.model.ThoughtSubmission;
import com.example.datalake.thinking.session.ThinkingSession;
import com.example.datalake.thinking.support.TestFixtures;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ThoughtServiceTest {

  private final ThoughtService service = TestFixtures.thoughtService();

  @Test
  void validArgumentsAreAppliedToSession() {
    ThinkingSession session = new ThinkingSession(7, false);

    ThoughtSubmission submission = service.submit(session, thought("step1", 1, 2, true));

    assertThat(submission.isAccepted()).isTrue();
    assertThat(submission.getErrors()).isEmpty();
    assertThat(submission.getOutcome().getLogLength()).isEqualTo(1);
    assertThat(session.history()).extracting("content").containsExactly("step1");
  }

  @Test
  void invalidArgumentsLeaveSessionUntouched() {
    ThinkingSession session = new ThinkingSession(7, false);
    Map<String, Object> arguments = thought("step1", 0, 2, true);

    ThoughtSubmission submission = service.submit(session, arguments);

    assertThat(submission.isAccepted()).isFalse();
    assertThat(submission.getOutcome()).isNull();
    assertThat(submission.getErrors())
        .containsExactly("Invalid sequenceNumber: must be a positive integer");
    assertThat(session.logLength()).isZero();
  }
}
