package com.example.datalake.thinking.util;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.datalake.thinking.model.ThoughtRecord;
import org.junit.jupiter.api.Test;

class ThoughtRenderUtilsTest {

  private final ThoughtRecord base = ThoughtRecord.builder()
      .content("check the invariants")
      .sequenceNumber(2)
      .totalEstimate(4)
      .continuationNeeded(true)
      .build();

  @Test
  void plainThoughtHeader() {
    assertThat(ThoughtRenderUtils.header(base)).isEqualTo("💭 Thought 2/4");
  }

  @Test
  void revisionHeaderNamesRevisedThought() {
    ThoughtRecord revision = base.toBuilder().revision(true).revisesSequence(1).build();

    assertThat(ThoughtRenderUtils.header(revision)).isEqualTo("🔄 Revision 2/4 (revising thought 1)");
  }

  @Test
  void branchHeaderNamesOriginAndId() {
    ThoughtRecord branch = base.toBuilder().branchOrigin(1).branchId("alt").build();

    assertThat(ThoughtRenderUtils.header(branch)).isEqualTo("🌿 Branch 2/4 (from thought 1, ID: alt)");
  }

  @Test
  void renderBoxesHeaderAndEveryContentLine() {
    ThoughtRecord multiLine = base.toBuilder().content("first line\nsecond").build();

    String rendered = ThoughtRenderUtils.render(multiLine);

    String[] lines = rendered.split("\n");
    assertThat(lines).hasSize(6);
    assertThat(lines[0]).startsWith("┌").endsWith("┐");
    assertThat(lines[1]).contains("💭 Thought 2/4");
    assertThat(lines[3]).startsWith("│ first line");
    assertThat(lines[4]).startsWith("│ second");
    assertThat(lines[5]).startsWith("└").endsWith("┘");
    assertThat(lines[3]).hasSameSizeAs(lines[4]);
  }

  @Test
  void rightBorderLinesUpWhenHeaderIsWidest() {
    ThoughtRecord shortContent = base.toBuilder().content("ok").build();

    String[] lines = ThoughtRenderUtils.render(shortContent).split("\n");

    int expected = lines[0].codePointCount(0, lines[0].length());
    for (String line : lines) {
      assertThat(line.codePointCount(0, line.length())).as(line).isEqualTo(expected);
    }
    assertThat(lines[3]).isEqualTo("│ ok" + " ".repeat(11) + " │");
  }
}
