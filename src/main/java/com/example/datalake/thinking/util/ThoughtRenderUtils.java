package com.example.datalake.thinking.util;

import com.example.datalake.thinking.model.ThoughtRecord;
import java.util.List;

public final class ThoughtRenderUtils {
  private ThoughtRenderUtils() {}

  public static String header(ThoughtRecord record) {
    String position = record.getSequenceNumber() + "/" + record.getTotalEstimate();
    if (record.isRevisionRecord()) {
      return "🔄 Revision " + position + " (revising thought " + record.getRevisesSequence() + ")";
    }
    if (record.getBranchOrigin() != null) {
      return "🌿 Branch " + position
          + " (from thought " + record.getBranchOrigin() + ", ID: " + record.getBranchId() + ")";
    }
    return "💭 Thought " + position;
  }

  /** Boxed rendering of a thought: header on top, content lines below. */
  public static String render(ThoughtRecord record) {
    String header = header(record);
    List<String> lines = record.getContent() == null
        ? List.of("")
        : record.getContent().lines().toList();

    int width = displayLength(header);
    for (String line : lines) {
      width = Math.max(width, displayLength(line));
    }
    String border = "─".repeat(width + 2);

    StringBuilder out = new StringBuilder();
    out.append('┌').append(border).append("┐\n");
    out.append("│ ").append(pad(header, width)).append(" │\n");
    out.append('├').append(border).append("┤\n");
    for (String line : lines) {
      out.append("│ ").append(pad(line, width)).append(" │\n");
    }
    out.append('└').append(border).append('┘');
    return out.toString();
  }

  private static String pad(String text, int width) {
    int length = displayLength(text);
    return length >= width ? text : text + " ".repeat(width - length);
  }

  // emoji prefixes are one code point but two chars
  private static int displayLength(String text) {
    return text.codePointCount(0, text.length());
  }
}
