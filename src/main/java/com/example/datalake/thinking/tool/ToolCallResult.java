package com.example.datalake.thinking.tool;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

/** Result body of a {@code tools/call} reply: text content plus the error flag. */
public record ToolCallResult(
    List<Map<String, Object>> content,
    @JsonProperty("isError") boolean isError
) {

  public static ToolCallResult text(String text, boolean isError) {
    return new ToolCallResult(List.of(Map.of("type", "text", "text", text)), isError);
  }

  public String firstText() {
    return content.isEmpty() ? null : (String) content.get(0).get("text");
  }
}
