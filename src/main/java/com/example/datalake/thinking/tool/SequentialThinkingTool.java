package com.example.datalake.thinking.tool;

import com.example.datalake.thinking.model.ThoughtSubmission;
import com.example.datalake.thinking.service.ThoughtService;
import com.example.datalake.thinking.session.ThinkingSession;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** The single tool offered over the protocol: records one thought in the caller's session. */
@Component
@RequiredArgsConstructor
public class SequentialThinkingTool {

  public static final String NAME = "sequentialthinking";

  private static final String DESCRIPTION = """
      A detailed tool for dynamic and reflective problem-solving through thoughts.
      This tool helps analyze problems through a flexible thinking process that can adapt and evolve.
      Each thought can build on, question, or revise previous insights as understanding deepens.

      When to use this tool:
      - Breaking down complex problems into steps
      - Planning and design with room for revision
      - Analysis that might need course correction
      - Problems where the full scope might not be clear initially
      - Problems that require a multi-step solution
      - Tasks that need to maintain context over multiple steps
      - Situations where irrelevant information needs to be filtered out

      Key features:
      - You can adjust totalEstimate up or down as you progress
      - You can question or revise previous thoughts
      - You can add more thoughts even after reaching what seemed like the end
      - You can express uncertainty and explore alternative approaches
      - Not every thought needs to build linearly - you can branch or backtrack
      - Generates a solution hypothesis
      - Verifies the hypothesis based on the Chain of Thought steps
      - Repeats the process until satisfied
      - Provides a correct answer

      Parameters explained:
      - thought: Your current thinking step, which can include regular analytical steps,
        revisions of previous thoughts, questions about previous decisions, realizations about
        needing more analysis, changes in approach, hypothesis generation and verification
      - continuationNeeded: True if you need more thinking, even if at what seemed like the end
      - sequenceNumber: Current number in sequence (can go beyond initial total if needed)
      - totalEstimate: Current estimate of thoughts needed (can be adjusted up/down)
      - isRevision: A boolean indicating if this thought revises previous thinking
      - revisesSequence: If isRevision is true, which thought number is being reconsidered
      - branchOrigin: If branching, which thought number is the branching point
      - branchId: Identifier for the current branch (if any)
      - needsMoreThoughts: If reaching end but realizing more thoughts needed
      - sessionHint: Session to record into when calling outside a streaming connection

      You should:
      1. Start with an initial estimate of needed thoughts, but be ready to adjust
      2. Feel free to question or revise previous thoughts
      3. Don't hesitate to add more thoughts if needed, even at the "end"
      4. Express uncertainty when present
      5. Mark thoughts that revise previous thinking or branch into new paths
      6. Ignore information that is irrelevant to the current step
      7. Generate a solution hypothesis when appropriate
      8. Verify the hypothesis based on the Chain of Thought steps
      9. Repeat the process until satisfied with the solution
      10. Provide a single, ideally correct answer as the final output
      11. Only set continuationNeeded to false when truly done and a satisfactory answer is reached
      """;

  private final ThoughtService thoughtService;
  private final ObjectMapper objectMapper;

  public ToolDefinition definition() {
    Map<String, Object> properties = new LinkedHashMap<>();
    properties.put("thought", property("string", "Your current thinking step"));
    properties.put("sequenceNumber", integerProperty("Current thought number"));
    properties.put("totalEstimate", integerProperty("Estimated total thoughts needed"));
    properties.put("continuationNeeded", property("boolean", "Whether another thought step is needed"));
    properties.put("sessionHint", property("string", "Existing session id to continue"));
    properties.put("isRevision", property("boolean", "Whether this revises previous thinking"));
    properties.put("revisesSequence", integerProperty("Which thought is being reconsidered"));
    properties.put("branchOrigin", integerProperty("Branching point thought number"));
    properties.put("branchId", property("string", "Branch identifier"));
    properties.put("needsMoreThoughts", property("boolean", "If more thoughts are needed"));

    Map<String, Object> schema = new LinkedHashMap<>();
    schema.put("type", "object");
    schema.put("properties", properties);
    schema.put("required", List.of("thought", "sequenceNumber", "totalEstimate", "continuationNeeded"));
    return new ToolDefinition(NAME, DESCRIPTION.strip(), schema);
  }

  public ToolCallResult call(ThinkingSession session, Map<String, Object> arguments) {
    ThoughtSubmission submission = thoughtService.submit(session, arguments);
    if (!submission.isAccepted()) {
      Map<String, Object> body = new LinkedHashMap<>();
      body.put("status", "failed");
      body.put("errors", submission.getErrors());
      return ToolCallResult.text(toJson(body), true);
    }

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("sequenceNumber", submission.getOutcome().getSequenceNumber());
    body.put("totalEstimate", submission.getOutcome().getTotalEstimate());
    body.put("continuationNeeded", submission.getOutcome().isContinuationNeeded());
    body.put("branches", submission.getOutcome().getBranches());
    body.put("logLength", submission.getOutcome().getLogLength());
    if (!submission.getNotices().isEmpty()) {
      body.put("notices", submission.getNotices());
    }
    return ToolCallResult.text(toJson(body), false);
  }

  private String toJson(Map<String, Object> body) {
    try {
      return objectMapper.writeValueAsString(body);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to serialize tool result", ex);
    }
  }

  private static Map<String, Object> property(String type, String description) {
    return Map.of("type", type, "description", description);
  }

  private static Map<String, Object> integerProperty(String description) {
    return Map.of("type", "integer", "minimum", 1, "description", description);
  }
}
