package com.example.datalake.thinking.model;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/** What a session reports back after accepting a thought. */
@Value
@Builder
public class ThoughtOutcome {
  int sequenceNumber;
  int totalEstimate;
  boolean continuationNeeded;
  List<String> branches;
  int logLength;
}
