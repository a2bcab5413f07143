package com.example.datalake.thinking.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * One validated reasoning step. Instances are immutable; the only adjustment a session makes
 * before storing one is the upward correction of {@code totalEstimate}, which yields a copy.
 */
@Value
@Builder(toBuilder = true)
public class ThoughtRecord {
  String content;
  int sequenceNumber;
  @With int totalEstimate;
  boolean continuationNeeded;

  // optional context, null when absent
  Boolean revision;
  Integer revisesSequence;
  Integer branchOrigin;
  String branchId;
  Boolean needsMoreThoughts;

  public boolean isRevisionRecord() {
    return Boolean.TRUE.equals(revision);
  }

  /** True when the record declares both the branch point and the branch it belongs to. */
  public boolean isBranchRecord() {
    return branchOrigin != null && branchId != null;
  }
}
