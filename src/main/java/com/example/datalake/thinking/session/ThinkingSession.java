package com.example.datalake.thinking.session;

import com.example.datalake.thinking.model.ThoughtOutcome;
import com.example.datalake.thinking.model.ThoughtRecord;
import com.example.datalake.thinking.util.ThoughtRenderUtils;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;

/**
 * One reasoning conversation: an append-only log of accepted thoughts plus an index of the
 * thoughts that declared each branch id. Revisions and branch continuations are appended, never
 * merged into earlier entries.
 */
@Slf4j
public class ThinkingSession {

  private final long id;
  private final boolean renderThoughts;
  private final ReentrantLock lock = new ReentrantLock();
  private final List<ThoughtRecord> thoughts = new ArrayList<>();
  private final Map<String, List<ThoughtRecord>> branches = new LinkedHashMap<>();

  public ThinkingSession(long id) {
    this(id, false);
  }

  public ThinkingSession(long id, boolean renderThoughts) {
    this.id = id;
    this.renderThoughts = renderThoughts;
  }

  public long getId() {
    return id;
  }

  public ThoughtOutcome process(ThoughtRecord submitted) {
    ThoughtRecord record = submitted.getSequenceNumber() > submitted.getTotalEstimate()
        ? submitted.withTotalEstimate(submitted.getSequenceNumber())
        : submitted;

    lock.lock();
    try {
      thoughts.add(record);
      if (record.isBranchRecord()) {
        branches.computeIfAbsent(record.getBranchId(), key -> new ArrayList<>()).add(record);
      }

      if (renderThoughts) {
        log.info("session={}\n{}", id, ThoughtRenderUtils.render(record));
      }

      return ThoughtOutcome.builder()
          .sequenceNumber(record.getSequenceNumber())
          .totalEstimate(record.getTotalEstimate())
          .continuationNeeded(record.isContinuationNeeded())
          .branches(List.copyOf(branches.keySet()))
          .logLength(thoughts.size())
          .build();
    } finally {
      lock.unlock();
    }
  }

  public int logLength() {
    lock.lock();
    try {
      return thoughts.size();
    } finally {
      lock.unlock();
    }
  }

  /** Snapshot of the log in submission order. */
  public List<ThoughtRecord> history() {
    lock.lock();
    try {
      return List.copyOf(thoughts);
    } finally {
      lock.unlock();
    }
  }

  /** Snapshot of the thoughts recorded under one branch id, in submission order. */
  public List<ThoughtRecord> branch(String branchId) {
    lock.lock();
    try {
      List<ThoughtRecord> records = branches.get(branchId);
      return records == null ? List.of() : List.copyOf(records);
    } finally {
      lock.unlock();
    }
  }
}
