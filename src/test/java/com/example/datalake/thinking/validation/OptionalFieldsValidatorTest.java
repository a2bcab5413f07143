package com.example.datalake.thinking.validation;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.datalake.thinking.model.ThoughtRecord;
import java.util.Map;
import org.junit.jupiter.api.Test;

class OptionalFieldsValidatorTest {

  private final OptionalFieldsValidator validator = new OptionalFieldsValidator();

  @Test
  void shouldCopyWellTypedFields() {
    ValidationContext context = new ValidationContext(Map.of(
        "isRevision", true,
        "revisesSequence", 2,
        "branchOrigin", 1,
        "branchId", "alt",
        "needsMoreThoughts", false));

    validator.validate(context);

    ThoughtRecord record = context.record().content("x").sequenceNumber(1).totalEstimate(1).build();
    assertThat(record.getRevision()).isTrue();
    assertThat(record.getRevisesSequence()).isEqualTo(2);
    assertThat(record.getBranchOrigin()).isEqualTo(1);
    assertThat(record.getBranchId()).isEqualTo("alt");
    assertThat(record.getNeedsMoreThoughts()).isFalse();
    assertThat(context.getNotices()).isEmpty();
  }

  @Test
  void shouldDropIllTypedFieldsWithNotice() {
    ValidationContext context = new ValidationContext(Map.of(
        "isRevision", "yes",
        "branchOrigin", "one",
        "branchId", ""));

    validator.validate(context);

    ThoughtRecord record = context.record().build();
    assertThat(record.getRevision()).isNull();
    assertThat(record.getBranchOrigin()).isNull();
    assertThat(record.getBranchId()).isNull();
    assertThat(context.hasErrors()).isFalse();
    assertThat(context.getNotices()).containsExactly(
        "Ignored isRevision: expected a boolean",
        "Ignored branchOrigin: expected a positive integer",
        "Ignored branchId: expected a non-blank string");
  }
}
