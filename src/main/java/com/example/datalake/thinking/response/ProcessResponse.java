package com.example.datalake.thinking.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Accessors(chain = true, fluent = false)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProcessResponse {
  private Long sessionId;

  private Integer sequenceNumber;
  private Integer totalEstimate;
  private Boolean continuationNeeded;
  private List<String> branches;
  private Integer logLength;

  private List<String> notices;
  private List<String> errors;
}
