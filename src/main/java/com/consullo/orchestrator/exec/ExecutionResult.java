package com.consullo.orchestrator.exec;

/**
 * Outcome of one execution.
 *
 * <p>
 * Text accumulated before a failure, timeout or cancellation is always kept in
 * {@link #getText()} and {@link #getDetailedText()}.
 * </p>
 */
public final class ExecutionResult {

  private final boolean success;
  private final String text;
  private final String detailedText;
  private final String externalSessionId;
  private final String error;
  private final Double costUnits;
  private final Long durationMs;
  private final boolean wasCancelled;
  private final boolean pendingQuestion;
  private final boolean pendingPlanApproval;
  private final String planCandidateText;
  private final boolean planWriteTimedOut;

  private ExecutionResult(Builder b) {
    this.success = b.success;
    this.text = b.text;
    this.detailedText = b.detailedText;
    this.externalSessionId = b.externalSessionId;
    this.error = b.error;
    this.costUnits = b.costUnits;
    this.durationMs = b.durationMs;
    this.wasCancelled = b.wasCancelled;
    this.pendingQuestion = b.pendingQuestion;
    this.pendingPlanApproval = b.pendingPlanApproval;
    this.planCandidateText = b.planCandidateText;
    this.planWriteTimedOut = b.planWriteTimedOut;
  }

  /**
   * Creates a failure result carrying no output.
   */
  public static ExecutionResult failure(String error) {
    return builder().success(false).error(error).build();
  }

  public boolean isSuccess() {
    return success;
  }

  public String getText() {
    return text;
  }

  public String getDetailedText() {
    return detailedText;
  }

  public String getExternalSessionId() {
    return externalSessionId;
  }

  public String getError() {
    return error;
  }

  public Double getCostUnits() {
    return costUnits;
  }

  public Long getDurationMs() {
    return durationMs;
  }

  public boolean wasCancelled() {
    return wasCancelled;
  }

  public boolean isPendingQuestion() {
    return pendingQuestion;
  }

  public boolean isPendingPlanApproval() {
    return pendingPlanApproval;
  }

  public String getPlanCandidateText() {
    return planCandidateText;
  }

  public boolean isPlanWriteTimedOut() {
    return planWriteTimedOut;
  }

  public Builder toBuilder() {
    return builder()
            .success(success)
            .text(text)
            .detailedText(detailedText)
            .externalSessionId(externalSessionId)
            .error(error)
            .costUnits(costUnits)
            .durationMs(durationMs)
            .wasCancelled(wasCancelled)
            .pendingQuestion(pendingQuestion)
            .pendingPlanApproval(pendingPlanApproval)
            .planCandidateText(planCandidateText)
            .planWriteTimedOut(planWriteTimedOut);
  }

  @Override
  public String toString() {
    return "ExecutionResult{success=" + success
            + ", externalSessionId=" + externalSessionId
            + ", error=" + error
            + ", wasCancelled=" + wasCancelled
            + ", pendingQuestion=" + pendingQuestion
            + ", pendingPlanApproval=" + pendingPlanApproval
            + ", textLength=" + text.length() + "}";
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {

    private boolean success;
    private String text = "";
    private String detailedText;
    private String externalSessionId;
    private String error;
    private Double costUnits;
    private Long durationMs;
    private boolean wasCancelled;
    private boolean pendingQuestion;
    private boolean pendingPlanApproval;
    private String planCandidateText;
    private boolean planWriteTimedOut;

    private Builder() {
    }

    public Builder success(boolean success) {
      this.success = success;
      return this;
    }

    public Builder text(String text) {
      this.text = text;
      return this;
    }

    public Builder detailedText(String detailedText) {
      this.detailedText = detailedText;
      return this;
    }

    public Builder externalSessionId(String externalSessionId) {
      this.externalSessionId = externalSessionId;
      return this;
    }

    public Builder error(String error) {
      this.error = error;
      return this;
    }

    public Builder costUnits(Double costUnits) {
      this.costUnits = costUnits;
      return this;
    }

    public Builder durationMs(Long durationMs) {
      this.durationMs = durationMs;
      return this;
    }

    public Builder wasCancelled(boolean wasCancelled) {
      this.wasCancelled = wasCancelled;
      return this;
    }

    public Builder pendingQuestion(boolean pendingQuestion) {
      this.pendingQuestion = pendingQuestion;
      return this;
    }

    public Builder pendingPlanApproval(boolean pendingPlanApproval) {
      this.pendingPlanApproval = pendingPlanApproval;
      return this;
    }

    public Builder planCandidateText(String planCandidateText) {
      this.planCandidateText = planCandidateText;
      return this;
    }

    public Builder planWriteTimedOut(boolean planWriteTimedOut) {
      this.planWriteTimedOut = planWriteTimedOut;
      return this;
    }

    public ExecutionResult build() {
      if (text == null) {
        text = "";
      }
      if (detailedText == null) {
        detailedText = text;
      }
      return new ExecutionResult(this);
    }
  }
}
