package com.consullo.orchestrator.exec;

import java.nio.file.Path;
import org.apache.commons.lang3.Validate;

/**
 * Inputs for one execution.
 *
 * @param prompt prompt text, passed as the final CLI argument
 * @param workingDirectory working directory of the backend process
 * @param resumeSessionId external session id to resume (may be null; format
 * validated before use)
 * @param mode backend mode (permission or sandbox mode; may be null)
 * @param model model name (may be null)
 * @param executionId cancellation and state-isolation key
 * @param ownerKey owner/conversation key for bulk cancellation and PTY reuse
 * @since 1.0
 */
public record ExecutionRequest(
    String prompt,
    Path workingDirectory,
    String resumeSessionId,
    String mode,
    String model,
    String executionId,
    String ownerKey) {

  public ExecutionRequest {
    Validate.notNull(prompt, "prompt must not be null");
    Validate.notNull(workingDirectory, "workingDirectory must not be null");
    Validate.notBlank(executionId, "executionId must not be blank");
    Validate.notBlank(ownerKey, "ownerKey must not be blank");
  }

  public ExecutionRequest withResumeSessionId(final String id) {
    return new ExecutionRequest(prompt, workingDirectory, id, mode, model, executionId, ownerKey);
  }

  public ExecutionRequest withMode(final String newMode) {
    return new ExecutionRequest(prompt, workingDirectory, resumeSessionId, newMode, model, executionId, ownerKey);
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {

    private String prompt;
    private Path workingDirectory;
    private String resumeSessionId;
    private String mode;
    private String model;
    private String executionId;
    private String ownerKey;

    private Builder() {
    }

    public Builder prompt(String prompt) {
      this.prompt = prompt;
      return this;
    }

    public Builder workingDirectory(Path workingDirectory) {
      this.workingDirectory = workingDirectory;
      return this;
    }

    public Builder resumeSessionId(String resumeSessionId) {
      this.resumeSessionId = resumeSessionId;
      return this;
    }

    public Builder mode(String mode) {
      this.mode = mode;
      return this;
    }

    public Builder model(String model) {
      this.model = model;
      return this;
    }

    public Builder executionId(String executionId) {
      this.executionId = executionId;
      return this;
    }

    public Builder ownerKey(String ownerKey) {
      this.ownerKey = ownerKey;
      return this;
    }

    public ExecutionRequest build() {
      return new ExecutionRequest(prompt, workingDirectory, resumeSessionId, mode, model, executionId, ownerKey);
    }
  }
}
