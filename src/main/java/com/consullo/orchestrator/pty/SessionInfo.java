package com.consullo.orchestrator.pty;

import java.time.Instant;

/**
 * Point-in-time description of a pooled session.
 *
 * @param key pool key
 * @param state lifecycle state
 * @param pid process id, or -1 when unknown
 * @param alive whether the process is running
 * @param outputMode output framing
 * @param createdAt creation time
 * @param lastActivityAt last input or output
 * @since 1.0
 */
public record SessionInfo(
    String key,
    PtySessionState state,
    int pid,
    boolean alive,
    OutputMode outputMode,
    Instant createdAt,
    Instant lastActivityAt) {
}
