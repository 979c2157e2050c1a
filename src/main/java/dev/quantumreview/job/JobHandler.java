package dev.quantumreview.job;

/**
 * Business logic behind one {@link JobType}.
 *
 * <p>Implementations must be idempotent: running the same job twice leaves the same end
 * state (upsert by natural key, never blind inserts). They run inside a transaction opened
 * by {@link JobDispatcher} and should let exceptions propagate.
 */
public interface JobHandler {

    JobType type();

    void handle(Job job);
}
