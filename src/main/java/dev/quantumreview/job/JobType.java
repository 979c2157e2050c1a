package dev.quantumreview.job;

/**
 * Closed set of background jobs. Every constant must have exactly one {@link JobHandler};
 * {@link JobDispatcher} refuses to start otherwise.
 */
public enum JobType {
    SYNC_INSTALLATION_REPOS,
    GENERATE_CHECKLIST,
    GENERATE_TEST_MANIFEST,
    HANDLE_PR_CLOSED,
    PROCESS_WORKFLOW_RUN
}
