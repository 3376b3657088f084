package com.polarroute.route.service;

import com.polarroute.shared.enums.JobState;

import java.util.UUID;

/**
 * Live view of a calculation task's state, keyed by job id. Nothing about task state is
 * persisted on the job row.
 */
public interface JobStateProvider {

    /** Current state; ids the store has never seen are PENDING. */
    JobState query(UUID jobId);

    /**
     * Marks a task that has not started as REVOKED. Has no effect on a running or finished task.
     *
     * @return the state after the call
     */
    JobState revoke(UUID jobId);

    /** Records a task that will never run, e.g. because its request could not be queued. */
    void markFailed(UUID jobId);
}
