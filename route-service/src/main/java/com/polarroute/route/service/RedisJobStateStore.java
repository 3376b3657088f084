package com.polarroute.route.service;

import com.polarroute.shared.enums.JobState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.UUID;

/**
 * Task state held in Redis under {@code job:state:{jobId}}.
 *
 * Absent key = PENDING. Leaving PENDING is a SETNX, so a revoke and a worker claim racing on the
 * same job resolve to exactly one winner. Entries expire after the configured retention, after
 * which a job reads as PENDING again.
 */
@Slf4j
@Component
public class RedisJobStateStore implements JobStateProvider {

    private static final String STATE_KEY_PREFIX = "job:state:";

    private final RedisTemplate<String, String> redisTemplate;
    private final Duration retention;

    public RedisJobStateStore(RedisTemplate<String, String> redisTemplate,
                              @Value("${route.job.state-ttl-hours:168}") long retentionHours) {
        this.redisTemplate = redisTemplate;
        this.retention = Duration.ofHours(retentionHours);
    }

    @Override
    public JobState query(UUID jobId) {
        String value = redisTemplate.opsForValue().get(key(jobId));
        return value == null ? JobState.PENDING : JobState.valueOf(value);
    }

    @Override
    public JobState revoke(UUID jobId) {
        Boolean revoked = redisTemplate.opsForValue().setIfAbsent(key(jobId), JobState.REVOKED.name(), retention);
        if (Boolean.TRUE.equals(revoked)) {
            log.info("Job {} revoked before start", jobId);
            return JobState.REVOKED;
        }
        JobState current = query(jobId);
        log.info("Job {} already {}, revoke has no effect", jobId, current);
        return current;
    }

    @Override
    public void markFailed(UUID jobId) {
        complete(jobId, JobState.FAILURE);
    }

    /**
     * Moves a PENDING task to RUNNING.
     *
     * @return false if the task was revoked or already claimed
     */
    public boolean claim(UUID jobId) {
        Boolean claimed = redisTemplate.opsForValue().setIfAbsent(key(jobId), JobState.RUNNING.name(), retention);
        return Boolean.TRUE.equals(claimed);
    }

    public void complete(UUID jobId, JobState state) {
        if (!state.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal state: " + state);
        }
        redisTemplate.opsForValue().set(key(jobId), state.name(), retention);
    }

    private String key(UUID jobId) {
        return STATE_KEY_PREFIX + jobId;
    }
}
