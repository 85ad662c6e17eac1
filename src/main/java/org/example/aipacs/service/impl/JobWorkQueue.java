package org.example.aipacs.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bounded hand-off between the orchestrator and its workers. A job id is held at most once
 * (queued or running); when the executor is saturated {@link #submit} refuses the job and the
 * caller leaves it in its persisted state for the next dispatch round.
 */
@Slf4j
public class JobWorkQueue {

    private final TaskExecutor executor;
    private final int capacity;
    private final Set<String> held = ConcurrentHashMap.newKeySet();

    public JobWorkQueue(TaskExecutor executor, int capacity) {
        this.executor = executor;
        this.capacity = capacity;
    }

    public boolean submit(String jobId, Runnable work) {
        if (!held.add(jobId)) {
            log.debug("Job {} already held by the work queue", jobId);
            return false;
        }
        try {
            executor.execute(() -> {
                try {
                    work.run();
                } finally {
                    held.remove(jobId);
                }
            });
            return true;
        } catch (TaskRejectedException e) {
            held.remove(jobId);
            log.warn("Work queue full ({} slots), job {} stays pending", capacity, jobId);
            return false;
        }
    }

    public boolean isHeld(String jobId) {
        return held.contains(jobId);
    }

    public int size() {
        return held.size();
    }

    public int capacity() {
        return capacity;
    }
}
