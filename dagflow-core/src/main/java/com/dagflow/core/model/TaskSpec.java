package com.dagflow.core.model;

import java.time.Duration;

/**
 * Definition of a task node within a workflow.
 * Describes what to execute, not run-specific data.
 *
 * Invariants (checked at registration):
 * - name is non-blank and unique within its definition
 * - executableRef is non-blank
 * - timeout is absent (executor default applies) or > 0
 */
public record TaskSpec(
    String name,
    String executableRef,
    RetryPolicy retryPolicy,
    Duration timeout,
    String description
) {
    /**
     * Timeout used when neither the task nor the executor sets one: 5 minutes.
     */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(5);

    /**
     * Get the effective timeout (task-specific or the executor default).
     */
    public Duration effectiveTimeout(Duration executorDefault) {
        if (timeout != null) {
            return timeout;
        }
        return executorDefault != null ? executorDefault : DEFAULT_TIMEOUT;
    }

    /**
     * Get the effective retry policy (task-specific or the workflow default).
     */
    public RetryPolicy effectiveRetryPolicy(RetryPolicy workflowDefault) {
        return retryPolicy != null ? retryPolicy : workflowDefault;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Shorthand for a task with the executor's default timeout and the workflow's retry policy.
     */
    public static TaskSpec of(String name, String executableRef) {
        return builder().name(name).executableRef(executableRef).build();
    }

    public static class Builder {
        private String name;
        private String executableRef;
        private RetryPolicy retryPolicy;
        private Duration timeout;
        private String description;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder executableRef(String executableRef) {
            this.executableRef = executableRef;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public TaskSpec build() {
            return new TaskSpec(name, executableRef, retryPolicy, timeout, description);
        }
    }
}
