package io.kairos.core.schedule;

public enum JobType {
    ONE_TIME,
    RECURRING,
    CRON,
    INTERVAL,
    DELAYED
}
