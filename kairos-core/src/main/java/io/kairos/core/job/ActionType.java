package io.kairos.core.job;

public enum ActionType {
    TASK_CREATE,
    TASK_UPDATE,
    EMAIL_SEND,
    NOTIFICATION_SEND,
    REPORT_GENERATE,
    DATA_CLEANUP,
    SYNC_INTEGRATION,
    WEBHOOK_CALL,
    WORKFLOW_TRIGGER,
    CUSTOM_FUNCTION
}
