package io.kairos.core.error;

public final class NotFoundException extends SchedulerException {
    private final String id;

    private NotFoundException(ErrorCode code, String message, String id) {
        super(code, message);
        this.id = id;
    }

    public static NotFoundException job(String id) {
        return new NotFoundException(ErrorCode.JOB_NOT_FOUND, "Job not found: " + id, id);
    }

    public static NotFoundException template(String id) {
        return new NotFoundException(ErrorCode.TEMPLATE_NOT_FOUND, "Template not found: " + id, id);
    }

    public static NotFoundException execution(String id) {
        return new NotFoundException(ErrorCode.EXECUTION_NOT_FOUND, "Execution not found: " + id, id);
    }

    public String id() {
        return id;
    }
}
