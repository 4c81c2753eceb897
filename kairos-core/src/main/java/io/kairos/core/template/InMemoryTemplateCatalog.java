package io.kairos.core.template;

import io.kairos.core.model.Attributes;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class InMemoryTemplateCatalog implements TemplateCatalog {
    private final Map<String, JobTemplate> templates = new LinkedHashMap<>();

    public InMemoryTemplateCatalog(List<JobTemplate> templates) {
        for (JobTemplate template : templates) {
            this.templates.put(template.id(), template);
        }
    }

    public static InMemoryTemplateCatalog defaults() {
        return new InMemoryTemplateCatalog(List.of(
            new JobTemplate(
                "daily-summary",
                "Daily Summary Email",
                "Send a daily summary of tasks and activities",
                "notifications",
                Attributes.of(Map.of("type", "RECURRING", "frequency", "DAILY", "time", "18:00")),
                Attributes.of(Map.of("type", "EMAIL_SEND", "target", "user", "method", "sendDailySummary")),
                85,
                List.of("email", "summary", "daily")
            ),
            new JobTemplate(
                "weekly-review",
                "Weekly Review",
                "Generate and send weekly productivity review",
                "analytics",
                Attributes.of(Map.of("type", "RECURRING", "frequency", "WEEKLY", "daysOfWeek", List.of(5), "time", "16:00")),
                Attributes.of(Map.of(
                    "type", "REPORT_GENERATE",
                    "target", "analytics",
                    "method", "generateWeeklyReview",
                    "parameters", Map.of("reportType", "weekly_review", "format", "pdf", "emailTo", true)
                )),
                72,
                List.of("review", "weekly", "analytics")
            ),
            new JobTemplate(
                "task-cleanup",
                "Completed Task Cleanup",
                "Archive completed tasks older than 30 days",
                "maintenance",
                Attributes.of(Map.of("type", "RECURRING", "frequency", "MONTHLY", "daysOfMonth", List.of(1), "time", "02:00")),
                Attributes.of(Map.of(
                    "type", "DATA_CLEANUP",
                    "target", "tasks",
                    "method", "archiveCompleted",
                    "parameters", Map.of("olderThanDays", 30, "cleanCompletedTasks", true)
                )),
                45,
                List.of("cleanup", "tasks", "maintenance")
            ),
            new JobTemplate(
                "integration-sync",
                "Integration Data Sync",
                "Sync data from connected integrations",
                "integrations",
                Attributes.of(Map.of("type", "INTERVAL", "intervalMinutes", 30)),
                Attributes.of(Map.of(
                    "type", "SYNC_INTEGRATION",
                    "target", "integrations",
                    "method", "syncAll",
                    "parameters", Map.of("syncType", "incremental")
                )),
                68,
                List.of("sync", "integrations", "data")
            ),
            new JobTemplate(
                "reminder-digest",
                "Morning Reminder Digest",
                "Send daily digest of upcoming tasks and events",
                "notifications",
                Attributes.of(Map.of("type", "RECURRING", "frequency", "DAILY", "time", "08:00")),
                Attributes.of(Map.of(
                    "type", "NOTIFICATION_SEND",
                    "target", "user",
                    "method", "sendReminderDigest",
                    "parameters", Map.of(
                        "includeToday", true,
                        "includeTomorrow", true,
                        "channels", List.of("email", "push")
                    )
                )),
                90,
                List.of("reminder", "digest", "morning")
            )
        ));
    }

    @Override
    public List<JobTemplate> list(String category) {
        return templates.values().stream()
            .filter(template -> category == null || category.isBlank() || category.equalsIgnoreCase(template.category()))
            .sorted(Comparator.comparingInt(JobTemplate::popularity).reversed().thenComparing(JobTemplate::id))
            .toList();
    }

    @Override
    public Optional<JobTemplate> find(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(templates.get(id));
    }
}
