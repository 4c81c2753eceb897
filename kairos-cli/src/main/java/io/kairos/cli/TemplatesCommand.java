package io.kairos.cli;

import io.kairos.core.template.InMemoryTemplateCatalog;
import io.kairos.core.template.JobTemplate;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "templates", description = "List built-in job templates")
public final class TemplatesCommand implements Callable<Integer> {

    @Option(names = {"--category"}, description = "Only list templates of this category")
    String category;

    @Override
    public Integer call() {
        try {
            List<JobTemplate> templates = InMemoryTemplateCatalog.defaults().list(category);
            if (templates.isEmpty()) {
                System.out.println("No templates" + (category == null ? "" : " in category " + category));
                return 0;
            }
            for (JobTemplate template : templates) {
                System.out.printf(
                    "%-18s %-14s %3d  %s%n",
                    template.id(),
                    template.category(),
                    template.popularity(),
                    template.name()
                );
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Templates command failed: " + e.getMessage());
            return 1;
        }
    }
}
