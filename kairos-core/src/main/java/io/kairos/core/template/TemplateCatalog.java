package io.kairos.core.template;

import java.util.List;
import java.util.Optional;

public interface TemplateCatalog {
    /**
     * Templates of the given category (all when {@code null}), most popular first.
     */
    List<JobTemplate> list(String category);

    Optional<JobTemplate> find(String id);
}
