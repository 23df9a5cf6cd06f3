package work.agentflow.resolve;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import work.agentflow.shared.Names;

/**
 * Categories a caller wants covered, optional pinned agents per category, and the stack to match.
 */
public record WorkflowRequest(
    Set<String> requiredCategories,
    Map<String, String> explicitPicks,
    Set<String> stackTags,
    boolean strict
) {
    public WorkflowRequest {
        var categories = new LinkedHashSet<String>();
        if (requiredCategories != null) {
            for (String raw : requiredCategories) {
                String category = Names.category(raw);
                if (category != null) {
                    categories.add(category);
                }
            }
        }
        requiredCategories = Collections.unmodifiableSet(categories);

        var picks = new LinkedHashMap<String, String>();
        if (explicitPicks != null) {
            explicitPicks.forEach((rawCategory, id) -> {
                String category = Names.category(rawCategory);
                if (category != null && id != null && !id.isBlank()) {
                    picks.put(category, id.trim());
                }
            });
        }
        explicitPicks = Collections.unmodifiableMap(picks);
        stackTags = Collections.unmodifiableSet(Names.tags(stackTags));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Set<String> categories = new LinkedHashSet<>();
        private final Map<String, String> picks = new LinkedHashMap<>();
        private final Set<String> stackTags = new LinkedHashSet<>();
        private boolean strict;

        public Builder category(String category) {
            categories.add(category);
            return this;
        }

        public Builder categories(Collection<String> values) {
            categories.addAll(values);
            return this;
        }

        public Builder pick(String category, String id) {
            picks.put(category, id);
            return this;
        }

        public Builder picks(Map<String, String> values) {
            picks.putAll(values);
            return this;
        }

        public Builder stackTag(String tag) {
            stackTags.add(tag);
            return this;
        }

        public Builder stackTags(Collection<String> values) {
            stackTags.addAll(values);
            return this;
        }

        public Builder strict(boolean strict) {
            this.strict = strict;
            return this;
        }

        public WorkflowRequest build() {
            return new WorkflowRequest(categories, picks, stackTags, strict);
        }
    }
}
