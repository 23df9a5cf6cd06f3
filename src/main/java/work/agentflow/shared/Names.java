package work.agentflow.shared;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Normalization rules shared by categories, ids and stack tags.
 */
public final class Names {
    private Names() {}

    public static String category(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim().toLowerCase(Locale.ROOT);
        return trimmed.isEmpty() ? null : trimmed;
    }

    public static String tag(String raw) {
        return category(raw);
    }

    /**
     * Lower-cases the value and collapses every run of characters outside {@code [a-z0-9]} to {@code -}.
     */
    public static String slug(String raw) {
        if (raw == null) {
            return null;
        }
        String slug = raw.trim().toLowerCase(Locale.ROOT)
            .replaceAll("[^a-z0-9]+", "-")
            .replaceAll("^-+|-+$", "");
        return slug.isEmpty() ? null : slug;
    }

    public static Set<String> tags(Collection<String> raw) {
        var tags = new LinkedHashSet<String>();
        if (raw == null) {
            return tags;
        }
        for (String value : raw) {
            String tag = tag(value);
            if (tag != null) {
                tags.add(tag);
            }
        }
        return tags;
    }
}
