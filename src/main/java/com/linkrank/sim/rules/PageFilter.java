package com.linkrank.sim.rules;

import com.linkrank.sim.model.Page;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Attribute filter over page type and category. Matching is
 * case-insensitive and an empty set means no restriction on that attribute.
 */
public record PageFilter(Set<String> types, Set<String> categories) {

    public static final PageFilter ANY = new PageFilter(Set.of(), Set.of());

    public PageFilter {
        types = normalize(types);
        categories = normalize(categories);
    }

    public static PageFilter of(Collection<String> types, Collection<String> categories) {
        return new PageFilter(types == null ? null : new LinkedHashSet<>(types),
                categories == null ? null : new LinkedHashSet<>(categories));
    }

    public static PageFilter types(String... types) {
        return of(Arrays.asList(types), null);
    }

    public static PageFilter categories(String... categories) {
        return of(null, Arrays.asList(categories));
    }

    public boolean matches(Page page) {
        return (types.isEmpty() || types.contains(page.type().toLowerCase(Locale.ROOT)))
                && (categories.isEmpty() || categories.contains(page.category().toLowerCase(Locale.ROOT)));
    }

    public boolean isUnrestricted() {
        return types.isEmpty() && categories.isEmpty();
    }

    private static Set<String> normalize(Set<String> values) {
        if (values == null || values.isEmpty())
            return Set.of();
        Set<String> out = new LinkedHashSet<>();
        for (String v : values) {
            if (v != null && !v.isBlank())
                out.add(v.trim().toLowerCase(Locale.ROOT));
        }
        return Collections.unmodifiableSet(out);
    }
}
