package com.linkrank.sim.rules;

import com.linkrank.sim.api.ValidationException;
import com.linkrank.sim.model.LinkPosition;
import com.linkrank.sim.model.Page;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Menu or footer rule. Targets are resolved by URL (exact match or
 * substring containment). Menu rules act on every page; footer rules only
 * on pages whose type is in {@code sourceTypes}.
 */
public record StructuralRuleSpec(RuleKind kind, StructuralAction action, List<String> targetUrls,
        Set<String> sourceTypes) implements LinkRule {

    public static final Set<String> DEFAULT_FOOTER_SOURCE_TYPES = Set.of("product", "category");

    public StructuralRuleSpec {
        if (kind != RuleKind.MENU && kind != RuleKind.FOOTER)
            throw new ValidationException("Structural rule must be MENU or FOOTER: " + kind);
        if (action == null)
            throw new ValidationException("Structural rule requires an action");
        List<String> urls = new ArrayList<>();
        if (targetUrls != null) {
            // a blank url would be a substring of every page
            for (String u : targetUrls) {
                if (u != null && !u.isBlank())
                    urls.add(u.trim());
            }
        }
        targetUrls = List.copyOf(urls);
        Set<String> types = new LinkedHashSet<>();
        if (sourceTypes != null) {
            for (String t : sourceTypes) {
                if (t != null && !t.isBlank())
                    types.add(t.trim().toLowerCase(Locale.ROOT));
            }
        }
        if (kind == RuleKind.FOOTER && types.isEmpty())
            types.addAll(DEFAULT_FOOTER_SOURCE_TYPES);
        sourceTypes = Set.copyOf(types);
    }

    public static StructuralRuleSpec menu(StructuralAction action, Collection<String> targetUrls) {
        return new StructuralRuleSpec(RuleKind.MENU, action, new ArrayList<>(targetUrls), null);
    }

    public static StructuralRuleSpec footer(StructuralAction action, Collection<String> targetUrls,
            Collection<String> sourceTypes) {
        return new StructuralRuleSpec(RuleKind.FOOTER, action, new ArrayList<>(targetUrls),
                sourceTypes == null ? null : new LinkedHashSet<>(sourceTypes));
    }

    @Override
    public LinkPosition position() {
        return kind == RuleKind.MENU ? LinkPosition.HEADER : LinkPosition.FOOTER;
    }

    public boolean matchesTarget(Page page) {
        for (String url : targetUrls) {
            if (page.url().equals(url) || page.url().contains(url))
                return true;
        }
        return false;
    }

    public boolean matchesSource(Page page) {
        return kind == RuleKind.MENU || sourceTypes.contains(page.type().toLowerCase(Locale.ROOT));
    }
}
