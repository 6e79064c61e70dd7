package com.linkrank.sim.rules;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Locale;

/**
 * Available target-selection policies. Each constant carries its strategy,
 * so the enum doubles as the dispatch table.
 */
public enum SelectionMethod {
    CATEGORY(new CategorySelection(), "category"),
    RELEVANCE_MIX(new RelevanceMixSelection(), "semantic", "relevance_mix"),
    RANDOM(new RandomSelection(), "random"),
    RANK_HIGH(new RankSelection(true), "pagerank_high", "rank_high"),
    RANK_LOW(new RankSelection(false), "pagerank_low", "rank_low");

    public static final SelectionMethod DEFAULT = CATEGORY;

    private static final Logger log = LogManager.getLogger(SelectionMethod.class);

    private final SelectionStrategy strategy;
    private final String[] aliases;

    SelectionMethod(SelectionStrategy strategy, String... aliases) {
        this.strategy = strategy;
        this.aliases = aliases;
    }

    public SelectionStrategy strategy() {
        return strategy;
    }

    /**
     * Resolves a method name or alias, case-insensitive. Blank input gives
     * {@link #DEFAULT}; an unknown name falls back to {@link #DEFAULT} with a
     * warning.
     */
    public static SelectionMethod fromString(String text) {
        if (text == null || text.isBlank())
            return DEFAULT;
        String key = text.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (SelectionMethod m : values()) {
            if (m.name().toLowerCase(Locale.ROOT).equals(key))
                return m;
            for (String alias : m.aliases) {
                if (alias.equals(key))
                    return m;
            }
        }
        log.warn("Unknown selection method '{}', falling back to {}", text, DEFAULT);
        return DEFAULT;
    }
}
