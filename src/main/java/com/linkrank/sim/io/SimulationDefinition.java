package com.linkrank.sim.io;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of a simulation request as stored in JSON.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SimulationDefinition {
    private SimulationInfo simulation;

    /** Name plus the rule, boost and protection lists of one simulation. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class SimulationInfo {
        private String name;
        private List<RuleDef> rules;
        private List<BoostDef> boosts;
        private List<ProtectDef> protections;
    }

    /**
     * One rule. {@code kind} selects linking (default), menu or footer; the
     * fields that do not apply to a kind are ignored.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class RuleDef {
        private String kind;
        @JsonAlias("source_types")
        private List<String> sourceTypes;
        @JsonAlias("source_categories")
        private List<String> sourceCategories;
        @JsonAlias("target_types")
        private List<String> targetTypes;
        @JsonAlias("target_categories")
        private List<String> targetCategories;
        @JsonAlias("selection_method")
        private String selectionMethod;
        @JsonAlias("links_per_page")
        private Integer linksPerPage;
        private Boolean bidirectional;
        @JsonAlias("avoid_self_links")
        private Boolean avoidSelfLinks;
        @JsonAlias("link_position")
        private String linkPosition;
        private String action;
        @JsonAlias("target_urls")
        private List<String> targetUrls;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class BoostDef {
        private String url;
        @JsonAlias({"target_factor", "boost_factor", "boostFactor"})
        private Double targetFactor;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ProtectDef {
        private String url;
        @JsonAlias("protection_factor")
        private Double protectionFactor;
    }
}
