package com.linkrank.sim.io;

import com.linkrank.sim.api.ValidationException;
import com.linkrank.sim.model.BoostSpec;
import com.linkrank.sim.model.LinkPosition;
import com.linkrank.sim.model.ProtectSpec;
import com.linkrank.sim.rules.LinkRule;
import com.linkrank.sim.rules.PageFilter;
import com.linkrank.sim.rules.RuleSpec;
import com.linkrank.sim.rules.SelectionMethod;
import com.linkrank.sim.rules.StructuralAction;
import com.linkrank.sim.rules.StructuralRuleSpec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import lombok.extern.log4j.Log4j2;

/**
 * Reads JSON simulation definitions and compiles them into rule, boost and
 * protection value types.
 *
 * Defaults follow the rule types: three links per page, self links avoided,
 * category selection, content placement, protection factor 0.05. Missing
 * filters mean no restriction.
 */
@Log4j2
public final class DefinitionParser {
    public static final double DEFAULT_PROTECTION_FACTOR = 0.05;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private DefinitionParser() {
        // Utility class
    }

    /** Parses a JSON file into a SimulationDefinition. */
    public static SimulationDefinition parseFile(Path path) throws IOException {
        return parse(Files.readString(path));
    }

    /** Parses a classpath resource into a SimulationDefinition. */
    public static SimulationDefinition parseResource(String resource) throws IOException {
        try (InputStream in = DefinitionParser.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null)
                throw new IOException("Resource not found: " + resource);
            return MAPPER.readValue(in, SimulationDefinition.class);
        }
    }

    /** Parses a JSON string into a SimulationDefinition. */
    public static SimulationDefinition parse(String json) {
        try {
            SimulationDefinition def = MAPPER.readValue(json, SimulationDefinition.class);
            if (def == null || def.getSimulation() == null)
                throw new ValidationException("Missing 'simulation' key");
            return def;
        } catch (JsonProcessingException e) {
            throw new ValidationException("Malformed simulation definition: " + e.getOriginalMessage());
        }
    }

    public static CompiledSimulation compile(SimulationDefinition def) {
        SimulationDefinition.SimulationInfo info = def.getSimulation();
        if (info == null)
            throw new ValidationException("Missing 'simulation' key");

        List<LinkRule> rules = new ArrayList<>();
        if (info.getRules() != null) {
            for (SimulationDefinition.RuleDef rd : info.getRules())
                rules.add(compileRule(rd));
        }

        List<BoostSpec> boosts = new ArrayList<>();
        if (info.getBoosts() != null) {
            for (SimulationDefinition.BoostDef bd : info.getBoosts()) {
                if (bd.getTargetFactor() == null)
                    throw new ValidationException("Boost for " + bd.getUrl() + " has no target factor");
                boosts.add(new BoostSpec(bd.getUrl(), bd.getTargetFactor()));
            }
        }

        List<ProtectSpec> protections = new ArrayList<>();
        if (info.getProtections() != null) {
            for (SimulationDefinition.ProtectDef pd : info.getProtections()) {
                double factor = pd.getProtectionFactor() == null ? DEFAULT_PROTECTION_FACTOR
                        : pd.getProtectionFactor();
                protections.add(new ProtectSpec(pd.getUrl(), factor));
            }
        }

        String name = info.getName() == null || info.getName().isBlank() ? "simulation" : info.getName();
        log.debug("Compiled simulation '{}': {} rule(s), {} boost(s), {} protection(s)", name, rules.size(),
                boosts.size(), protections.size());
        return new CompiledSimulation(name, rules, boosts, protections);
    }

    static LinkRule compileRule(SimulationDefinition.RuleDef rd) {
        String kind = rd.getKind() == null ? "linking" : rd.getKind().trim().toLowerCase(Locale.ROOT);
        return switch (kind) {
            case "", "linking", "link", "multi" -> RuleSpec.builder()
                    .from(PageFilter.of(rd.getSourceTypes(), rd.getSourceCategories()))
                    .to(PageFilter.of(rd.getTargetTypes(), rd.getTargetCategories()))
                    .selection(SelectionMethod.fromString(rd.getSelectionMethod()))
                    .linksPerPage(rd.getLinksPerPage() == null ? RuleSpec.DEFAULT_LINKS_PER_PAGE : rd.getLinksPerPage())
                    .bidirectional(Boolean.TRUE.equals(rd.getBidirectional()))
                    .avoidSelfLinks(rd.getAvoidSelfLinks() == null || rd.getAvoidSelfLinks())
                    .position(LinkPosition.fromString(rd.getLinkPosition()))
                    .build();
            case "menu" -> StructuralRuleSpec.menu(StructuralAction.fromString(rd.getAction()), urls(rd));
            case "footer" -> StructuralRuleSpec.footer(StructuralAction.fromString(rd.getAction()), urls(rd),
                    rd.getSourceTypes());
            default -> throw new ValidationException("Unknown rule kind: " + rd.getKind());
        };
    }

    private static List<String> urls(SimulationDefinition.RuleDef rd) {
        return rd.getTargetUrls() == null ? List.of() : rd.getTargetUrls();
    }
}
