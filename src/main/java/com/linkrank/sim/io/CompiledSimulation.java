package com.linkrank.sim.io;

import com.linkrank.sim.model.BoostSpec;
import com.linkrank.sim.model.ProtectSpec;
import com.linkrank.sim.rules.LinkRule;

import java.util.List;

/** A definition translated into domain types, ready for the orchestrator. */
public record CompiledSimulation(String name, List<LinkRule> rules, List<BoostSpec> boosts,
        List<ProtectSpec> protections) {

    public CompiledSimulation {
        rules = List.copyOf(rules);
        boosts = List.copyOf(boosts);
        protections = List.copyOf(protections);
    }
}
