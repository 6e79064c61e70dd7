package com.linkrank.sim.model;

import com.linkrank.sim.rules.LinkRule;

import java.util.List;

/**
 * Persisted record of one simulation. Immutable; the store replaces it on
 * every status change or result save.
 */
public record SimulationRun(long id, long projectId, String name, List<LinkRule> rules,
        List<BoostSpec> boosts, List<ProtectSpec> protections, RunStatus status, List<PageResult> results) {

    public SimulationRun {
        rules = List.copyOf(rules);
        boosts = List.copyOf(boosts);
        protections = List.copyOf(protections);
        results = List.copyOf(results);
    }

    public SimulationRun withStatus(RunStatus next) {
        return new SimulationRun(id, projectId, name, rules, boosts, protections, next, results);
    }

    public SimulationRun withResults(List<PageResult> next) {
        return new SimulationRun(id, projectId, name, rules, boosts, protections, status, next);
    }
}
