package com.linkrank.sim.sim;

import com.linkrank.sim.model.BoostSpec;
import com.linkrank.sim.model.ProtectSpec;
import com.linkrank.sim.rules.LinkRule;

import java.util.List;

/** A simulation submitted for asynchronous execution. */
public record RunRequest(long projectId, String name, List<LinkRule> rules, List<BoostSpec> boosts,
        List<ProtectSpec> protections, RunOptions options) {

    public RunRequest {
        boosts = boosts == null ? List.of() : boosts;
        protections = protections == null ? List.of() : protections;
        options = options == null ? RunOptions.defaults() : options;
    }
}
