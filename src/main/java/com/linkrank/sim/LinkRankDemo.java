package com.linkrank.sim;

import com.linkrank.sim.io.CompiledSimulation;
import com.linkrank.sim.io.DefinitionParser;
import com.linkrank.sim.io.SettingsLoader;
import com.linkrank.sim.io.SimulatorSettings;
import com.linkrank.sim.model.Edge;
import com.linkrank.sim.model.Page;
import com.linkrank.sim.model.PageResult;
import com.linkrank.sim.sim.RunOptions;
import com.linkrank.sim.sim.RunRequest;
import com.linkrank.sim.sim.RunSummary;
import com.linkrank.sim.sim.SimulationDispatcher;
import com.linkrank.sim.sim.SimulationOrchestrator;
import com.linkrank.sim.sim.SubmittedRun;
import com.linkrank.sim.store.InMemorySimulationStore;
import com.linkrank.sim.util.IterationProfileListener;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the simulation defined in {@code demo_simulation.json} against a
 * small shop-like site held in memory.
 */
public class LinkRankDemo {
    private static final Logger log = LogManager.getLogger(LinkRankDemo.class);

    public static final long PROJECT_ID = 1L;

    public static void main(String[] args) throws Exception {
        log.info("Starting link graph simulation demo...");
        RunSummary summary = runDemo();
        log.info("Run {} finished with status {}: {} new link(s), {} removed", summary.runId(), summary.status(),
                summary.newLinksCount(), summary.removedLinksCount());
        log.info("Stats: {}", summary.stats());
    }

    public static RunSummary runDemo() throws Exception {
        // 1. Site: home, two categories with three products each, a blog post
        InMemorySimulationStore store = new InMemorySimulationStore();
        store.putProject(PROJECT_ID, demoPages(), demoLinks());

        // 2. Settings and definition
        SimulatorSettings settings = SettingsLoader.loadDefault();
        CompiledSimulation simulation = DefinitionParser.compile(
                DefinitionParser.parseResource("demo_simulation.json"));

        // 3. Run through the dispatcher with a profile listener attached
        SimulationOrchestrator orchestrator = new SimulationOrchestrator(store, settings);
        log.info("Graph before: {}", orchestrator.graphStats(PROJECT_ID));
        IterationProfileListener profile = new IterationProfileListener();
        try (SimulationDispatcher dispatcher = new SimulationDispatcher(orchestrator, 8)) {
            SubmittedRun submitted = dispatcher.submit(new RunRequest(PROJECT_ID, simulation.name(),
                    simulation.rules(), simulation.boosts(), simulation.protections(),
                    RunOptions.defaults().withSeed(42L).withListener(profile)));
            RunSummary summary = submitted.result().get();

            log.info("Solver profile:\n{}", profile.dump());
            for (PageResult r : store.getRun(summary.runId()).orElseThrow().results())
                log.info("page {} -> {} ({})", r.pageId(), String.format("%.5f", r.newScore()),
                        String.format("%+.5f", r.delta()));
            return summary;
        }
    }

    static List<Page> demoPages() {
        List<Page> pages = new ArrayList<>();
        pages.add(new Page(1, "https://shop.example/", "home", "home", 0.0));
        pages.add(new Page(2, "https://shop.example/shoes", "category", "shoes", 0.0));
        pages.add(new Page(3, "https://shop.example/bags", "category", "bags", 0.0));
        long id = 4;
        for (String cat : List.of("shoes", "bags")) {
            for (int i = 1; i <= 3; i++)
                pages.add(new Page(id++, "https://shop.example/" + cat + "/item-" + i, "product", cat, 0.0));
        }
        pages.add(new Page(id, "https://shop.example/blog/care-guide", "blog", "blog", 0.0));
        return pages;
    }

    static List<Edge> demoLinks() {
        List<Edge> links = new ArrayList<>();
        links.add(Edge.of(1, 2));
        links.add(Edge.of(1, 3));
        links.add(Edge.of(2, 1));
        links.add(Edge.of(3, 1));
        for (long p = 4; p <= 6; p++) {
            links.add(Edge.of(2, p));
            links.add(Edge.of(p, 2));
        }
        for (long p = 7; p <= 9; p++) {
            links.add(Edge.of(3, p));
            links.add(Edge.of(p, 3));
        }
        links.add(Edge.of(10, 1));
        return links;
    }
}
