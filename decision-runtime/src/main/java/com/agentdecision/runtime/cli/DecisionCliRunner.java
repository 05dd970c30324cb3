package com.agentdecision.runtime.cli;

import com.agentdecision.runtime.driver.DriverStats;
import com.agentdecision.runtime.driver.DriverStep;
import com.agentdecision.runtime.driver.EnvironmentDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Drives the configured agent with the non-option command-line arguments,
 * one percept per argument, and logs one line per decision. Failures are
 * marked with {@code !}.
 */
@Component
public class DecisionCliRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(DecisionCliRunner.class);

    private final EnvironmentDriver<String, String> driver;

    public DecisionCliRunner(EnvironmentDriver<String, String> driver) {
        this.driver = driver;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> percepts = args.getNonOptionArgs();
        if (percepts.isEmpty()) {
            log.info("No percepts given, nothing to decide agent={}", driver.agent().agentName());
            return;
        }

        log.info("Driving agent={} percepts={}", driver.agent().agentName(), percepts.size());
        for (DriverStep<String, String> step : driver.run(percepts)) {
            log.info("{} {} -> {}", step.index(), step.percept(),
                     step.decision().fold(action -> action, error -> "!" + error));
        }

        DriverStats stats = driver.stats();
        log.info("Run complete agent={} percepts={} actions={} failures={}",
                 driver.agent().agentName(), stats.percepts(), stats.actions(), stats.failures());
    }
}
