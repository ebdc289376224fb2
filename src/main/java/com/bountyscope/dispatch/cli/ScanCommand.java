package com.bountyscope.dispatch.cli;

import com.bountyscope.core.engine.PipelineEngine;
import com.bountyscope.core.engine.RunRequest;
import com.bountyscope.core.events.EventBus;
import com.bountyscope.core.model.RunResult;
import com.bountyscope.core.model.ScanMode;
import com.bountyscope.core.model.ScopeDefinition;
import com.bountyscope.core.policy.PolicyProperties;
import com.bountyscope.core.scope.ScopeDefinitionLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: bountyscope scan --target example.com
 * <p>
 * Runs the pipeline for one target or for every line of a targets file. Exits 0 only
 * if every target completed.
 */
@Command(name = "scan", mixinStandardHelpOptions = true, description = "Run the scan pipeline against targets")
@Component
public class ScanCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ScanCommand.class);

    @Option(names = {"--target", "-t"}, description = "Single target domain")
    private String target;

    @Option(names = "--targets-file", description = "File with one target per line ('#' starts a comment)")
    private Path targetsFile;

    @Option(names = {"--mode", "-m"},
            description = "passive-only, safe-scan or full-scan-with-validation",
            defaultValue = "safe-scan")
    private String mode;

    @Option(names = "--scope-file", description = "Program scope JSON with in_scope/out_of_scope patterns")
    private Path scopeFile;

    @Option(names = "--allow-unblock", description = "Offer a manual override when scope is unresolved")
    private boolean allowUnblock;

    @Option(names = "--output-dir", description = "Parent directory for run artifacts")
    private Path outputDir;

    @Option(names = "--timeout", description = "Per-target timeout in seconds")
    private Long timeoutSeconds;

    private final PipelineEngine engine;
    private final ScopeDefinitionLoader scopeLoader;
    private final PolicyProperties policyProperties;
    private final EventBus eventBus;

    public ScanCommand(PipelineEngine engine, ScopeDefinitionLoader scopeLoader,
                       PolicyProperties policyProperties, EventBus eventBus) {
        this.engine = engine;
        this.scopeLoader = scopeLoader;
        this.policyProperties = policyProperties;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() throws IOException {
        ConsoleOutput.printBanner();

        ScanMode scanMode;
        try {
            scanMode = ScanMode.fromCliName(mode);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return CommandLine.ExitCode.USAGE;
        }

        List<String> targets = collectTargets();
        if (targets.isEmpty()) {
            ConsoleOutput.error("No targets given. Use --target or --targets-file");
            return CommandLine.ExitCode.USAGE;
        }

        ScopeDefinition scope = scopeLoader.load(scopeFile).orElse(null);
        if (scope == null) {
            ConsoleOutput.warn("No scope file given; targets will be refused unless manually unblocked");
        }
        var request = new RunRequest(null, scanMode, scope, allowUnblock, outputDir,
                timeoutSeconds != null ? Duration.ofSeconds(timeoutSeconds) : null,
                new ConsoleOverrideChannel(policyProperties.getOverrideToken()));

        ConsoleOutput.info("Scanning " + targets.size() + " target(s) in " + scanMode.cliName() + " mode");
        var subscription = eventBus.subscribeAll(ConsoleOutput::event);
        Thread shutdownHook = new Thread(engine::cancelAll, "bountyscope-cancel");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        List<RunResult> results;
        try {
            results = engine.runBatch(targets, request);
        } finally {
            subscription.unsubscribe();
            removeHook(shutdownHook);
        }

        System.out.println();
        results.forEach(ConsoleOutput::result);
        ConsoleOutput.summary(results);
        return results.stream().allMatch(RunResult::success) ? CommandLine.ExitCode.OK : 1;
    }

    List<String> collectTargets() throws IOException {
        var targets = new ArrayList<String>();
        if (target != null && !target.isBlank()) {
            targets.add(target.trim());
        }
        if (targetsFile != null) {
            for (String line : Files.readAllLines(targetsFile)) {
                String trimmed = line.trim();
                if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
                    targets.add(trimmed);
                }
            }
        }
        return targets;
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM is shutting down; cancel hook stays registered");
        }
    }
}
