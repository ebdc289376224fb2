package com.bountyscope.dispatch.cli;

import com.bountyscope.core.triage.ClassifierTrainer;
import com.bountyscope.core.triage.LabeledExample;
import com.bountyscope.core.triage.TriageProperties;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: bountyscope train --data labeled.json
 * <p>
 * Fits the local triage classifier on labeled findings and saves the model file.
 */
@Command(name = "train", mixinStandardHelpOptions = true, description = "Train the local triage classifier")
@Component
public class TrainCommand implements Callable<Integer> {

    @Option(names = "--data", required = true, description = "JSON array of labeled findings")
    private Path data;

    @Option(names = "--output", description = "Model file to write (defaults to bounty.triage.model-path)")
    private Path output;

    private final ClassifierTrainer trainer;
    private final TriageProperties triageProperties;

    public TrainCommand(ClassifierTrainer trainer, TriageProperties triageProperties) {
        this.trainer = trainer;
        this.triageProperties = triageProperties;
    }

    @Override
    public Integer call() throws IOException {
        ConsoleOutput.printBanner();
        List<LabeledExample> examples = trainer.loadExamples(data);
        ConsoleOutput.info("Loaded " + examples.size() + " labeled example(s) from " + data);

        ClassifierTrainer.TrainingReport report;
        try {
            report = trainer.train(examples);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return CommandLine.ExitCode.USAGE;
        }

        Path target = output != null ? output : Path.of(triageProperties.getModelPath());
        report.classifier().save(target, examples.size(), report.accuracy());
        ConsoleOutput.success(String.format("Trained on %d, tested on %d, accuracy %.2f",
                report.trainSize(), report.testSize(), report.accuracy()));
        ConsoleOutput.success("Model saved to " + target);
        return CommandLine.ExitCode.OK;
    }
}
