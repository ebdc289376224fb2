package com.bountyscope.core.triage;

import com.bountyscope.core.config.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ClassifierTrainerTest {

    @TempDir
    Path tempDir;

    private final ClassifierTrainer trainer = new ClassifierTrainer();

    private static List<LabeledExample> separableExamples() {
        List<LabeledExample> examples = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            examples.add(new LabeledExample("SQL Injection " + i, "database error leaked in response",
                    "high", Map.of("type", "http"), 1));
            examples.add(new LabeledExample("Missing Header " + i, "generic banner informational noise",
                    "info", Map.of("type", "http"), 0));
        }
        return examples;
    }

    @Nested
    @DisplayName("train")
    class Train {

        @Test
        @DisplayName("learns to separate true and false positives")
        void separatesClasses() {
            var report = trainer.train(separableExamples());

            assertEquals(16, report.trainSize());
            assertEquals(4, report.testSize());
            assertEquals(1.0, report.accuracy(), 1e-9);
            var classifier = report.classifier();
            assertTrue(classifier.isTrained());
            assertTrue(classifier.predict("SQL Injection database error").getAsDouble() > 0.5);
            assertTrue(classifier.predict("Missing Header banner noise").getAsDouble() < 0.5);
        }

        @Test
        @DisplayName("requires both classes")
        void requiresBothClasses() {
            var onlyPositive = List.of(
                    new LabeledExample("a", "", "high", Map.of(), 1),
                    new LabeledExample("b", "", "high", Map.of(), 1));

            assertThrows(IllegalArgumentException.class, () -> trainer.train(onlyPositive));
        }

        @Test
        @DisplayName("requires at least two examples")
        void requiresTwoExamples() {
            assertThrows(IllegalArgumentException.class,
                    () -> trainer.train(List.of(new LabeledExample("a", "", "high", Map.of(), 1))));
        }

        @Test
        @DisplayName("scores tiny sets on the training data")
        void tinySetHasNoHoldout() {
            var report = trainer.train(List.of(
                    new LabeledExample("xss reflected", "", "high", Map.of(), 1),
                    new LabeledExample("banner disclosure", "", "info", Map.of(), 0)));

            assertEquals(0, report.testSize());
            assertEquals(2, report.trainSize());
        }
    }

    @Nested
    @DisplayName("persistence")
    class Persistence {

        @Test
        @DisplayName("a saved model loads back with identical predictions")
        void saveAndLoad() throws IOException {
            var classifier = trainer.train(separableExamples()).classifier();
            Path model = tempDir.resolve("models/triage_model.json");

            classifier.save(model, 20, 1.0);
            var loaded = LogisticTextClassifier.load(model);

            String text = "SQL Injection database error";
            assertEquals(classifier.predict(text).getAsDouble(), loaded.predict(text).getAsDouble(), 1e-9);
        }

        @Test
        @DisplayName("a missing model file yields an untrained classifier")
        void missingModelIsUntrained() {
            var classifier = LogisticTextClassifier.load(tempDir.resolve("absent.json"));

            assertFalse(classifier.isTrained());
            assertTrue(classifier.predict("anything").isEmpty());
        }

        @Test
        @DisplayName("a malformed model file is a configuration error")
        void malformedModelFails() throws IOException {
            Path model = tempDir.resolve("broken.json");
            Files.writeString(model, "{not json");

            assertThrows(ConfigurationException.class, () -> LogisticTextClassifier.load(model));
        }

        @Test
        @DisplayName("a null weight is a configuration error")
        void nullWeight() throws IOException {
            Path model = tempDir.resolve("model.json");
            Files.writeString(model, "{\"vocabulary\": {\"sqli\": 1.5, \"banner\": null}, \"bias\": 0.1}");

            var error = assertThrows(ConfigurationException.class, () -> LogisticTextClassifier.load(model));

            assertTrue(error.getMessage().contains("banner"));
        }

        @Test
        @DisplayName("the constructor rejects non-finite weights")
        void constructorRejectsNonFinite() {
            assertThrows(IllegalArgumentException.class,
                    () -> new LogisticTextClassifier(Map.of("sqli", Double.NaN), 0.0));
        }

        @Test
        @DisplayName("reads labeled examples from a JSON array")
        void loadsExamples() throws IOException {
            Path data = tempDir.resolve("labeled.json");
            Files.writeString(data, """
                    [
                      {"name": "XSS", "description": "reflected", "severity": "high", "evidence": {}, "label": 1},
                      {"name": "Banner", "severity": "info", "label": 0, "source": "manual"}
                    ]
                    """);

            var examples = trainer.loadExamples(data);

            assertEquals(2, examples.size());
            assertTrue(examples.get(0).positive());
            assertFalse(examples.get(1).positive());
        }
    }
}
