package com.bountyscope.core.triage;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * Fits a {@link LogisticTextClassifier} from labeled findings with batch gradient descent
 * and L2 regularization, holding out a fifth of the examples to report accuracy.
 */
@Component
public class ClassifierTrainer {

    private static final Logger log = LoggerFactory.getLogger(ClassifierTrainer.class);

    static final int DEFAULT_EPOCHS = 300;
    static final double DEFAULT_LEARNING_RATE = 0.5;
    static final double DEFAULT_L2 = 0.001;
    static final int MAX_FEATURES = 1000;
    static final double HOLDOUT_FRACTION = 0.2;
    static final long SPLIT_SEED = 42L;

    private final ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public record TrainingReport(LogisticTextClassifier classifier, int trainSize, int testSize, double accuracy) {}

    public List<LabeledExample> loadExamples(Path dataFile) throws IOException {
        List<LabeledExample> examples = mapper.readValue(dataFile.toFile(), new TypeReference<List<LabeledExample>>() {});
        log.info("Loaded {} labeled examples from {}", examples.size(), dataFile);
        return examples;
    }

    public TrainingReport train(List<LabeledExample> examples) {
        return train(examples, DEFAULT_EPOCHS, DEFAULT_LEARNING_RATE, DEFAULT_L2);
    }

    /**
     * @throws IllegalArgumentException if fewer than two examples are given or only one class is present
     */
    public TrainingReport train(List<LabeledExample> examples, int epochs, double learningRate, double l2) {
        if (examples.size() < 2) {
            throw new IllegalArgumentException("At least two labeled examples are required");
        }
        boolean hasPositive = examples.stream().anyMatch(LabeledExample::positive);
        boolean hasNegative = examples.stream().anyMatch(e -> !e.positive());
        if (!hasPositive || !hasNegative) {
            throw new IllegalArgumentException("Training data must contain both true and false positives");
        }

        List<LabeledExample> shuffled = new ArrayList<>(examples);
        Collections.shuffle(shuffled, new Random(SPLIT_SEED));
        int testSize = shuffled.size() >= 5 ? (int) Math.max(1, Math.round(shuffled.size() * HOLDOUT_FRACTION)) : 0;
        List<LabeledExample> test = shuffled.subList(0, testSize);
        List<LabeledExample> train = shuffled.subList(testSize, shuffled.size());

        List<Set<String>> features = train.stream().map(e -> TextFeatures.tokens(e.text())).toList();
        List<String> vocabulary = selectVocabulary(features);
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < vocabulary.size(); i++) {
            index.put(vocabulary.get(i), i);
        }

        double[] w = new double[vocabulary.size()];
        double b = 0.0;
        int n = train.size();
        for (int epoch = 0; epoch < epochs; epoch++) {
            double[] gradW = new double[w.length];
            double gradB = 0.0;
            for (int i = 0; i < n; i++) {
                double z = b;
                for (String token : features.get(i)) {
                    Integer j = index.get(token);
                    if (j != null) {
                        z += w[j];
                    }
                }
                double error = LogisticTextClassifier.sigmoid(z) - train.get(i).label();
                for (String token : features.get(i)) {
                    Integer j = index.get(token);
                    if (j != null) {
                        gradW[j] += error;
                    }
                }
                gradB += error;
            }
            for (int j = 0; j < w.length; j++) {
                w[j] -= learningRate * (gradW[j] / n + l2 * w[j]);
            }
            b -= learningRate * gradB / n;
        }

        Map<String, Double> weights = new LinkedHashMap<>();
        for (int j = 0; j < w.length; j++) {
            weights.put(vocabulary.get(j), w[j]);
        }
        var classifier = new LogisticTextClassifier(weights, b);
        double accuracy = accuracy(classifier, test.isEmpty() ? train : test);
        log.info("Trained triage classifier on {} examples ({} features), accuracy {} on {} {} examples",
                n, weights.size(), String.format("%.3f", accuracy), test.isEmpty() ? n : test.size(),
                test.isEmpty() ? "training" : "held-out");
        return new TrainingReport(classifier, n, test.size(), accuracy);
    }

    static double accuracy(FindingClassifier classifier, List<LabeledExample> examples) {
        if (examples.isEmpty()) {
            return 0.0;
        }
        long correct = examples.stream()
                .filter(e -> (classifier.predict(e.text()).orElse(0.5) >= 0.5) == e.positive())
                .count();
        return (double) correct / examples.size();
    }

    /** Most frequent tokens by document frequency, ties broken alphabetically. */
    private static List<String> selectVocabulary(List<Set<String>> documents) {
        Map<String, Integer> frequency = new HashMap<>();
        for (Set<String> doc : documents) {
            for (String token : doc) {
                frequency.merge(token, 1, Integer::sum);
            }
        }
        return frequency.entrySet().stream()
                .sorted(Comparator.<Map.Entry<String, Integer>>comparingInt(Map.Entry::getValue).reversed()
                        .thenComparing(Map.Entry::getKey))
                .limit(MAX_FEATURES)
                .map(Map.Entry::getKey)
                .toList();
    }
}
