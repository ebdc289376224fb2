package com.bountyscope.core.triage;

import com.bountyscope.core.config.ConfigurationException;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * Logistic regression over binary bag-of-words features.
 * <p>
 * The model is persisted as JSON:
 * <pre>
 * {"vocabulary": {"token": weight, ...}, "bias": 0.0, "examples": 120, "accuracy": 0.91}
 * </pre>
 */
public class LogisticTextClassifier implements FindingClassifier {

    private static final Logger log = LoggerFactory.getLogger(LogisticTextClassifier.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final Map<String, Double> weights;
    private final double bias;
    private final boolean trained;

    public LogisticTextClassifier(Map<String, Double> weights, double bias) {
        weights.forEach((token, weight) -> {
            if (token == null || weight == null || !Double.isFinite(weight)) {
                throw new IllegalArgumentException("Invalid weight for token '" + token + "': " + weight);
            }
        });
        this.weights = Map.copyOf(weights);
        this.bias = bias;
        this.trained = true;
    }

    private LogisticTextClassifier() {
        this.weights = Map.of();
        this.bias = 0.0;
        this.trained = false;
    }

    public static LogisticTextClassifier untrained() {
        return new LogisticTextClassifier();
    }

    /**
     * Loads a model file. A missing file yields an untrained classifier; an unreadable
     * or malformed one is a configuration error.
     */
    public static LogisticTextClassifier load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            log.info("No triage model at {}; classifier scores stay neutral", path);
            return untrained();
        }
        try {
            Model model = MAPPER.readValue(path.toFile(), Model.class);
            if (model.vocabulary() == null) {
                throw new ConfigurationException("Triage model " + path + " has no vocabulary");
            }
            model.vocabulary().forEach((token, weight) -> {
                if (weight == null || !Double.isFinite(weight)) {
                    throw new ConfigurationException("Triage model " + path + " has an invalid weight for '"
                            + token + "': " + weight);
                }
            });
            log.info("Loaded triage model from {} ({} features)", path, model.vocabulary().size());
            return new LogisticTextClassifier(model.vocabulary(), model.bias());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read triage model " + path + ": " + e.getMessage(), e);
        }
    }

    public void save(Path path, int examples, double accuracy) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        MAPPER.writeValue(path.toFile(), new Model(new TreeMap<>(weights), bias, examples, accuracy));
    }

    @Override
    public OptionalDouble predict(String text) {
        if (!trained) {
            return OptionalDouble.empty();
        }
        double z = bias;
        for (String token : TextFeatures.tokens(text)) {
            z += weights.getOrDefault(token, 0.0);
        }
        return OptionalDouble.of(sigmoid(z));
    }

    @Override
    public boolean isTrained() {
        return trained;
    }

    public Map<String, Double> weights() {
        return weights;
    }

    public double bias() {
        return bias;
    }

    static double sigmoid(double z) {
        return 1.0 / (1.0 + Math.exp(-z));
    }

    record Model(
        @JsonProperty("vocabulary") Map<String, Double> vocabulary,
        @JsonProperty("bias") double bias,
        @JsonProperty("examples") int examples,
        @JsonProperty("accuracy") double accuracy
    ) {}
}
