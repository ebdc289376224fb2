package com.bountyscope.core.triage;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "bounty.triage")
public class TriageProperties {

    private double mlWeight = 0.4;
    private double llmWeight = 0.6;
    /** Trained classifier JSON; a missing file leaves the classifier untrained. */
    private String modelPath = "models/triage_model.json";
    private double falsePositiveThreshold = 0.3;

    public double getMlWeight() {
        return mlWeight;
    }

    public void setMlWeight(double mlWeight) {
        this.mlWeight = mlWeight;
    }

    public double getLlmWeight() {
        return llmWeight;
    }

    public void setLlmWeight(double llmWeight) {
        this.llmWeight = llmWeight;
    }

    public String getModelPath() {
        return modelPath;
    }

    public void setModelPath(String modelPath) {
        this.modelPath = modelPath;
    }

    public double getFalsePositiveThreshold() {
        return falsePositiveThreshold;
    }

    public void setFalsePositiveThreshold(double falsePositiveThreshold) {
        this.falsePositiveThreshold = falsePositiveThreshold;
    }
}
