package com.bountyscope.core.triage;

import java.util.OptionalDouble;

/**
 * Local true-positive classifier over finding text.
 */
public interface FindingClassifier {

    /**
     * Probability in [0,1] that the finding is a true positive, or empty when the
     * classifier has no trained model.
     */
    OptionalDouble predict(String text);

    boolean isTrained();
}
