package com.bountyscope.core.engine;

/**
 * Observable run-level cancellation: external cancel or deadline expiry.
 */
public interface CancellationSignal {

    CancellationSignal NONE = new CancellationSignal() {
        @Override
        public boolean isCancelled() {
            return false;
        }

        @Override
        public String reason() {
            return "";
        }
    };

    boolean isCancelled();

    /** "cancelled" or "timeout" once cancelled, empty otherwise. */
    String reason();

    default void throwIfCancelled() {
        if (isCancelled()) {
            throw new RunCancelledException(reason());
        }
    }
}
