package com.bountyscope.core.advisory;

import java.util.function.Function;

/**
 * Result of an advisory call: either a value or the reason it could not be obtained.
 * Advisory failures never surface as exceptions to callers.
 */
public record AdvisoryOutcome<T>(T value, String failure) {

    public static <T> AdvisoryOutcome<T> success(T value) {
        return new AdvisoryOutcome<>(value, null);
    }

    public static <T> AdvisoryOutcome<T> failed(String failure) {
        return new AdvisoryOutcome<>(null, failure != null ? failure : "advisory failure");
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public <R> AdvisoryOutcome<R> map(Function<T, R> mapper) {
        return isSuccess() ? success(mapper.apply(value)) : failed(failure);
    }
}
