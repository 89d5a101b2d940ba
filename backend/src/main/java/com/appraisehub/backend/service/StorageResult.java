package com.appraisehub.backend.service;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.function.Supplier;

/**
 * Outcome of a single-row write. Callers decide what a conflict or a failure
 * means for the batch they are running.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class StorageResult<T> {

    private final Outcome outcome;
    private final T value;
    private final String error;

    public static <T> StorageResult<T> success(T value) {
        return new StorageResult<>(Outcome.SUCCESS, value, null);
    }

    public static <T> StorageResult<T> conflict(String error) {
        return new StorageResult<>(Outcome.CONFLICT, null, error);
    }

    public static <T> StorageResult<T> failure(String error) {
        return new StorageResult<>(Outcome.FAILURE, null, error);
    }

    /**
     * Runs a write and folds the exceptions it may throw into a result.
     * Unique-key violations become {@link Outcome#CONFLICT}.
     */
    public static <T> StorageResult<T> capture(Supplier<StorageResult<T>> write) {
        try {
            return write.get();
        } catch (DataIntegrityViolationException e) {
            return conflict(e.getMostSpecificCause().getMessage());
        } catch (RuntimeException e) {
            return failure(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
    }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCESS;
    }

    public boolean isConflict() {
        return outcome == Outcome.CONFLICT;
    }

    public enum Outcome {
        SUCCESS, CONFLICT, FAILURE
    }
}
