package com.hypothesis.exception;

import com.hypothesis.core.ErrorKind;
import lombok.Getter;

/**
 * Base class of every failure the research pipeline knows how to classify.
 *
 * <p>{@code retryable} tells the generate/execute loop whether producing a new query may help.
 * {@code attempts} is the number of query generations spent before the failure, 1 unless set by the loop.
 */
@Getter
public class ResearchException extends RuntimeException {

    private final ErrorKind kind;
    private final boolean retryable;
    private int attempts = 1;

    public ResearchException(ErrorKind kind, String message) {
        this(kind, message, kind.isRetryableByDefault(), null);
    }

    public ResearchException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, kind.isRetryableByDefault(), cause);
    }

    public ResearchException(ErrorKind kind, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.retryable = retryable;
    }

    /**
     * Records the attempt on which the failure occurred.
     */
    public ResearchException atAttempt(int attempt) {
        this.attempts = attempt;
        return this;
    }
}
