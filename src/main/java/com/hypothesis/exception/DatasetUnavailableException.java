package com.hypothesis.exception;

import com.hypothesis.core.ErrorKind;

/**
 * Annotation dataset could not be loaded. Not retried.
 */
public class DatasetUnavailableException extends ResearchException {

    public DatasetUnavailableException(String message) {
        super(ErrorKind.DATASET_UNAVAILABLE, message);
    }

    public DatasetUnavailableException(String message, Throwable cause) {
        super(ErrorKind.DATASET_UNAVAILABLE, message, cause);
    }
}
