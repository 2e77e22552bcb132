package com.deepknow.abis.interview.domain.error;

public class SimilarityUnavailableException extends InterviewException {
    public SimilarityUnavailableException(String message, Throwable cause) {
        super("SIMILARITY_UNAVAILABLE", message, cause);
    }
}
