package com.deepknow.abis.interview.domain.error;

/**
 * 同一 (session, indicator) 已有评估在执行。
 */
public class AssessmentInProgressException extends InterviewException {
    public AssessmentInProgressException(String message) {
        super("ASSESSMENT_IN_PROGRESS", message);
    }
}
