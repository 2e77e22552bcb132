package com.deepknow.abis.interview.domain.session.model;

/**
 * 会后批量评估状态。FAILED 为终态，需要重新提交。
 */
public enum ProcessingStatus {
    RECORDING,
    PROCESSING,
    COMPLETED,
    FAILED
}
