package com.deepknow.abis.interview.domain.scoring;

/**
 * 基于总分（0-100）的录用建议档位。
 */
public enum Recommendation {
    RECOMMENDED,
    CONSIDER,
    NOT_RECOMMENDED;

    public static Recommendation forOverall(double overallScore) {
        if (overallScore >= 80.0) return RECOMMENDED;
        if (overallScore >= 60.0) return CONSIDER;
        return NOT_RECOMMENDED;
    }
}
