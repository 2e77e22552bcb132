package com.deepknow.abis.interview.domain.emotion;

/**
 * 空检测窗口的稳定度取值策略。
 * STABLE：没有相反证据即视为稳定，取 1.0；UNDEFINED：不给出数值。
 */
public enum EmptyWindowPolicy {
    STABLE,
    UNDEFINED
}
