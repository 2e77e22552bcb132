package com.deepknow.abis.interview.domain.error;

/**
 * 配置非法：评分权重之和不为 100，或指标定义不合法。
 */
public class ConfigurationException extends InterviewException {
    public ConfigurationException(String message) {
        super("CONFIGURATION", message);
    }
}
