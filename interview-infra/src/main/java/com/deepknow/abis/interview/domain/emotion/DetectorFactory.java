package com.deepknow.abis.interview.domain.emotion;

import com.deepknow.abis.interview.config.DetectorProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * 检测器工厂：按 detector.* 配置选择实现。
 */
@Component
public class DetectorFactory {
    private static final Logger log = LoggerFactory.getLogger(DetectorFactory.class);

    private final DetectorProperties properties;
    private final ObjectMapper objectMapper;

    public DetectorFactory(DetectorProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public FacialEmotionDetector createFacial() {
        if ("remote".equalsIgnoreCase(properties.getFacialProvider())) {
            log.info("Facial detector: remote endpoint={}", properties.getFacialEndpoint());
            return new RemoteFacialEmotionDetector(properties.getFacialEndpoint(), properties.getFacialTimeoutMs(), objectMapper);
        }
        log.info("Facial detector: mock");
        return new MockFacialEmotionDetector();
    }

    public VoiceEmotionDetector createVoice() {
        if ("mock".equalsIgnoreCase(properties.getVoiceProvider())) {
            log.info("Voice detector: mock");
            return new MockVoiceEmotionDetector();
        }
        log.info("Voice detector: acoustic");
        return new AcousticVoiceEmotionDetector();
    }
}
