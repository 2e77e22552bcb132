package com.deepknow.abis.interview.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({
        LiveSessionProperties.class,
        DetectorProperties.class,
        TranscriptionProperties.class,
        SimilarityProperties.class,
        AssessmentProperties.class
})
public class InterviewPropertiesConfig {
}
