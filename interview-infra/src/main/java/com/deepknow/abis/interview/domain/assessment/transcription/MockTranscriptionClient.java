package com.deepknow.abis.interview.domain.assessment.transcription;

import com.deepknow.abis.interview.domain.assessment.model.Transcript;
import com.deepknow.abis.interview.domain.assessment.model.TranscriptSegment;
import com.deepknow.abis.interview.domain.assessment.service.TranscriptionClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 本地联调用的固定转写。
 */
public class MockTranscriptionClient implements TranscriptionClient {
    private static final Logger log = LoggerFactory.getLogger(MockTranscriptionClient.class);

    @Override
    public Transcript transcribe(String audioArtifactRef) {
        log.info("Mock transcription: ref={}", audioArtifactRef);
        return new Transcript(List.of(
                TranscriptSegment.interviewer("Tell me about a project you led.", 0.0, 3.0),
                TranscriptSegment.candidate("I led a team of five engineers to rebuild our billing pipeline. "
                        + "We split the monolith into services and cut the batch time from six hours to forty minutes.", 3.5, 15.0),
                TranscriptSegment.interviewer("How did you handle disagreement?", 15.5, 18.0),
                TranscriptSegment.candidate("When two engineers disagreed on the queue design, I set up a short spike "
                        + "so both options could be measured, and we picked the one with better latency.", 18.5, 30.0)
        ));
    }
}
