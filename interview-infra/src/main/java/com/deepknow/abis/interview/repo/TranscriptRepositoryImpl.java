package com.deepknow.abis.interview.repo;

import com.deepknow.abis.interview.domain.assessment.model.Transcript;
import com.deepknow.abis.interview.domain.assessment.model.TranscriptSegment;
import com.deepknow.abis.interview.domain.assessment.service.TranscriptRepository;
import com.deepknow.abis.interview.repo.mapper.TranscriptSegmentMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Repository
public class TranscriptRepositoryImpl implements TranscriptRepository {
    private final TranscriptSegmentMapper segmentMapper;

    public TranscriptRepositoryImpl(TranscriptSegmentMapper segmentMapper) {
        this.segmentMapper = segmentMapper;
    }

    @Override
    @Transactional
    public void replace(String sessionId, Transcript transcript) {
        segmentMapper.deleteBySession(sessionId);
        if (transcript != null && !transcript.getSegments().isEmpty()) {
            segmentMapper.batchInsert(sessionId, transcript.getSegments());
        }
    }

    @Override
    public Transcript find(String sessionId) {
        List<TranscriptSegment> segments = segmentMapper.listBySession(sessionId);
        if (segments == null || segments.isEmpty()) return null;
        return new Transcript(segments);
    }
}
