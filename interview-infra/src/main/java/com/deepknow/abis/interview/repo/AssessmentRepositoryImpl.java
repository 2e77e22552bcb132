package com.deepknow.abis.interview.repo;

import com.deepknow.abis.interview.domain.assessment.model.Assessment;
import com.deepknow.abis.interview.domain.assessment.service.AssessmentRepository;
import com.deepknow.abis.interview.repo.mapper.AssessmentMapper;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public class AssessmentRepositoryImpl implements AssessmentRepository {
    private final AssessmentMapper assessmentMapper;

    public AssessmentRepositoryImpl(AssessmentMapper assessmentMapper) {
        this.assessmentMapper = assessmentMapper;
    }

    @Override
    public Assessment upsertAiResult(String sessionId, Long indicatorId, double aiScore, String evidence, String reasoning) {
        LocalDateTime now = LocalDateTime.now();
        Assessment a = new Assessment();
        a.setSessionId(sessionId);
        a.setIndicatorId(indicatorId);
        a.setAiScore(aiScore);
        a.setEvidence(evidence);
        a.setReasoning(reasoning);
        a.setCreatedAt(now);
        a.setUpdatedAt(now);
        assessmentMapper.upsertAiResult(a);
        return assessmentMapper.find(sessionId, indicatorId);
    }

    @Override
    public Assessment updateManualScore(String sessionId, Long indicatorId, Double manualScore, String notes) {
        int updated = assessmentMapper.updateManualScore(sessionId, indicatorId, manualScore, notes);
        if (updated == 0) return null;
        return assessmentMapper.find(sessionId, indicatorId);
    }

    @Override
    public Assessment find(String sessionId, Long indicatorId) {
        return assessmentMapper.find(sessionId, indicatorId);
    }

    @Override
    public List<Assessment> listBySession(String sessionId) {
        return assessmentMapper.listBySession(sessionId);
    }
}
