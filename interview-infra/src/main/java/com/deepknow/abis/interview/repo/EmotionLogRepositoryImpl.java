package com.deepknow.abis.interview.repo;

import com.deepknow.abis.interview.domain.emotion.EmotionLogRepository;
import com.deepknow.abis.interview.domain.emotion.EmotionSample;
import com.deepknow.abis.interview.repo.mapper.EmotionSampleMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Repository
public class EmotionLogRepositoryImpl implements EmotionLogRepository {
    private static final Logger logger = LoggerFactory.getLogger(EmotionLogRepositoryImpl.class);
    private static final int BATCH_SIZE = 500;

    private final EmotionSampleMapper sampleMapper;

    public EmotionLogRepositoryImpl(EmotionSampleMapper sampleMapper) {
        this.sampleMapper = sampleMapper;
    }

    @Override
    @Transactional
    public int persist(String sessionId, List<EmotionSample> samples) {
        if (samples == null || samples.isEmpty()) return 0;
        int written = 0;
        for (int from = 0; from < samples.size(); from += BATCH_SIZE) {
            List<EmotionSample> batch = samples.subList(from, Math.min(samples.size(), from + BATCH_SIZE));
            written += sampleMapper.batchInsert(batch);
        }
        logger.info("Persisted emotion log: sessionId={}, samples={}", sessionId, written);
        return written;
    }

    @Override
    public List<EmotionSample> listBySession(String sessionId) {
        return sampleMapper.listBySession(sessionId);
    }
}
