package com.deepknow.abis.interview.domain.scoring;

import com.deepknow.abis.interview.domain.error.ConfigurationException;
import com.deepknow.abis.interview.repo.mapper.AppSettingMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import javax.annotation.PostConstruct;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 权重以整对形式原子替换；先校验、再落库、事务提交后才切换内存值，任一步失败都保留旧值。
 * 落库与切换在同一把锁内完成，内存中的顺序与提交顺序一致。
 */
@Service
public class ScoringWeightsStoreImpl implements ScoringWeightsStore {
    private static final Logger logger = LoggerFactory.getLogger(ScoringWeightsStoreImpl.class);

    static final String AI_WEIGHT_KEY = "ai_score_weight";
    static final String MANUAL_WEIGHT_KEY = "manual_score_weight";

    private final AppSettingMapper settingMapper;
    private final TransactionOperations transactionOperations;
    private final AtomicReference<ScoringWeights> current = new AtomicReference<>(ScoringWeights.DEFAULT);
    private final Object updateLock = new Object();

    public ScoringWeightsStoreImpl(AppSettingMapper settingMapper, TransactionOperations transactionOperations) {
        this.settingMapper = settingMapper;
        this.transactionOperations = transactionOperations;
    }

    @PostConstruct
    public void load() {
        try {
            String ai = settingMapper.getValue(AI_WEIGHT_KEY);
            String manual = settingMapper.getValue(MANUAL_WEIGHT_KEY);
            if (ai == null || manual == null) {
                logger.info("Scoring weights not configured, using default {}", ScoringWeights.DEFAULT);
                return;
            }
            ScoringWeights loaded = new ScoringWeights(Integer.parseInt(ai.trim()), Integer.parseInt(manual.trim()));
            current.set(loaded);
            logger.info("Scoring weights loaded: {}", loaded);
        } catch (NumberFormatException | ConfigurationException e) {
            logger.warn("Stored scoring weights invalid, using default {}: {}", ScoringWeights.DEFAULT, e.getMessage());
        } catch (RuntimeException e) {
            logger.warn("Load scoring weights failed, using default {}", ScoringWeights.DEFAULT, e);
        }
    }

    @Override
    public ScoringWeights current() {
        return current.get();
    }

    @Override
    public ScoringWeights update(int aiWeight, int manualWeight) {
        ScoringWeights next;
        try {
            next = new ScoringWeights(aiWeight, manualWeight);
        } catch (ConfigurationException e) {
            logger.warn("Reject scoring weights update: ai={}, manual={}, keep {}", aiWeight, manualWeight, current.get());
            throw e;
        }
        ScoringWeights prev;
        synchronized (updateLock) {
            try {
                transactionOperations.executeWithoutResult(status -> {
                    settingMapper.upsert(AI_WEIGHT_KEY, String.valueOf(next.getAiWeight()));
                    settingMapper.upsert(MANUAL_WEIGHT_KEY, String.valueOf(next.getManualWeight()));
                });
            } catch (RuntimeException e) {
                logger.error("Persist scoring weights failed: next={}, keep {}", next, current.get(), e);
                throw e;
            }
            prev = current.getAndSet(next);
        }
        logger.info("Scoring weights updated: {} -> {}", prev, next);
        return next;
    }
}
