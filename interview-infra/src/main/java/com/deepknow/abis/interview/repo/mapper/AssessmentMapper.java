package com.deepknow.abis.interview.repo.mapper;

import com.deepknow.abis.interview.domain.assessment.model.Assessment;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface AssessmentMapper {
    /**
     * 依赖 (session_id, indicator_id) 唯一键：冲突时只覆盖 AI 字段。
     */
    int upsertAiResult(Assessment assessment);
    int updateManualScore(@Param("sessionId") String sessionId, @Param("indicatorId") Long indicatorId,
                          @Param("manualScore") Double manualScore, @Param("notes") String notes);
    Assessment find(@Param("sessionId") String sessionId, @Param("indicatorId") Long indicatorId);
    List<Assessment> listBySession(@Param("sessionId") String sessionId);
}
