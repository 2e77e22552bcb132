package com.deepknow.abis.interview.repo.mapper;

import com.deepknow.abis.interview.domain.session.model.InterviewSession;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;

@Mapper
public interface InterviewSessionMapper {
    int insert(InterviewSession session);
    InterviewSession findById(@Param("id") String id);
    int updateStatus(@Param("id") String id, @Param("status") String status, @Param("endTime") LocalDateTime endTime);
    int updateAudioArtifact(@Param("id") String id, @Param("audioArtifactRef") String audioArtifactRef);
    int updateProcessingStatus(@Param("id") String id, @Param("processingStatus") String processingStatus,
                               @Param("processingError") String processingError);
}
