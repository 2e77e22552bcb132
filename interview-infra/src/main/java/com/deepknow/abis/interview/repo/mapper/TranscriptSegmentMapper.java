package com.deepknow.abis.interview.repo.mapper;

import com.deepknow.abis.interview.domain.assessment.model.TranscriptSegment;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface TranscriptSegmentMapper {
    int deleteBySession(@Param("sessionId") String sessionId);
    int batchInsert(@Param("sessionId") String sessionId, @Param("segments") List<TranscriptSegment> segments);
    List<TranscriptSegment> listBySession(@Param("sessionId") String sessionId);
}
