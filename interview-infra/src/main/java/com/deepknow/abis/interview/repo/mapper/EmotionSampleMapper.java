package com.deepknow.abis.interview.repo.mapper;

import com.deepknow.abis.interview.domain.emotion.EmotionSample;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface EmotionSampleMapper {
    int batchInsert(@Param("samples") List<EmotionSample> samples);
    List<EmotionSample> listBySession(@Param("sessionId") String sessionId);
}
