package com.deepknow.abis.interview.domain.assessment.service;

import com.deepknow.abis.interview.domain.assessment.model.Transcript;

/**
 * 转写适配器：把定稿的音频产物转成带时间戳的转写。
 * 失败抛出 TranscriptionException；空结果同样视为失败。
 */
public interface TranscriptionClient {
    Transcript transcribe(String audioArtifactRef);
}
