package com.deepknow.abis.interview.domain.assessment.service;

import java.util.List;

/**
 * 句向量相似度协作者：返回 query 与每个候选文本的相似度（[0,1]，与输入同序）。
 * 不可用时抛出 SimilarityUnavailableException。
 */
public interface SimilarityScorer {
    List<Double> similarities(String query, List<String> candidates);
}
