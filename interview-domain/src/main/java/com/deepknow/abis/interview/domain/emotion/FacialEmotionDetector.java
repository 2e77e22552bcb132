package com.deepknow.abis.interview.domain.emotion;

import java.util.Optional;

/**
 * 面部情绪识别适配器（外部模型）。输入一张已解码的图像（JPEG/PNG 字节）。
 * 未检测到人脸时返回 empty；调用失败抛出 DetectorUnavailableException。
 */
public interface FacialEmotionDetector {
    Optional<EmotionDetection> detect(byte[] image);
}
