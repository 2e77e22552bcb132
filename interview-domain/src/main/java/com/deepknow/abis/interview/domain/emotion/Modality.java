package com.deepknow.abis.interview.domain.emotion;

/**
 * 检测通道：面部（视频帧）或语音（音频窗口）。
 */
public enum Modality {
    FACIAL("facial"),
    VOICE("voice");

    private final String wireName;

    Modality(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() { return wireName; }

    public static Modality fromWireName(String name) {
        if (name == null) return null;
        for (Modality m : values()) {
            if (m.wireName.equalsIgnoreCase(name.trim())) return m;
        }
        return null;
    }
}
