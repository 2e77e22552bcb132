package com.deepknow.abis.interview.domain.emotion;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 基于声学特征的语音情绪识别：对 PCM16 窗口逐帧计算能量（RMS）、过零率与自相关基频，
 * 映射为唤醒度（arousal）与效价（valence），再落到 confident / nervous / excited / calm / tired / neutral。
 * <p>
 * 静音、过短或无浊音帧的窗口不产出结果。
 */
public class AcousticVoiceEmotionDetector implements VoiceEmotionDetector {
    private static final Logger log = LoggerFactory.getLogger(AcousticVoiceEmotionDetector.class);

    static final int MIN_SAMPLES = 1600; // 0.1s @16kHz
    static final double SILENCE_RMS = 0.005;
    private static final double VOICED_RMS = 0.01;
    private static final double MIN_PITCH_HZ = 70.0;
    private static final double MAX_PITCH_HZ = 400.0;
    private static final double VOICING_CORRELATION = 0.3;

    @Override
    public Optional<EmotionDetection> detect(byte[] pcmWindow, int sampleRate) {
        if (pcmWindow == null || sampleRate <= 0) return Optional.empty();
        double[] audio = toFloat(pcmWindow);
        if (audio.length < MIN_SAMPLES) {
            log.trace("Voice window too short: samples={}", audio.length);
            return Optional.empty();
        }
        Features f = extract(audio, sampleRate);
        if (f == null) return Optional.empty();
        return Optional.of(classify(f));
    }

    Features extract(double[] audio, int sampleRate) {
        int frame = Math.max(64, sampleRate / 40);  // 25ms
        int hop = Math.max(32, sampleRate / 100);   // 10ms
        int frames = 0;
        double energySum = 0, energySq = 0;
        double zcrSum = 0;
        double pitchSum = 0, pitchSq = 0;
        int pitchCount = 0;
        int onsets = 0;
        boolean prevVoiced = false;

        for (int start = 0; start + frame <= audio.length; start += hop) {
            double rms = rms(audio, start, frame);
            energySum += rms;
            energySq += rms * rms;
            zcrSum += zeroCrossingRate(audio, start, frame);
            frames++;

            boolean voiced = false;
            if (rms >= VOICED_RMS) {
                double pitch = pitch(audio, start, frame, sampleRate);
                if (pitch > 0) {
                    pitchSum += pitch;
                    pitchSq += pitch * pitch;
                    pitchCount++;
                    voiced = true;
                }
            }
            if (voiced && !prevVoiced) onsets++;
            prevVoiced = voiced;
        }
        if (frames == 0) return null;
        double meanEnergy = energySum / frames;
        if (meanEnergy < SILENCE_RMS || pitchCount == 0) {
            log.trace("Voice window silent or unvoiced: meanEnergy={}, voicedFrames={}", meanEnergy, pitchCount);
            return null;
        }
        double meanPitch = pitchSum / pitchCount;
        double seconds = (double) audio.length / sampleRate;
        return new Features(
                meanPitch,
                Math.sqrt(Math.max(0, pitchSq / pitchCount - meanPitch * meanPitch)),
                meanEnergy,
                Math.sqrt(Math.max(0, energySq / frames - meanEnergy * meanEnergy)),
                zcrSum / frames,
                onsets / seconds);
    }

    EmotionDetection classify(Features f) {
        double pitchNorm = (f.meanPitch - 150.0) / 100.0;
        double pitchVarNorm = f.pitchStd / 30.0;
        double energyNorm = f.meanEnergy / 0.05;
        double rateNorm = (f.onsetRate - 4.0) / 2.0; // 发声起始次数/秒，约 4 次为常速

        double arousal = clamp(0.4 * pitchNorm + 0.3 * energyNorm + 0.3 * rateNorm, -1, 1);
        double steadiness = 1.0 - Math.min(pitchVarNorm, 1.0);
        double valence = clamp(0.5 * steadiness + 0.3 * Math.min(energyNorm, 1.0) - 0.2 * Math.abs(pitchNorm), -1, 1);
        double confidence = clamp(0.5 * Math.min(energyNorm, 1.0) + 0.3 * steadiness
                + 0.2 * (1.0 - Math.min(1.0, Math.abs(rateNorm))), 0, 1);

        String label;
        if (arousal > 0.3 && valence > 0.2) {
            label = "confident";
        } else if (arousal > 0.5 && valence < 0) {
            label = "nervous";
        } else if (arousal > 0.5) {
            label = "excited";
        } else if (arousal < -0.3) {
            label = valence > 0 ? "calm" : "tired";
        } else {
            label = "neutral";
        }
        Map<String, Double> scores = new LinkedHashMap<>();
        scores.put("arousal", arousal);
        scores.put("valence", valence);
        scores.put("pitch_hz", f.meanPitch);
        scores.put("energy", f.meanEnergy);
        scores.put("zcr", f.meanZcr);
        return new EmotionDetection(label, confidence, scores);
    }

    private static double[] toFloat(byte[] pcm) {
        int n = pcm.length / 2;
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            int lo = pcm[2 * i] & 0xff;
            int hi = pcm[2 * i + 1];
            out[i] = ((hi << 8) | lo) / 32768.0;
        }
        return out;
    }

    private static double rms(double[] a, int start, int len) {
        double sum = 0;
        for (int i = start; i < start + len; i++) sum += a[i] * a[i];
        return Math.sqrt(sum / len);
    }

    private static double zeroCrossingRate(double[] a, int start, int len) {
        int crossings = 0;
        for (int i = start + 1; i < start + len; i++) {
            if ((a[i - 1] >= 0) != (a[i] >= 0)) crossings++;
        }
        return (double) crossings / (len - 1);
    }

    /**
     * 归一化自相关取峰值滞后；相关性不足时视为清音，返回 0。
     */
    private static double pitch(double[] a, int start, int len, int sampleRate) {
        int minLag = (int) (sampleRate / MAX_PITCH_HZ);
        int maxLag = Math.min(len - 1, (int) (sampleRate / MIN_PITCH_HZ));
        double energy = 0;
        for (int i = start; i < start + len; i++) energy += a[i] * a[i];
        if (energy <= 0) return 0;
        double best = 0;
        int bestLag = -1;
        for (int lag = minLag; lag <= maxLag; lag++) {
            double sum = 0;
            for (int i = start; i + lag < start + len; i++) sum += a[i] * a[i + lag];
            double r = sum / energy;
            if (r > best) {
                best = r;
                bestLag = lag;
            }
        }
        if (bestLag <= 0 || best < VOICING_CORRELATION) return 0;
        return (double) sampleRate / bestLag;
    }

    private static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }

    static final class Features {
        final double meanPitch;
        final double pitchStd;
        final double meanEnergy;
        final double energyStd;
        final double meanZcr;
        final double onsetRate;

        Features(double meanPitch, double pitchStd, double meanEnergy, double energyStd, double meanZcr, double onsetRate) {
            this.meanPitch = meanPitch;
            this.pitchStd = pitchStd;
            this.meanEnergy = meanEnergy;
            this.energyStd = energyStd;
            this.meanZcr = meanZcr;
            this.onsetRate = onsetRate;
        }
    }
}
