package com.deepknow.abis.interview.domain.assessment.service;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 把转写片段切成句子级证据候选。
 * 按句末标点切分；超长且无标点的句子在词边界处截断；过短的句子丢弃。
 */
public class SentenceSplitter {
    private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?。！？])\\s+|[。！？]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final int minChars;
    private final int maxChars;

    public SentenceSplitter(int minChars, int maxChars) {
        this.minChars = minChars;
        this.maxChars = maxChars;
    }

    public List<String> split(String text) {
        List<String> out = new ArrayList<>();
        if (text == null || text.isBlank()) return out;
        for (String raw : SENTENCE_END.split(text.trim())) {
            String sentence = WHITESPACE.matcher(raw).replaceAll(" ").trim();
            if (sentence.isEmpty()) continue;
            if (sentence.length() <= maxChars) {
                addIfLongEnough(out, sentence);
            } else {
                chunk(sentence, out);
            }
        }
        return out;
    }

    private void chunk(String sentence, List<String> out) {
        StringBuilder current = new StringBuilder();
        for (String word : sentence.split(" ")) {
            if (current.length() > 0 && current.length() + 1 + word.length() > maxChars) {
                addIfLongEnough(out, current.toString());
                current.setLength(0);
            }
            if (word.length() > maxChars) {
                // 单词本身超长（如无空格的中文长句），按字符硬切
                for (int i = 0; i < word.length(); i += maxChars) {
                    addIfLongEnough(out, word.substring(i, Math.min(word.length(), i + maxChars)));
                }
                continue;
            }
            if (current.length() > 0) current.append(' ');
            current.append(word);
        }
        if (current.length() > 0) addIfLongEnough(out, current.toString());
    }

    private void addIfLongEnough(List<String> out, String span) {
        String s = span.trim();
        if (s.length() >= minChars) out.add(s);
    }
}
