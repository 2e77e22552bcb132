package com.deepknow.abis.interview.domain.assessment.service;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SentenceSplitterTest {

    @Test
    void splitsOnSentencePunctuationAndDropsShortSpans() {
        SentenceSplitter splitter = new SentenceSplitter(15, 150);

        List<String> spans = splitter.split("I built the service.  Then I scaled it to millions! ok.");

        assertThat(spans).containsExactly("I built the service.", "Then I scaled it to millions!");
    }

    @Test
    void splitsChineseSentences() {
        SentenceSplitter splitter = new SentenceSplitter(5, 150);

        List<String> spans = splitter.split("我负责了整个项目的架构设计。团队一共有五个人。好。");

        assertThat(spans).containsExactly("我负责了整个项目的架构设计", "团队一共有五个人");
    }

    @Test
    void longSentenceIsChunkedAtWordBoundaries() {
        SentenceSplitter splitter = new SentenceSplitter(5, 30);
        String text = "alpha beta gamma delta epsilon zeta eta theta iota kappa lambda mu nu xi omicron";

        List<String> spans = splitter.split(text);

        assertThat(spans).hasSizeGreaterThan(1);
        assertThat(spans).allSatisfy(s -> assertThat(s.length()).isLessThanOrEqualTo(30));
        assertThat(String.join(" ", spans)).isEqualTo(text);
    }

    @Test
    void blankInputYieldsNothing() {
        assertThat(new SentenceSplitter(5, 30).split("   ")).isEmpty();
        assertThat(new SentenceSplitter(5, 30).split(null)).isEmpty();
    }
}
