package io.convotest.core.runner;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class NextChildDetectorTest {

    @Test
    void shouldAdvanceWhenAgentMovesToNextChild() {
        assertThat(NextChildDetector.advance("Great. Now for your next child, what is their name?", 0, 2)).isEqualTo(1);
        assertThat(NextChildDetector.advance("And the second kid's date of birth?", 0, 3)).isEqualTo(1);
    }

    @Test
    void shouldNeverMovePastLastChild() {
        assertThat(NextChildDetector.advance("What about the other child?", 1, 2)).isEqualTo(1);
        assertThat(NextChildDetector.advance("What about the other child?", 0, 0)).isZero();
    }

    @Test
    void shouldIgnoreUnrelatedUtterances() {
        assertThat(NextChildDetector.mentionsNextChild("What is your child's date of birth?")).isFalse();
        assertThat(NextChildDetector.mentionsNextChild(null)).isFalse();
        assertThat(NextChildDetector.advance("Next, your phone number please.", 0, 2)).isZero();
    }
}
