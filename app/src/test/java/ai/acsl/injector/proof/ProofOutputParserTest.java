package ai.acsl.injector.proof;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class ProofOutputParserTest {

    private final ProofOutputParser parser = new ProofOutputParser();

    @Test
    void summarizesPartialProof() throws IOException {
        ProofSummary summary = parser.parse(fixture("wp_output.log"));

        assertThat(summary.provedGoals()).hasValue(11);
        assertThat(summary.totalGoals()).hasValue(12);
        assertThat(summary.ratio()).isCloseTo(11.0 / 12.0, within(1e-9));
        assertThat(summary.fullyProved()).isFalse();
        assertThat(summary.failedGoals()).containsExactly("[wp] [Alt-Ergo 2.5.2] Goal typed_clamp_ensures : not proved");
        assertThat(summary.warnings()).containsExactly("[wp] Warning: Missing RTE guards");
    }

    @Test
    void recognizesFullProof() {
        ProofSummary summary = parser.parse("[wp] Proved goals:    5 / 5\r\n");

        assertThat(summary.fullyProved()).isTrue();
        assertThat(summary.ratio()).isEqualTo(1.0);
        assertThat(summary.failedGoals()).isEmpty();
    }

    @Test
    void treatsZeroGoalsAsUnproved() {
        ProofSummary summary = parser.parse("[wp] Proved goals: 0 / 0");

        assertThat(summary.hasGoalCounts()).isTrue();
        assertThat(summary.ratio()).isZero();
        assertThat(summary.fullyProved()).isFalse();
    }

    @Test
    void reportsMissingSummary() {
        ProofSummary summary = parser.parse("[kernel] Parsing f.c\n[kernel] user error: cannot find entry point");

        assertThat(summary.hasGoalCounts()).isFalse();
        assertThat(summary.ratio()).isZero();
        assertThat(summary.fullyProved()).isFalse();
        assertThat(summary.warnings()).containsExactly("[kernel] user error: cannot find entry point");
    }

    @Test
    void handlesEmptyOutput() {
        assertThat(parser.parse("").hasGoalCounts()).isFalse();
        assertThat(parser.parse(null).failedGoals()).isEmpty();
    }

    private static String fixture(String name) throws IOException {
        try (InputStream stream = ProofOutputParserTest.class.getResourceAsStream("/fixtures/" + name)) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
