package ai.acsl.injector.io;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.acsl.injector.inject.FragmentList;
import java.io.UncheckedIOException;
import java.net.URISyntaxException;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class FragmentFileReaderTest {

    private final FragmentFileReader reader = new FragmentFileReader();

    @Test
    void decodesFixtureIntoValidFragmentList() throws URISyntaxException {
        Path path = Path.of(FragmentFileReaderTest.class.getResource("/fixtures/sum_fragments.json").toURI());

        FragmentList fragments = FragmentList.from(reader.read(path));

        assertThat(fragments.size()).isEqualTo(4);
        assertThat(fragments.predicates()).hasSize(1);
        assertThat(fragments.fragment(1)).startsWith("/*@ requires \\valid_read(a + (0 .. n - 1));\n");
    }

    @Test
    void rejectsInvalidJson() {
        assertThatThrownBy(() -> reader.parse("[[], \"unterminated", "inline"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Fragment file is not valid JSON: inline");
    }

    @Test
    void reportsMissingFile() {
        assertThatThrownBy(() -> reader.read(Path.of("does-not-exist.json")))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("does-not-exist.json");
    }
}
