package tech.bulkstream.sdk.stream;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for HeaderDeduplicator.
 */
class HeaderDeduplicatorTest {

    private final HeaderDeduplicator dedup = new HeaderDeduplicator();

    @Test
    @DisplayName("first non-blank line becomes the header and is emitted")
    void firstLine_isRecordedAsHeader() {
        assertThat(dedup.getHeader()).isEmpty();

        assertThat(dedup.apply("Id,Name")).isEqualTo(LineDecision.EMIT);

        assertThat(dedup.getHeader()).contains("Id,Name");
    }

    @Test
    @DisplayName("lines equal to the header are dropped every time they reappear")
    void repeatedHeader_isDropped() {
        dedup.apply("Id,Name");

        assertThat(dedup.apply("001,Foo")).isEqualTo(LineDecision.EMIT);
        assertThat(dedup.apply("Id,Name")).isEqualTo(LineDecision.DROP);
        assertThat(dedup.apply("002,Bar")).isEqualTo(LineDecision.EMIT);
        assertThat(dedup.apply("Id,Name")).isEqualTo(LineDecision.DROP);
        assertThat(dedup.getDuplicatesDropped()).isEqualTo(2);
    }

    @Test
    @DisplayName("blank lines are dropped and never become the header")
    void blankLines_areDropped() {
        assertThat(dedup.apply("")).isEqualTo(LineDecision.DROP);
        assertThat(dedup.apply("   \t")).isEqualTo(LineDecision.DROP);
        assertThat(dedup.getHeader()).isEmpty();

        dedup.apply("Id,Name");
        assertThat(dedup.getHeader()).contains("Id,Name");
    }

    @Test
    @DisplayName("comparison is exact: case and surrounding whitespace matter")
    void comparison_isExact() {
        dedup.apply("\"Id\",\"Name\"");

        assertThat(dedup.apply("\"id\",\"name\"")).isEqualTo(LineDecision.EMIT);
        assertThat(dedup.apply(" \"Id\",\"Name\"")).isEqualTo(LineDecision.EMIT);
        assertThat(dedup.apply("\"Id\",\"Name\" ")).isEqualTo(LineDecision.EMIT);
        assertThat(dedup.apply("\"Id\",\"Name\"")).isEqualTo(LineDecision.DROP);
    }
}
