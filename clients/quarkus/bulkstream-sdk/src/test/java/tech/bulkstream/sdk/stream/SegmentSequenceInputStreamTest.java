package tech.bulkstream.sdk.stream;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for SegmentSequenceInputStream.
 */
class SegmentSequenceInputStreamTest {

    private final List<String> events = new ArrayList<>();

    @Test
    void emptySequence_isEmpty() throws IOException {
        try (InputStream in = new SegmentSequenceInputStream(List.of())) {
            assertThat(in.read()).isEqualTo(-1);
        }
    }

    @Test
    void segments_areJoinedWithNewlineAfterEach() throws IOException {
        var in = new SegmentSequenceInputStream(List.of(source("a", "Id\n1"), source("b", "Id\n2\n")));

        assertThat(readAll(in)).isEqualTo("Id\n1\nId\n2\n\n");
    }

    @Test
    void segments_areOpenedLazilyAndClosedBeforeTheNextOpens() throws IOException {
        var in = new SegmentSequenceInputStream(List.of(source("a", "x"), source("b", "y")));
        assertThat(events).isEmpty();

        assertThat(in.read()).isEqualTo('x');
        assertThat(events).containsExactly("open a");

        readAll(in);
        assertThat(events).containsExactly("open a", "close a", "open b", "close b");
        assertThat(in.getOpenedCount()).isEqualTo(2);
    }

    @Test
    void close_releasesCurrentSegment_andNeverOpensTheRest() throws IOException {
        var in = new SegmentSequenceInputStream(List.of(source("a", "xyz"), source("b", "y")));
        in.read();

        in.close();

        assertThat(events).containsExactly("open a", "close a");
        assertThatThrownBy(in::read).isInstanceOf(IOException.class);
    }

    @Test
    void openFailure_surfacesAsIOException() {
        SegmentSource failing = () -> {
            throw new IOException("segment gone");
        };
        var in = new SegmentSequenceInputStream(List.of(source("a", "x"), failing));

        assertThatThrownBy(() -> readAll(in))
            .isInstanceOf(IOException.class)
            .hasMessage("segment gone");
    }

    @Test
    void failure_endsTheSequence() throws IOException {
        IOException gone = new IOException("segment gone");
        SegmentSource failing = () -> {
            throw gone;
        };
        var in = new SegmentSequenceInputStream(List.of(source("a", "x"), failing, source("c", "y")));
        assertThat(in.read()).isEqualTo('x');
        assertThat(in.read()).isEqualTo('\n');

        assertThatThrownBy(in::read).isSameAs(gone);
        assertThatThrownBy(in::read).isSameAs(gone);
        assertThatThrownBy(() -> in.read(new byte[8], 0, 8)).isSameAs(gone);

        assertThat(events).containsExactly("open a", "close a");
        assertThat(in.getOpenedCount()).isEqualTo(1);
    }

    private SegmentSource source(String name, String content) {
        return () -> {
            events.add("open " + name);
            return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8)) {
                @Override
                public void close() throws IOException {
                    events.add("close " + name);
                    super.close();
                }
            };
        };
    }

    private static String readAll(InputStream in) throws IOException {
        return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
}
