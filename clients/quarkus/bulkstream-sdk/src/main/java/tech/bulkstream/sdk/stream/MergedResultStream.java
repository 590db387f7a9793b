package tech.bulkstream.sdk.stream;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Line-oriented view over concatenated segment bytes.
 *
 * <p>Splits the source into lines, drops blank ones, runs the rest through a
 * {@link LinePipeline} and re-emits each surviving line with exactly one {@code \n}.
 * Only the current line is held in memory. Once reading the source fails, the
 * stream stays failed and every later read rethrows the same exception.
 */
public class MergedResultStream extends InputStream {

    private static final byte[] EMPTY = new byte[0];

    private final BufferedReader reader;
    private final LinePipeline pipeline;

    private byte[] buffer = EMPTY;
    private int position;
    private boolean exhausted;
    private long linesEmitted;
    private IOException failure;

    public MergedResultStream(InputStream source, LinePipeline pipeline) {
        this.reader = new BufferedReader(new InputStreamReader(source, StandardCharsets.UTF_8));
        this.pipeline = pipeline;
    }

    @Override
    public int read() throws IOException {
        if (!fill()) {
            return -1;
        }
        return buffer[position++] & 0xff;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        Objects.checkFromIndexSize(off, len, b.length);
        if (len == 0) {
            return 0;
        }
        if (!fill()) {
            return -1;
        }
        int n = Math.min(len, buffer.length - position);
        System.arraycopy(buffer, position, b, off, n);
        position += n;
        return n;
    }

    /**
     * Lines written to the output so far, header included.
     */
    public long getLinesEmitted() {
        return linesEmitted;
    }

    @Override
    public void close() throws IOException {
        exhausted = true;
        buffer = EMPTY;
        position = 0;
        reader.close();
    }

    private boolean fill() throws IOException {
        while (position >= buffer.length) {
            if (exhausted) {
                return false;
            }
            String line = nextLine();
            if (line == null) {
                exhausted = true;
                return false;
            }
            if (!line.isBlank() && pipeline.accept(line)) {
                buffer = (line + "\n").getBytes(StandardCharsets.UTF_8);
                position = 0;
                linesEmitted++;
            }
        }
        return true;
    }

    private String nextLine() throws IOException {
        if (failure != null) {
            throw failure;
        }
        try {
            return reader.readLine();
        } catch (IOException e) {
            failure = e;
            throw e;
        }
    }
}
