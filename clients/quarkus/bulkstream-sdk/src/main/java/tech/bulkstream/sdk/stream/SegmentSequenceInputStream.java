package tech.bulkstream.sdk.stream;

import java.io.IOException;
import java.io.InputStream;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Concatenates segment streams in order, with a newline after each segment so that
 * no line spans two segments.
 *
 * <p>Segments are opened one at a time: the next one is requested only after the
 * previous one is drained and closed. Closing this stream closes the open segment;
 * segments not reached yet are never opened.
 *
 * <p>The first failure to open or read a segment ends the sequence: every later read
 * rethrows it, and no further segment is opened.
 */
public class SegmentSequenceInputStream extends InputStream {

    private static final byte SEPARATOR = '\n';

    private final Iterator<SegmentSource> sources;

    private InputStream current;
    private boolean separatorPending;
    private boolean closed;
    private int openedCount;
    private IOException failure;

    public SegmentSequenceInputStream(List<SegmentSource> sources) {
        this.sources = List.copyOf(sources).iterator();
    }

    @Override
    public int read() throws IOException {
        byte[] single = new byte[1];
        int n = read(single, 0, 1);
        return n == -1 ? -1 : single[0] & 0xff;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        Objects.checkFromIndexSize(off, len, b.length);
        ensureOpen();
        if (failure != null) {
            throw failure;
        }
        if (len == 0) {
            return 0;
        }
        try {
            return readSegments(b, off, len);
        } catch (IOException e) {
            failure = e;
            throw e;
        }
    }

    private int readSegments(byte[] b, int off, int len) throws IOException {
        while (true) {
            if (separatorPending) {
                separatorPending = false;
                b[off] = SEPARATOR;
                return 1;
            }
            if (current == null) {
                if (!sources.hasNext()) {
                    return -1;
                }
                current = sources.next().open();
                openedCount++;
            }
            int n = current.read(b, off, len);
            if (n != -1) {
                return n;
            }
            closeCurrent();
            separatorPending = true;
        }
    }

    /**
     * Number of segments opened so far.
     */
    public int getOpenedCount() {
        return openedCount;
    }

    @Override
    public void close() throws IOException {
        if (!closed) {
            closed = true;
            closeCurrent();
        }
    }

    private void closeCurrent() throws IOException {
        if (current != null) {
            InputStream segment = current;
            current = null;
            segment.close();
        }
    }

    private void ensureOpen() throws IOException {
        if (closed) {
            throw new IOException("Stream closed");
        }
    }
}
