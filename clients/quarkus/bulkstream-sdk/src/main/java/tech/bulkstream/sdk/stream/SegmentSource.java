package tech.bulkstream.sdk.stream;

import java.io.IOException;
import java.io.InputStream;

/**
 * Lazily opens one result segment. Nothing is requested until {@link #open()} is called.
 */
@FunctionalInterface
public interface SegmentSource {

    InputStream open() throws IOException;
}
