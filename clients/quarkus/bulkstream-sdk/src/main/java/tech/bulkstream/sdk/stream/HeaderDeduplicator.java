package tech.bulkstream.sdk.stream;

import java.util.Optional;

/**
 * Keeps only the first header line of a merged result.
 *
 * <p>The first non-blank line seen becomes the header and is emitted. Any later line
 * equal to it is dropped, whichever segment or batch it comes from. Blank lines are
 * dropped. Comparison is exact: no trimming, no case folding.
 *
 * <p>One instance holds the header for one merge and must not be reused across merges.
 */
public final class HeaderDeduplicator implements LineStage {

    private String header;
    private int duplicatesDropped;

    @Override
    public LineDecision apply(String line) {
        if (line.isBlank()) {
            return LineDecision.DROP;
        }
        if (header == null) {
            header = line;
            return LineDecision.EMIT;
        }
        if (header.equals(line)) {
            duplicatesDropped++;
            return LineDecision.DROP;
        }
        return LineDecision.EMIT;
    }

    /**
     * The recorded header, empty until the first non-blank line arrives.
     */
    public Optional<String> getHeader() {
        return Optional.ofNullable(header);
    }

    public int getDuplicatesDropped() {
        return duplicatesDropped;
    }
}
