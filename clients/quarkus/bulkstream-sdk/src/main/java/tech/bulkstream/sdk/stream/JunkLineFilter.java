package tech.bulkstream.sdk.stream;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Drops lines that are not result content.
 *
 * <p>A line is junk when any pattern is found anywhere in it. The defaults cover the
 * "no records" message the service writes into empty results and comment lines
 * starting with {@code #}.
 */
public final class JunkLineFilter implements LineStage {

    public static final Pattern NO_RECORDS = Pattern.compile("Records not found for this query");
    public static final Pattern COMMENT = Pattern.compile("^#.*");

    private final List<Pattern> patterns;

    public JunkLineFilter(List<Pattern> patterns) {
        this.patterns = List.copyOf(patterns);
    }

    public static JunkLineFilter defaults() {
        return new JunkLineFilter(List.of(NO_RECORDS, COMMENT));
    }

    /**
     * A filter with {@code pattern} added to this filter's patterns.
     */
    public JunkLineFilter withPattern(Pattern pattern) {
        List<Pattern> extended = new ArrayList<>(patterns);
        extended.add(pattern);
        return new JunkLineFilter(extended);
    }

    public List<Pattern> getPatterns() {
        return patterns;
    }

    @Override
    public LineDecision apply(String line) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(line).find()) {
                return LineDecision.DROP;
            }
        }
        return LineDecision.EMIT;
    }
}
