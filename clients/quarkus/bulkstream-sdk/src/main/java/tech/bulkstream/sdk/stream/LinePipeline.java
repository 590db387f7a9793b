package tech.bulkstream.sdk.stream;

import java.util.List;

/**
 * Stages applied in order to each line; the first {@link LineDecision#DROP} wins.
 */
public final class LinePipeline {

    private final List<LineStage> stages;

    public LinePipeline(List<LineStage> stages) {
        this.stages = List.copyOf(stages);
    }

    /**
     * Junk filtering followed by header de-duplication, with a fresh header state.
     */
    public static LinePipeline forMergedResults(JunkLineFilter junkFilter) {
        return new LinePipeline(List.of(junkFilter, new HeaderDeduplicator()));
    }

    public boolean accept(String line) {
        for (LineStage stage : stages) {
            if (stage.apply(line) == LineDecision.DROP) {
                return false;
            }
        }
        return true;
    }
}
