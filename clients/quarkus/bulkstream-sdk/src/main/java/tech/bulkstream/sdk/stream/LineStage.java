package tech.bulkstream.sdk.stream;

/**
 * One step of the merged result line pipeline.
 *
 * <p>A stage sees lines in merge order and may keep state across them.
 */
@FunctionalInterface
public interface LineStage {

    /**
     * @param line a line without its terminator
     * @return whether the line continues down the pipeline
     */
    LineDecision apply(String line);
}
