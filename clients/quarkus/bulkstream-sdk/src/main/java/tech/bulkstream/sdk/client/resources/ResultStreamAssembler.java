package tech.bulkstream.sdk.client.resources;

import org.jboss.logging.Logger;
import tech.bulkstream.sdk.dto.BatchInfo;
import tech.bulkstream.sdk.dto.ResultSegment;
import tech.bulkstream.sdk.exception.BulkApiException;
import tech.bulkstream.sdk.stream.JunkLineFilter;
import tech.bulkstream.sdk.stream.LinePipeline;
import tech.bulkstream.sdk.stream.MergedResultStream;
import tech.bulkstream.sdk.stream.SegmentSequenceInputStream;
import tech.bulkstream.sdk.stream.SegmentSource;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Merges the results of every eligible batch of a query job into one CSV stream.
 *
 * <p>The merged stream has a single header line (the first non-blank, non-junk line
 * of the first segment that has one), then every data line of every segment in batch
 * enumeration order and, within a batch, segment order. Each line ends with exactly
 * one {@code \n}.
 *
 * <p>Call this only once the job has completed successfully. Segment ids are resolved
 * up front; segment content is requested lazily, one segment at a time, as the
 * returned stream is read. A failure while reading a segment surfaces as an
 * {@link IOException} from the stream and ends the merge.
 */
public class ResultStreamAssembler {

    private static final Logger LOG = Logger.getLogger(ResultStreamAssembler.class);

    private final BatchEnumerator batchEnumerator;
    private final ResultLocator resultLocator;
    private final JunkLineFilter junkFilter;

    public ResultStreamAssembler(BatchEnumerator batchEnumerator, ResultLocator resultLocator) {
        this(batchEnumerator, resultLocator, JunkLineFilter.defaults());
    }

    public ResultStreamAssembler(BatchEnumerator batchEnumerator, ResultLocator resultLocator,
                                 JunkLineFilter junkFilter) {
        this.batchEnumerator = batchEnumerator;
        this.resultLocator = resultLocator;
        this.junkFilter = junkFilter;
    }

    /**
     * An assembler that additionally drops lines matching {@code pattern}.
     */
    public ResultStreamAssembler withJunkPattern(Pattern pattern) {
        return new ResultStreamAssembler(batchEnumerator, resultLocator, junkFilter.withPattern(pattern));
    }

    /**
     * The merged query results. The caller must close the stream, which releases the
     * segment being read.
     */
    public InputStream getQueryResults() {
        List<ResultSegment> segments = resolveAllSegments();
        List<SegmentSource> sources = segments.stream()
            .map(this::sourceFor)
            .toList();
        return new MergedResultStream(
            new SegmentSequenceInputStream(sources),
            LinePipeline.forMergedResults(junkFilter)
        );
    }

    /**
     * Segments of every eligible batch, in merge order.
     */
    public List<ResultSegment> resolveAllSegments() {
        List<BatchInfo> batches = batchEnumerator.listBatches();
        List<ResultSegment> segments = new ArrayList<>();
        for (BatchInfo batch : batches) {
            segments.addAll(resultLocator.resolveSegments(batch.id()));
        }
        LOG.infof("Merging %d result segment(s) from %d batch(es)", segments.size(), batches.size());
        return segments;
    }

    private SegmentSource sourceFor(ResultSegment segment) {
        return () -> {
            LOG.debugf("Opening result segment %s of batch %s", segment.id(), segment.batchId());
            try {
                return resultLocator.fetchSegment(segment);
            } catch (BulkApiException e) {
                throw new IOException("Failed to open result segment " + segment.id(), e);
            }
        };
    }
}
