package tech.bulkstream.sdk.client.resources;

import tech.bulkstream.sdk.client.BulkApiClient;
import tech.bulkstream.sdk.dto.ResultSegment;

import java.io.InputStream;
import java.util.List;

/**
 * Resource for the result segments of a batch.
 *
 * <p>The service caps each segment (around 1 GB) and splits larger results, so one
 * batch may have zero, one or many segments.
 */
public class ResultLocator {

    private final JobController job;

    public ResultLocator(JobController job) {
        this.job = job;
    }

    /**
     * Segments of a batch in the order the service lists them.
     */
    public List<ResultSegment> resolveSegments(String batchId) {
        BulkApiClient client = job.client();
        String jobId = job.requireJobId();
        String response = client.get(job.jobUrl() + "/batch/" + batchId + "/result");
        return client.xml().parseResultList(response).stream()
            .map(id -> new ResultSegment(id, batchId, jobId))
            .toList();
    }

    /**
     * Raw CSV content of one segment. The caller must close the stream.
     */
    public InputStream fetchSegment(ResultSegment segment) {
        return fetchSegment(segment.id(), segment.batchId());
    }

    /**
     * Raw CSV content of one segment. The caller must close the stream.
     */
    public InputStream fetchSegment(String segmentId, String batchId) {
        return job.client().getStream(job.jobUrl() + "/batch/" + batchId + "/result/" + segmentId);
    }

    /**
     * The payload originally submitted for a batch of an insert, update, upsert or delete job.
     */
    public InputStream fetchBatchRequest(String batchId) {
        return job.client().getStream(job.jobUrl() + "/batch/" + batchId + "/request");
    }
}
