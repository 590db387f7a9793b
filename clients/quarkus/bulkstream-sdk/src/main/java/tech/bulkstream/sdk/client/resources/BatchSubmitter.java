package tech.bulkstream.sdk.client.resources;

import org.jboss.logging.Logger;
import tech.bulkstream.sdk.client.BulkApiClient;
import tech.bulkstream.sdk.dto.BatchInfo;
import tech.bulkstream.sdk.dto.JobSpec;

import java.io.InputStream;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;

/**
 * Resource for adding batches to a job.
 *
 * <p>For query jobs the payload is the SOQL text and a single batch is all that is
 * meaningful. For insert, update, upsert and delete jobs the payload is CSV and this
 * may be called many times; close the job once all data is uploaded.
 */
public class BatchSubmitter {

    private static final Logger LOG = Logger.getLogger(BatchSubmitter.class);

    private final JobController job;
    private int submitted;

    public BatchSubmitter(JobController job) {
        this.job = job;
    }

    /**
     * Add a batch, creating the job first if it does not exist yet.
     *
     * @param payload SOQL query text or CSV content
     */
    public BatchInfo addBatch(String payload) {
        return submit(job.ensureJob(), HttpRequest.BodyPublishers.ofString(payload, StandardCharsets.UTF_8));
    }

    /**
     * Add a CSV batch read from a stream, creating the job first if it does not exist yet.
     * The stream is consumed once and closed by the HTTP client.
     */
    public BatchInfo addBatch(InputStream csv) {
        return submit(job.ensureJob(), HttpRequest.BodyPublishers.ofInputStream(() -> csv));
    }

    /**
     * Add a batch to an existing job without creating one.
     */
    public BatchInfo addBatch(String payload, String jobId) {
        if (jobId == null) {
            return addBatch(payload);
        }
        job.adopt(jobId);
        return submit(jobId, HttpRequest.BodyPublishers.ofString(payload, StandardCharsets.UTF_8));
    }

    /**
     * Number of batches added through this resource.
     */
    public int getSubmittedCount() {
        return submitted;
    }

    private BatchInfo submit(String jobId, HttpRequest.BodyPublisher body) {
        BulkApiClient client = job.client();
        boolean queryJob = job.spec().map(JobSpec::operation).map(op -> op.isQuery()).orElse(false);
        if (queryJob && submitted > 0) {
            LOG.warnf("Job %s is a query job; only its first batch is meaningful", jobId);
        }

        String response = client.postCsv(client.session().jobUrl(jobId) + "/batch", body);
        BatchInfo batch = client.xml().parseBatchInfo(response);
        submitted++;
        LOG.infof("Added batch %s to job %s (%s)", batch.id(), jobId, batch.state());
        return batch;
    }
}
