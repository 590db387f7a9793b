package tech.bulkstream.sdk.client.resources;

import org.jboss.logging.Logger;
import tech.bulkstream.sdk.client.BulkApiClient;
import tech.bulkstream.sdk.dto.BatchInfo;

import java.util.List;

/**
 * Resource for reading the batches of a job.
 */
public class BatchEnumerator {

    private static final Logger LOG = Logger.getLogger(BatchEnumerator.class);

    private final JobController job;

    public BatchEnumerator(JobController job) {
        this.job = job;
    }

    /**
     * Batches that can carry results, in the order the service lists them.
     *
     * <p>{@code NotProcessed} batches are always left out. With PK chunking the
     * original batch stays {@code NotProcessed} even when the job succeeds, so it
     * never shows up here. An empty list is a valid answer.
     */
    public List<BatchInfo> listBatches() {
        List<BatchInfo> all = listAllBatches();
        List<BatchInfo> eligible = eligible(all);
        if (eligible.size() != all.size()) {
            LOG.debugf("Job %s: skipping %d NotProcessed batch(es)", job.requireJobId(), all.size() - eligible.size());
        }
        return eligible;
    }

    /**
     * Every batch of the job, including {@code NotProcessed} ones.
     */
    public List<BatchInfo> listAllBatches() {
        BulkApiClient client = job.client();
        String response = client.get(job.jobUrl() + "/batch");
        return client.xml().parseBatchInfoList(response);
    }

    /**
     * Read a single batch.
     */
    public BatchInfo getBatchInfo(String batchId) {
        BulkApiClient client = job.client();
        return client.xml().parseBatchInfo(client.get(job.jobUrl() + "/batch/" + batchId));
    }

    static List<BatchInfo> eligible(List<BatchInfo> batches) {
        return batches.stream()
            .filter(BatchInfo::isEligibleForResults)
            .toList();
    }
}
