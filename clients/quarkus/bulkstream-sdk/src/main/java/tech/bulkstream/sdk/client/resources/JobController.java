package tech.bulkstream.sdk.client.resources;

import org.jboss.logging.Logger;
import tech.bulkstream.sdk.client.BulkApiClient;
import tech.bulkstream.sdk.dto.JobInfo;
import tech.bulkstream.sdk.dto.JobSpec;
import tech.bulkstream.sdk.enums.JobState;
import tech.bulkstream.sdk.enums.Operation;
import tech.bulkstream.sdk.exception.ConfigurationException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Owns the lifecycle of a single job: create, read status, close, abort.
 *
 * <p>A controller never switches jobs. Once a job id is known, every status snapshot
 * must belong to it. Not safe for concurrent use.
 */
public class JobController {

    private static final Logger LOG = Logger.getLogger(JobController.class);

    static final String DISABLE_BATCH_RETRY_HEADER = "Sforce-Disable-Batch-Retry";
    static final String ENABLE_PK_CHUNKING_HEADER = "Sforce-Enable-PKChunking";

    private final BulkApiClient client;
    private final JobSpec spec;

    private String jobId;
    private JobInfo jobInfo;

    private BatchSubmitter batchSubmitter;
    private BatchEnumerator batchEnumerator;
    private ResultLocator resultLocator;
    private ResultStreamAssembler resultAssembler;

    public JobController(BulkApiClient client, JobSpec spec) {
        this.client = client;
        this.spec = validate(spec);
    }

    private JobController(BulkApiClient client, String jobId) {
        if (jobId == null || jobId.isBlank()) {
            throw new IllegalArgumentException("jobId is required");
        }
        this.client = client;
        this.spec = null;
        this.jobId = jobId;
    }

    /**
     * Controller bound to an existing job. It never creates a job.
     */
    public static JobController attached(BulkApiClient client, String jobId) {
        return new JobController(client, jobId);
    }

    /**
     * Get the batch submission resource.
     */
    public BatchSubmitter batchSubmitter() {
        if (batchSubmitter == null) {
            batchSubmitter = new BatchSubmitter(this);
        }
        return batchSubmitter;
    }

    /**
     * Get the batch enumeration resource.
     */
    public BatchEnumerator batchEnumerator() {
        if (batchEnumerator == null) {
            batchEnumerator = new BatchEnumerator(this);
        }
        return batchEnumerator;
    }

    /**
     * Get the result segment resource.
     */
    public ResultLocator resultLocator() {
        if (resultLocator == null) {
            resultLocator = new ResultLocator(this);
        }
        return resultLocator;
    }

    /**
     * Get the merged query result resource.
     */
    public ResultStreamAssembler resultAssembler() {
        if (resultAssembler == null) {
            resultAssembler = new ResultStreamAssembler(batchEnumerator(), resultLocator());
        }
        return resultAssembler;
    }

    /**
     * Create the job. Only the first call reaches the service; later calls return the
     * job already known to this controller.
     *
     * <p>Batch retry is always disabled on the remote side: retried batches leave
     * reordered and duplicated content in the result segments.
     */
    public JobInfo createJob() {
        if (jobInfo != null) {
            return jobInfo;
        }
        if (jobId != null) {
            return getJobInfo();
        }

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(DISABLE_BATCH_RETRY_HEADER, "true");
        if (spec.pkChunking()) {
            headers.put(ENABLE_PK_CHUNKING_HEADER, "true");
        }

        String response = client.postXml(client.session().jobUrl(), client.xml().jobCreate(spec), headers);
        JobInfo created = transition(client.xml().parseJobInfo(response));
        LOG.infof("Created %s job %s on %s (pkChunking=%s)",
            spec.operation().wireValue(), created.id(), spec.object(), spec.pkChunking());
        return created;
    }

    /**
     * Read the current job status and counters. Always goes to the service.
     */
    public JobInfo getJobInfo() {
        String response = client.get(jobUrl());
        JobInfo info = transition(client.xml().parseJobInfo(response));
        LOG.debugf("Job %s: state=%s, batches %d/%d completed, %d failed, records %d processed, %d failed",
            info.id(), info.state(), info.numberBatchesCompleted(), info.numberBatchesTotal(),
            info.numberBatchesFailed(), info.numberRecordsProcessed(), info.numberRecordsFailed());
        return info;
    }

    /**
     * Tell the service no more batches are coming.
     */
    public JobInfo closeJob() {
        return changeState(JobState.CLOSED);
    }

    /**
     * Abort the job. Unprocessed batches are not processed.
     */
    public JobInfo abortJob() {
        return changeState(JobState.ABORTED);
    }

    public Optional<String> jobId() {
        return Optional.ofNullable(jobId);
    }

    /**
     * The last status snapshot seen by this controller.
     */
    public Optional<JobInfo> currentJobInfo() {
        return Optional.ofNullable(jobInfo);
    }

    /**
     * The spec this controller creates its job from; empty for an attached controller.
     */
    public Optional<JobSpec> spec() {
        return Optional.ofNullable(spec);
    }

    public String requireJobId() {
        if (jobId == null) {
            throw new IllegalStateException("No job has been created yet");
        }
        return jobId;
    }

    BulkApiClient client() {
        return client;
    }

    /**
     * Job id, creating the job first when none exists.
     */
    String ensureJob() {
        if (jobId == null) {
            createJob();
        }
        return jobId;
    }

    /**
     * Bind this controller to a job created elsewhere. Rebinding to another job is refused.
     */
    void adopt(String otherJobId) {
        if (jobId == null) {
            jobId = otherJobId;
        } else if (!jobId.equals(otherJobId)) {
            throw new IllegalStateException(
                "Controller for job " + jobId + " cannot switch to job " + otherJobId);
        }
    }

    String jobUrl() {
        return client.session().jobUrl(requireJobId());
    }

    private JobInfo changeState(JobState state) {
        String response = client.postXml(jobUrl(), client.xml().jobStateChange(state), Map.of());
        JobInfo info = transition(client.xml().parseJobInfo(response));
        LOG.infof("Job %s is now %s", info.id(), info.state());
        return info;
    }

    private JobInfo transition(JobInfo next) {
        if (next.id() != null) {
            adopt(next.id());
        }
        jobInfo = next;
        return next;
    }

    private static JobSpec validate(JobSpec spec) {
        if (spec == null) {
            throw new ConfigurationException("job spec is required");
        }
        if (spec.operation() == null) {
            throw ConfigurationException.missing("operation");
        }
        if (spec.object() == null || spec.object().isBlank()) {
            throw ConfigurationException.missing("object");
        }
        if (spec.operation() == Operation.UPSERT
            && (spec.externalIdFieldName() == null || spec.externalIdFieldName().isBlank())) {
            throw ConfigurationException.missing("externalIdFieldName");
        }
        return spec;
    }
}
