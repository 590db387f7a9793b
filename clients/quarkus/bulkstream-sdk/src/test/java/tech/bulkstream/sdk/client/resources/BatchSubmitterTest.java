package tech.bulkstream.sdk.client.resources;

import org.junit.jupiter.api.Test;
import tech.bulkstream.sdk.dto.BatchInfo;
import tech.bulkstream.sdk.dto.JobSpec;
import tech.bulkstream.sdk.enums.BatchState;
import tech.bulkstream.sdk.enums.Operation;
import tech.bulkstream.sdk.test.BulkApiXml;
import tech.bulkstream.sdk.test.WireMockBulkApiSupport;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BatchSubmitterTest extends WireMockBulkApiSupport {

    private static final String JOB_ID = "750A";
    private static final String BATCH_PATH = JOB_PATH + "/" + JOB_ID + "/batch";

    @Test
    void firstBatch_createsTheJob() {
        stubXml(post(urlEqualTo(JOB_PATH)), BulkApiXml.openJob(JOB_ID, "query"));
        stubXml(post(urlEqualTo(BATCH_PATH)), BulkApiXml.batchInfo("751A", JOB_ID, "Queued"));
        JobController job = client.newJob(JobSpec.query("Contact"));

        BatchInfo batch = job.batchSubmitter().addBatch("select Id, Name from Contact");

        assertThat(batch.id()).isEqualTo("751A");
        assertThat(batch.jobId()).isEqualTo(JOB_ID);
        assertThat(batch.state()).isEqualTo(BatchState.QUEUED);
        assertThat(job.jobId()).contains(JOB_ID);
        server.verify(1, postRequestedFor(urlEqualTo(JOB_PATH)));
        server.verify(postRequestedFor(urlEqualTo(BATCH_PATH))
            .withHeader("Content-Type", equalTo("text/csv; charset=UTF-8"))
            .withHeader("X-SFDC-Session", equalTo(SESSION_ID))
            .withRequestBody(equalTo("select Id, Name from Contact")));
    }

    @Test
    void repeatedBatches_reuseTheSameJob() {
        stubXml(post(urlEqualTo(JOB_PATH)), BulkApiXml.openJob(JOB_ID, "insert"));
        stubXml(post(urlEqualTo(BATCH_PATH)), BulkApiXml.batchInfo("751A", JOB_ID, "Queued"));
        JobController job = client.newJob(JobSpec.builder().operation(Operation.INSERT).object("Contact").build());
        BatchSubmitter submitter = job.batchSubmitter();

        submitter.addBatch("LastName\nOne\n");
        submitter.addBatch("LastName\nTwo\n");
        submitter.addBatch("LastName\nThree\n");

        assertThat(submitter.getSubmittedCount()).isEqualTo(3);
        server.verify(1, postRequestedFor(urlEqualTo(JOB_PATH)));
        server.verify(3, postRequestedFor(urlEqualTo(BATCH_PATH)));
    }

    @Test
    void explicitJobId_skipsCreation() {
        stubXml(post(urlEqualTo(BATCH_PATH)), BulkApiXml.batchInfo("751A", JOB_ID, "Queued"));
        JobController job = client.newJob(JobSpec.builder().operation(Operation.INSERT).object("Contact").build());

        job.batchSubmitter().addBatch("LastName\nOne\n", JOB_ID);

        assertThat(job.jobId()).contains(JOB_ID);
        server.verify(0, postRequestedFor(urlEqualTo(JOB_PATH)));
        server.verify(1, postRequestedFor(urlEqualTo(BATCH_PATH)));
    }

    @Test
    void explicitJobId_mustMatchTheControllersJob() {
        JobController job = client.attachJob(JOB_ID);

        assertThatThrownBy(() -> job.batchSubmitter().addBatch("x", "750OTHER"))
            .isInstanceOf(IllegalStateException.class);
        server.verify(0, postRequestedFor(urlMatching(".*/batch")));
    }

    @Test
    void streamPayload_isUploadedAsCsv() {
        stubXml(post(urlEqualTo(BATCH_PATH)), BulkApiXml.batchInfo("751A", JOB_ID, "Queued"));
        JobController job = client.attachJob(JOB_ID);
        String csv = "LastName,Email\nÅström,a@example.com\n";

        job.batchSubmitter().addBatch(new ByteArrayInputStream(csv.getBytes(StandardCharsets.UTF_8)));

        server.verify(postRequestedFor(urlEqualTo(BATCH_PATH))
            .withHeader("Content-Type", equalTo("text/csv; charset=UTF-8"))
            .withRequestBody(equalTo(csv)));
    }

    @Test
    void rejectedBatch_surfacesRemoteError() {
        server.stubFor(post(urlEqualTo(BATCH_PATH)).willReturn(aResponse()
            .withStatus(400)
            .withBody(BulkApiXml.error("InvalidBatch", "Failed to parse query"))));
        JobController job = client.attachJob(JOB_ID);

        assertThatThrownBy(() -> job.batchSubmitter().addBatch("select nonsense"))
            .hasMessage("Failed to parse query");
        assertThat(job.batchSubmitter().getSubmittedCount()).isZero();
    }
}
