package tech.bulkstream.sdk.client;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.bulkstream.sdk.client.auth.SessionManager;
import tech.bulkstream.sdk.client.resources.JobController;
import tech.bulkstream.sdk.client.xml.XmlPayloads;
import tech.bulkstream.sdk.config.BulkApiConfig;
import tech.bulkstream.sdk.dto.JobSpec;
import tech.bulkstream.sdk.dto.SessionContext;
import tech.bulkstream.sdk.exception.AuthenticationException;
import tech.bulkstream.sdk.exception.BulkApiException;
import tech.bulkstream.sdk.exception.TransportException;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * Main client for the bulk API.
 *
 * <p>Each {@link JobController} handed out works with exactly one job. To work with
 * another job, ask for another controller.
 *
 * <p>Example usage:
 * <pre>{@code
 * @Inject
 * BulkApiClient client;
 *
 * JobController job = client.newJob(JobSpec.builder()
 *     .operation(Operation.QUERY)
 *     .object("Contact")
 *     .pkChunking(true)
 *     .build());
 * job.batchSubmitter().addBatch("select Id, Name from Contact");
 * poller.awaitCompletion(job);
 * try (InputStream csv = job.resultAssembler().getQueryResults()) {
 *     csv.transferTo(out);
 * }
 * }</pre>
 *
 * <p>No request is retried; every failure surfaces to the caller.
 */
@ApplicationScoped
public class BulkApiClient {

    private static final Logger LOG = Logger.getLogger(BulkApiClient.class);

    public static final String SESSION_HEADER = "X-SFDC-Session";
    public static final String XML_CONTENT_TYPE = "text/xml; charset=UTF-8";
    public static final String CSV_CONTENT_TYPE = "text/csv; charset=UTF-8";

    private static final String INVALID_SESSION = "InvalidSessionId";

    private final BulkApiConfig config;
    private final SessionManager sessionManager;
    private final HttpClient httpClient;
    private final XmlPayloads xml;

    @Inject
    public BulkApiClient(BulkApiConfig config, SessionManager sessionManager) {
        this(config, sessionManager, HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofSeconds(config.http().connectTimeout()))
            .build());
    }

    public BulkApiClient(BulkApiConfig config, SessionManager sessionManager, HttpClient httpClient) {
        this.config = config;
        this.sessionManager = sessionManager;
        this.httpClient = httpClient;
        this.xml = new XmlPayloads();
    }

    /**
     * Controller for a job that will be created from {@code spec} on first use.
     */
    public JobController newJob(JobSpec spec) {
        return new JobController(this, spec);
    }

    /**
     * Controller for a job that already exists on the remote service.
     */
    public JobController attachJob(String jobId) {
        return JobController.attached(this, jobId);
    }

    /**
     * Authenticated session, logging in if necessary.
     */
    public SessionContext session() {
        return sessionManager.login();
    }

    public XmlPayloads xml() {
        return xml;
    }

    /**
     * Authenticated GET returning the response body as text.
     */
    public String get(String url) {
        HttpRequest request = authenticated(url).GET().build();
        return send("GET", url, request);
    }

    /**
     * Authenticated POST of an XML document.
     */
    public String postXml(String url, String body, Map<String, String> headers) {
        HttpRequest.Builder builder = authenticated(url)
            .header("Content-Type", XML_CONTENT_TYPE)
            .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
        headers.forEach(builder::header);
        return send("POST", url, builder.build());
    }

    /**
     * Authenticated POST of a CSV payload or query text.
     */
    public String postCsv(String url, HttpRequest.BodyPublisher body) {
        HttpRequest request = authenticated(url)
            .header("Content-Type", CSV_CONTENT_TYPE)
            .POST(body)
            .build();
        return send("POST", url, request);
    }

    /**
     * Authenticated GET returning the raw response body as a stream. The caller owns the stream.
     */
    public InputStream getStream(String url) {
        HttpRequest request = authenticated(url).GET().build();
        HttpResponse<InputStream> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
        } catch (IOException e) {
            throw TransportException.requestFailed("GET", url, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw TransportException.interrupted("GET", url, e);
        }

        int status = response.statusCode();
        LOG.debugf("GET %s returned %d (stream)", url, status);
        if (status >= 200 && status < 300) {
            return response.body();
        }

        String body;
        try (InputStream in = response.body()) {
            body = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw TransportException.requestFailed("GET", url, e);
        }
        throw errorFor(status, body);
    }

    private HttpRequest.Builder authenticated(String url) {
        SessionContext session = sessionManager.login();
        return HttpRequest.newBuilder()
            .uri(URI.create(url))
            .header(SESSION_HEADER, session.sessionId())
            .timeout(Duration.ofSeconds(config.http().timeout()));
    }

    private String send(String method, String url, HttpRequest request) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw TransportException.requestFailed(method, url, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw TransportException.interrupted(method, url, e);
        }

        int status = response.statusCode();
        LOG.debugf("%s %s returned %d", method, url, status);
        if (status >= 200 && status < 300) {
            return response.body();
        }
        throw errorFor(status, response.body());
    }

    private BulkApiException errorFor(int status, String body) {
        XmlPayloads.RemoteError error;
        try {
            error = xml.parseError(body);
        } catch (BulkApiException e) {
            return new BulkApiException("Unexpected response: " + status, status, e, Map.of());
        }

        if (status == 401 || INVALID_SESSION.equals(error.exceptionCode())) {
            return AuthenticationException.sessionInvalid();
        }

        LOG.errorf("Remote error %d: %s %s", status, error.exceptionCode(), error.exceptionMessage());
        return BulkApiException.remoteError(status, error.exceptionCode(), error.exceptionMessage());
    }
}
