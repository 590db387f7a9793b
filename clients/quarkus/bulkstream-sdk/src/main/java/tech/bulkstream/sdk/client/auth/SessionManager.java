package tech.bulkstream.sdk.client.auth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.bulkstream.sdk.client.xml.XmlPayloads;
import tech.bulkstream.sdk.config.BulkApiConfig;
import tech.bulkstream.sdk.dto.SessionContext;
import tech.bulkstream.sdk.exception.AuthenticationException;
import tech.bulkstream.sdk.exception.BulkApiException;
import tech.bulkstream.sdk.exception.ConfigurationException;
import tech.bulkstream.sdk.exception.TransportException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Performs the SOAP login exchange and caches the resulting session.
 *
 * <p>The session is kept for the life of this instance. The remaining lifetime the
 * service reports is recorded on the {@link SessionContext} but not enforced.
 */
@ApplicationScoped
public class SessionManager {

    private static final Logger LOG = Logger.getLogger(SessionManager.class);

    private final HttpClient httpClient;
    private final XmlPayloads xml;
    private final ReentrantLock lock = new ReentrantLock();
    private final int timeoutSeconds;

    private final String apiVersion;
    private final String loginUrl;
    private final String loginEnvelope;

    private SessionContext session;

    @Inject
    public SessionManager(BulkApiConfig config) {
        this(config, HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofSeconds(config.http().connectTimeout()))
            .build());
    }

    public SessionManager(BulkApiConfig config, HttpClient httpClient) {
        String url = required(config.url(), "url");
        String username = required(config.username(), "username");
        String password = required(config.password(), "password");
        String securityToken = required(config.securityToken(), "security-token");
        this.apiVersion = required(config.apiVersion(), "api-version");

        this.httpClient = httpClient;
        this.xml = new XmlPayloads();
        this.timeoutSeconds = config.http().timeout();
        this.loginUrl = url.replaceAll("/$", "") + "/services/Soap/u/" + apiVersion;
        this.loginEnvelope = xml.loginEnvelope(username, password, securityToken);
    }

    /**
     * Get the authenticated session, logging in on first use.
     */
    public SessionContext login() {
        lock.lock();
        try {
            if (session != null) {
                return session;
            }
            session = fetchSession();
            return session;
        } finally {
            lock.unlock();
        }
    }

    /**
     * The cached session, if a login already happened.
     */
    public Optional<SessionContext> current() {
        lock.lock();
        try {
            return Optional.ofNullable(session);
        } finally {
            lock.unlock();
        }
    }

    private SessionContext fetchSession() {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(loginUrl))
            .header("Content-Type", "text/xml; charset=UTF-8")
            .header("SOAPAction", "login")
            .POST(HttpRequest.BodyPublishers.ofString(loginEnvelope))
            .timeout(Duration.ofSeconds(timeoutSeconds))
            .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw TransportException.requestFailed("POST", loginUrl, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw TransportException.interrupted("POST", loginUrl, e);
        }

        if (response.statusCode() != 200) {
            String fault = faultOf(response.body());
            LOG.errorf("Login to %s rejected with status %d: %s", loginUrl, response.statusCode(), fault);
            throw AuthenticationException.loginRejected(fault);
        }

        try {
            XmlPayloads.LoginResult result = xml.parseLoginResponse(response.body());
            SessionContext context = SessionContext.of(
                result.serverUrl(), result.sessionId(), apiVersion, result.sessionSecondsValid());
            LOG.infof("Logged in to %s (session valid for %ds)", context.baseUrl(), context.sessionSecondsValid());
            return context;
        } catch (BulkApiException e) {
            throw AuthenticationException.malformedResponse(e);
        }
    }

    private String faultOf(String body) {
        try {
            return xml.parseSoapFault(body);
        } catch (BulkApiException e) {
            LOG.debugf(e, "Login error body is not a SOAP fault");
            return null;
        }
    }

    private static String required(Optional<String> value, String key) {
        return value
            .filter(v -> !v.isBlank())
            .orElseThrow(() -> ConfigurationException.missing(BulkApiConfig.PREFIX + "." + key));
    }
}
