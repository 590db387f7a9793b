package tech.bulkstream.sdk.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.util.Optional;

/**
 * Configuration for the bulk API client.
 *
 * <p>Configure in application.properties:
 * <pre>
 * bulkstream.url=https://login.example.com
 * bulkstream.username=integration@example.com
 * bulkstream.password=secret
 * bulkstream.security-token=token
 * bulkstream.api-version=41.0
 * </pre>
 *
 * <p>The connection settings are optional here so that a missing value is reported
 * as a {@link tech.bulkstream.sdk.exception.ConfigurationException} naming the key.
 */
@ConfigMapping(prefix = "bulkstream")
public interface BulkApiConfig {

    String PREFIX = "bulkstream";

    /**
     * Login host. The SOAP login endpoint is derived from it.
     */
    Optional<String> url();

    Optional<String> username();

    Optional<String> password();

    /**
     * Security token appended to the password at login.
     */
    @WithName("security-token")
    Optional<String> securityToken();

    /**
     * API version used in both the login and the job endpoints, e.g. {@code 41.0}.
     */
    @WithName("api-version")
    Optional<String> apiVersion();

    /**
     * HTTP client configuration.
     */
    HttpConfig http();

    /**
     * Job completion polling configuration.
     */
    PollConfig poll();

    interface HttpConfig {
        /**
         * Request timeout in seconds.
         */
        @WithDefault("30")
        int timeout();

        /**
         * Connect timeout in seconds.
         */
        @WithName("connect-timeout")
        @WithDefault("10")
        int connectTimeout();
    }

    interface PollConfig {
        /**
         * Delay between job status reads in milliseconds.
         */
        @WithDefault("2000")
        long interval();

        /**
         * Status reads before giving up on a job.
         */
        @WithName("max-attempts")
        @WithDefault("1800")
        int maxAttempts();
    }
}
