package tech.bulkstream.sdk.dto;

/**
 * Authenticated session produced by the login exchange.
 *
 * @param baseUrl             server base URL, e.g. {@code https://na1.example.com}
 * @param sessionId           token sent with every authenticated request
 * @param jobUrl              job collection endpoint derived from the base URL and API version
 * @param sessionSecondsValid remaining lifetime reported at login; recorded but not enforced
 */
public record SessionContext(
    String baseUrl,
    String sessionId,
    String jobUrl,
    int sessionSecondsValid
) {
    public static SessionContext of(String serverUrl, String sessionId, String apiVersion, int sessionSecondsValid) {
        String baseUrl = serverUrl;
        int i = serverUrl.indexOf("/services/Soap/");
        if (i >= 0) {
            baseUrl = serverUrl.substring(0, i);
        }
        return new SessionContext(
            baseUrl,
            sessionId,
            baseUrl + "/services/async/" + apiVersion + "/job",
            sessionSecondsValid
        );
    }

    public String jobUrl(String jobId) {
        return jobUrl + "/" + jobId;
    }

    @Override
    public String toString() {
        return "SessionContext[baseUrl=" + baseUrl + ", jobUrl=" + jobUrl + "]";
    }
}
