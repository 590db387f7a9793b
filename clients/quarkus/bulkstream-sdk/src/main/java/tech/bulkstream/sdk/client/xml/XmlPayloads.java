package tech.bulkstream.sdk.client.xml;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import tech.bulkstream.sdk.dto.BatchInfo;
import tech.bulkstream.sdk.dto.JobInfo;
import tech.bulkstream.sdk.dto.JobSpec;
import tech.bulkstream.sdk.enums.JobState;
import tech.bulkstream.sdk.exception.BulkApiException;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes the XML documents exchanged with the bulk API.
 *
 * <p>Repeatable elements ({@code batchInfo}, {@code result}) always come back as an
 * ordered list: the XML tree holds a bare object when only one element is present,
 * and that is normalized here so callers never see the difference.
 */
public class XmlPayloads {

    public static final String NAMESPACE = "http://www.force.com/2009/06/asyncapi/dataload";

    private static final String XML_DECLARATION = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n";

    private final XmlMapper xmlMapper;

    public XmlPayloads() {
        this.xmlMapper = XmlMapper.builder()
            .addModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .build();
    }

    // Requests

    /**
     * SOAP login envelope. The password and security token are sent concatenated.
     */
    public String loginEnvelope(String username, String password, String securityToken) {
        return XML_DECLARATION
            + "<env:Envelope xmlns:xsd=\"http://www.w3.org/2001/XMLSchema\"\n"
            + "  xmlns:xsi=\"http://www.w3.org/2001/XMLSchema-instance\"\n"
            + "  xmlns:env=\"http://schemas.xmlsoap.org/soap/envelope/\">\n"
            + "  <env:Body>\n"
            + "    <n1:login xmlns:n1=\"urn:partner.soap.sforce.com\">\n"
            + "      <n1:username>" + escape(username) + "</n1:username>\n"
            + "      <n1:password>" + escape(password) + escape(securityToken) + "</n1:password>\n"
            + "    </n1:login>\n"
            + "  </env:Body>\n"
            + "</env:Envelope>";
    }

    /**
     * Job creation body. The service rejects elements out of this order.
     */
    public String jobCreate(JobSpec spec) {
        StringBuilder xml = new StringBuilder(XML_DECLARATION)
            .append("<jobInfo xmlns=\"").append(NAMESPACE).append("\">\n")
            .append("  <operation>").append(spec.operation().wireValue()).append("</operation>\n")
            .append("  <object>").append(escape(spec.object())).append("</object>\n");
        if (spec.externalIdFieldName() != null) {
            xml.append("  <externalIdFieldName>").append(escape(spec.externalIdFieldName()))
                .append("</externalIdFieldName>\n");
        }
        xml.append("  <concurrencyMode>").append(spec.concurrencyMode().wireValue()).append("</concurrencyMode>\n")
            .append("  <contentType>CSV</contentType>\n")
            .append("</jobInfo>");
        return xml.toString();
    }

    /**
     * Body moving a job to {@link JobState#CLOSED} or {@link JobState#ABORTED}.
     */
    public String jobStateChange(JobState state) {
        return XML_DECLARATION
            + "<jobInfo xmlns=\"" + NAMESPACE + "\">\n"
            + "  <state>" + state.wireValue() + "</state>\n"
            + "</jobInfo>";
    }

    // Responses

    public LoginResult parseLoginResponse(String xml) {
        JsonNode result = read(xml).path("Body").path("loginResponse").path("result");
        String serverUrl = text(result, "serverUrl");
        String sessionId = text(result, "sessionId");
        if (serverUrl == null || sessionId == null) {
            throw new BulkApiException("Login response has no serverUrl or sessionId");
        }
        int secondsValid = result.path("userInfo").path("sessionSecondsValid").asInt(0);
        return new LoginResult(serverUrl, sessionId, secondsValid);
    }

    /**
     * Reads a SOAP fault string, or {@code null} when the document carries none.
     */
    public String parseSoapFault(String xml) {
        JsonNode fault = read(xml).path("Body").path("Fault");
        return fault.isMissingNode() ? null : text(fault, "faultstring");
    }

    /**
     * Reads an async API {@code <error>} document into exception code and message.
     */
    public RemoteError parseError(String xml) {
        JsonNode error = read(xml);
        return new RemoteError(text(error, "exceptionCode"), text(error, "exceptionMessage"));
    }

    public JobInfo parseJobInfo(String xml) {
        return convert(read(xml), JobInfo.class);
    }

    public BatchInfo parseBatchInfo(String xml) {
        return convert(read(xml), BatchInfo.class);
    }

    public List<BatchInfo> parseBatchInfoList(String xml) {
        List<BatchInfo> batches = new ArrayList<>();
        for (JsonNode node : elements(read(xml), "batchInfo")) {
            batches.add(convert(node, BatchInfo.class));
        }
        return batches;
    }

    /**
     * Result segment ids of a batch, in document order.
     */
    public List<String> parseResultList(String xml) {
        List<String> ids = new ArrayList<>();
        for (JsonNode node : elements(read(xml), "result")) {
            String id = node.asText();
            if (!id.isBlank()) {
                ids.add(id.trim());
            }
        }
        return ids;
    }

    /**
     * Returns the child elements named {@code name} as a list, whether the tree holds
     * none, a single object or an array of them.
     */
    static List<JsonNode> elements(JsonNode parent, String name) {
        JsonNode node = parent.path(name);
        if (node.isMissingNode() || node.isNull()) {
            return List.of();
        }
        if (node.isArray()) {
            List<JsonNode> items = new ArrayList<>();
            node.forEach(items::add);
            return items;
        }
        return List.of(node);
    }

    public static String escape(String value) {
        if (value == null) {
            return "";
        }
        return value.replace("&", "&amp;")
            .replace("<", "&lt;")
            .replace(">", "&gt;")
            .replace("\"", "&quot;")
            .replace("'", "&apos;");
    }

    private JsonNode read(String xml) {
        if (xml == null || xml.isBlank()) {
            return xmlMapper.createObjectNode();
        }
        try {
            JsonNode node = xmlMapper.readTree(xml);
            return node != null ? node : xmlMapper.createObjectNode();
        } catch (JsonProcessingException e) {
            throw new BulkApiException("Failed to parse response", e);
        }
    }

    private <T> T convert(JsonNode node, Class<T> type) {
        try {
            return xmlMapper.treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new BulkApiException("Failed to map response to " + type.getSimpleName(), e);
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isValueNode() ? value.asText() : null;
    }

    public record LoginResult(String serverUrl, String sessionId, int sessionSecondsValid) {}

    public record RemoteError(String exceptionCode, String exceptionMessage) {}
}
