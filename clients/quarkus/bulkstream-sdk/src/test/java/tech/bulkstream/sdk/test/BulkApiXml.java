package tech.bulkstream.sdk.test;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Canned response documents in the shape the bulk API returns them.
 */
public final class BulkApiXml {

    public static final String NS = "http://www.force.com/2009/06/asyncapi/dataload";

    private BulkApiXml() {
    }

    public static String loginResponse(String serverBaseUrl, String sessionId) {
        return "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
            + "<soapenv:Envelope xmlns:soapenv=\"http://schemas.xmlsoap.org/soap/envelope/\""
            + " xmlns=\"urn:partner.soap.sforce.com\""
            + " xmlns:xsi=\"http://www.w3.org/2001/XMLSchema-instance\">"
            + "<soapenv:Body><loginResponse><result>"
            + "<metadataServerUrl>" + serverBaseUrl + "/services/Soap/m/41.0/00D29000000DQIy</metadataServerUrl>"
            + "<passwordExpired>false</passwordExpired>"
            + "<sandbox>true</sandbox>"
            + "<serverUrl>" + serverBaseUrl + "/services/Soap/u/41.0/00D29000000DQIy</serverUrl>"
            + "<sessionId>" + sessionId + "</sessionId>"
            + "<userId>00536000002xBG9AAM</userId>"
            + "<userInfo><organizationName>Example Org</organizationName>"
            + "<sessionSecondsValid>7200</sessionSecondsValid>"
            + "<userTimeZone>America/New_York</userTimeZone></userInfo>"
            + "</result></loginResponse></soapenv:Body></soapenv:Envelope>";
    }

    public static String loginFault(String faultString) {
        return "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
            + "<soapenv:Envelope xmlns:soapenv=\"http://schemas.xmlsoap.org/soap/envelope/\""
            + " xmlns:sf=\"urn:fault.partner.soap.sforce.com\">"
            + "<soapenv:Body><soapenv:Fault>"
            + "<faultcode>sf:INVALID_LOGIN</faultcode>"
            + "<faultstring>" + faultString + "</faultstring>"
            + "</soapenv:Fault></soapenv:Body></soapenv:Envelope>";
    }

    public static String jobInfo(String id, String operation, String state,
                                 int completed, int total, int batchesFailed, long recordsFailed) {
        return "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
            + "<jobInfo xmlns=\"" + NS + "\">"
            + "<id>" + id + "</id>"
            + "<operation>" + operation + "</operation>"
            + "<object>Contact</object>"
            + "<createdById>00536000002xBG9AAM</createdById>"
            + "<createdDate>2017-12-07T11:00:29.000Z</createdDate>"
            + "<systemModstamp>2017-12-07T11:00:29.000Z</systemModstamp>"
            + "<state>" + state + "</state>"
            + "<concurrencyMode>Parallel</concurrencyMode>"
            + "<contentType>CSV</contentType>"
            + "<numberBatchesQueued>0</numberBatchesQueued>"
            + "<numberBatchesInProgress>" + (total - completed - batchesFailed) + "</numberBatchesInProgress>"
            + "<numberBatchesCompleted>" + completed + "</numberBatchesCompleted>"
            + "<numberBatchesFailed>" + batchesFailed + "</numberBatchesFailed>"
            + "<numberBatchesTotal>" + total + "</numberBatchesTotal>"
            + "<numberRecordsProcessed>2</numberRecordsProcessed>"
            + "<numberRetries>0</numberRetries>"
            + "<apiVersion>41.0</apiVersion>"
            + "<numberRecordsFailed>" + recordsFailed + "</numberRecordsFailed>"
            + "<totalProcessingTime>0</totalProcessingTime>"
            + "</jobInfo>";
    }

    public static String openJob(String id, String operation) {
        return jobInfo(id, operation, "Open", 0, 0, 0, 0);
    }

    public static String batchInfo(String id, String jobId, String state) {
        return "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
            + "<batchInfo xmlns=\"" + NS + "\">" + batchInfoBody(id, jobId, state) + "</batchInfo>";
    }

    /**
     * @param batches alternating batch id and state
     */
    public static String batchInfoList(String jobId, String... batches) {
        StringBuilder xml = new StringBuilder("<?xml version=\"1.0\" encoding=\"UTF-8\"?>")
            .append("<batchInfoList xmlns=\"").append(NS).append("\">");
        for (int i = 0; i + 1 < batches.length; i += 2) {
            xml.append("<batchInfo>").append(batchInfoBody(batches[i], jobId, batches[i + 1])).append("</batchInfo>");
        }
        return xml.append("</batchInfoList>").toString();
    }

    public static String resultList(String... resultIds) {
        return "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
            + "<result-list xmlns=\"" + NS + "\">"
            + Arrays.stream(resultIds).map(id -> "<result>" + id + "</result>").collect(Collectors.joining())
            + "</result-list>";
    }

    public static String error(String exceptionCode, String exceptionMessage) {
        return "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
            + "<error xmlns=\"" + NS + "\">"
            + "<exceptionCode>" + exceptionCode + "</exceptionCode>"
            + "<exceptionMessage>" + exceptionMessage + "</exceptionMessage>"
            + "</error>";
    }

    private static String batchInfoBody(String id, String jobId, String state) {
        return "<id>" + id + "</id>"
            + "<jobId>" + jobId + "</jobId>"
            + "<state>" + state + "</state>"
            + "<createdDate>2017-12-07T17:35:33.000Z</createdDate>"
            + "<systemModstamp>2017-12-07T17:35:35.000Z</systemModstamp>"
            + "<numberRecordsProcessed>2</numberRecordsProcessed>"
            + "<numberRecordsFailed>0</numberRecordsFailed>"
            + "<totalProcessingTime>964</totalProcessingTime>"
            + "<apiActiveProcessingTime>812</apiActiveProcessingTime>"
            + "<apexProcessingTime>271</apexProcessingTime>";
    }
}
