package fr.lapetina.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.orchestrator.domain.model.CallResult;

/**
 * Response of {@code POST /v1/calls}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CallApiResponse {

    @JsonProperty("request_id")
    private String requestId;

    private boolean success;
    private Object data;
    private String error;

    @JsonProperty("error_message")
    private String errorMessage;

    @JsonProperty("instance_id")
    private String instanceId;

    @JsonProperty("response_time_ms")
    private long responseTimeMs;

    public String getRequestId() { return requestId; }
    public void setRequestId(String requestId) { this.requestId = requestId; }

    public boolean isSuccess() { return success; }
    public void setSuccess(boolean success) { this.success = success; }

    public Object getData() { return data; }
    public void setData(Object data) { this.data = data; }

    public String getError() { return error; }
    public void setError(String error) { this.error = error; }

    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }

    public String getInstanceId() { return instanceId; }
    public void setInstanceId(String instanceId) { this.instanceId = instanceId; }

    public long getResponseTimeMs() { return responseTimeMs; }
    public void setResponseTimeMs(long responseTimeMs) { this.responseTimeMs = responseTimeMs; }

    public static CallApiResponse fromCallResult(CallResult result) {
        CallApiResponse api = new CallApiResponse();
        api.setRequestId(result.requestId());
        api.setSuccess(result.success());
        api.setData(result.data());
        api.setError(result.error());
        api.setErrorMessage(result.errorMessage());
        api.setInstanceId(result.instanceId());
        api.setResponseTimeMs(result.responseTimeMs());
        return api;
    }
}
