package com.openrangelabs.copilot.http;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Status, raw text and best-effort parsed JSON of one HTTP response.
 */
public class RawResponse {

    private final int status;
    private final String body;
    private final JsonNode json;

    public RawResponse(int status, String body, JsonNode json) {
        this.status = status;
        this.body = body != null ? body : "";
        this.json = json;
    }

    public boolean is2xxSuccessful() {
        return status >= 200 && status < 300;
    }

    /**
     * Whether the body parsed as a JSON object or array.
     */
    public boolean hasJson() {
        return json != null && (json.isObject() || json.isArray());
    }

    // Getters
    public int getStatus() { return status; }
    public String getBody() { return body; }
    public JsonNode getJson() { return json; }

    @Override
    public String toString() {
        return "RawResponse{" +
                "status=" + status +
                ", bodyLength=" + body.length() +
                ", json=" + (json != null) +
                '}';
    }
}
