package com.blockflow.blockflow_engine.tool;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Envelope every tool answers with: {@code { success, output?, error? }}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ToolResponse(boolean success, Object output, String error) {

    public static ToolResponse ok(Object output)      { return new ToolResponse(true,  output, null); }
    public static ToolResponse error(String message)  { return new ToolResponse(false, null,   message); }
}
