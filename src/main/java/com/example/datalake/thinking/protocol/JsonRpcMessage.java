package com.example.datalake.thinking.protocol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Map;

/**
 * One JSON-RPC 2.0 frame. Requests carry a method and an id, notifications a method only, and
 * responses an id with either a result or an error.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JsonRpcMessage(
    String jsonrpc,
    Object id,
    String method,
    Map<String, Object> params,
    Object result,
    JsonRpcError error
) {

  public static final String VERSION = "2.0";

  public static JsonRpcMessage request(Object id, String method, Map<String, Object> params) {
    return new JsonRpcMessage(VERSION, id, method, params, null, null);
  }

  public static JsonRpcMessage notification(String method, Map<String, Object> params) {
    return new JsonRpcMessage(VERSION, null, method, params, null, null);
  }

  public static JsonRpcMessage result(Object id, Object result) {
    return new JsonRpcMessage(VERSION, id, null, null, result, null);
  }

  public static JsonRpcMessage error(Object id, JsonRpcError error) {
    return new JsonRpcMessage(VERSION, id, null, null, null, error);
  }

  @JsonIgnore
  public boolean isRequest() {
    return method != null && id != null;
  }

  @JsonIgnore
  public boolean isNotification() {
    return method != null && id == null;
  }

  @JsonIgnore
  public boolean isResponse() {
    return method == null && id != null && (result != null || error != null);
  }
}
