package com.gateway.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;

/**
 * The outcome of one successful tool dispatch.
 *
 * @param toolName   The invoked tool.
 * @param method     Upper-case HTTP method that was sent.
 * @param url        The full target URL.
 * @param statusCode HTTP status of the backend response.
 * @param payload    Parsed JSON for structured responses, a text node otherwise.
 * @param structured Whether the response declared a JSON content type and parsed as such.
 * @param elapsed    Wall-clock time of the HTTP exchange.
 */
public record InvocationResult(String toolName,
                               String method,
                               String url,
                               int statusCode,
                               JsonNode payload,
                               boolean structured,
                               Duration elapsed) {
}
