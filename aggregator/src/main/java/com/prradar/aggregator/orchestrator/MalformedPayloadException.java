package com.prradar.aggregator.orchestrator;

import java.io.IOException;

/**
 * Raised when an API payload lacks a field the aggregator needs or carries one it cannot parse.
 * Treated exactly like a transport failure.
 */
public class MalformedPayloadException extends IOException {

    public MalformedPayloadException(String message) {
        super(message);
    }

    public MalformedPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
