package com.scanq.exception;

/**
 * Base exception for the scan admission scheduler.
 */
public class ScanQueueException extends RuntimeException {

    public ScanQueueException(String message) {
        super(message);
    }

    public ScanQueueException(String message, Throwable cause) {
        super(message, cause);
    }
}
