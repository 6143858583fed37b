package com.bidmarket.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * A failure kind that the route layer can render as a problem response.
 */
public interface ErrorCode {

    HttpStatus status();

    /**
     * Code exposed to clients. Several internal kinds may share one public code.
     */
    String publicCode();

    String publicDetail();
}
