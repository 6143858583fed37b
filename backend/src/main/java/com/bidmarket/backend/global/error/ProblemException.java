package com.bidmarket.backend.global.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class ProblemException extends ResponseStatusException {

    private static final String DEFAULT_TYPE_PREFIX = "urn:problem:bidmarket:";

    private final String code;
    private final String detail;
    private final String type;

    public ProblemException(ErrorCode errorCode) {
        this(errorCode.status(), errorCode.publicCode(), errorCode.publicDetail());
    }

    public ProblemException(HttpStatus status, String code, String detail) {
        super(status, code);
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("ProblemException code must not be blank");
        }
        this.code = code;
        this.detail = (detail != null && !detail.isBlank()) ? detail : code;
        this.type = DEFAULT_TYPE_PREFIX + code.toLowerCase().replaceAll("[^a-z0-9\\-_.:]+", "-");
    }

    public String getCode() {
        return code;
    }

    public String getDetailMessage() {
        return detail;
    }

    public String getProblemType() {
        return type;
    }

    public ProblemResponse toResponse(String instance) {
        return new ProblemResponse(type, HttpStatus.valueOf(getStatusCode().value()).getReasonPhrase(),
                getStatusCode().value(), detail, instance, code, null);
    }
}
