package com.polarroute.route.exception;

import org.springframework.http.HttpStatus;

public class RouteException extends RuntimeException {

    private final String code;
    private final HttpStatus status;

    public RouteException(String code, String message) {
        this(code, message, HttpStatus.BAD_REQUEST);
    }

    public RouteException(String code, String message, HttpStatus status) {
        super(message);
        this.code = code;
        this.status = status;
    }

    public String getCode() {
        return code;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
