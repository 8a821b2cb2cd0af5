package com.gt.linker.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

// Thrown when the server refuses a request it received, e.g. a validation failure
@ResponseStatus(value = HttpStatus.UNPROCESSABLE_ENTITY)
public class RemoteRejectedException extends RuntimeException {

    private final int statusCode;

    public RemoteRejectedException(String errMsg, int statusCode) {
        super(errMsg);
        this.statusCode = statusCode;
    }

    public RemoteRejectedException(String errMsg, int statusCode, Exception ex) {
        super(errMsg, ex);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
