package com.gt.linker.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

// Thrown when a cloud-only operation is attempted without an authenticated session
@ResponseStatus(value = HttpStatus.UNAUTHORIZED)
public class NotAuthenticatedException extends RuntimeException {

    public NotAuthenticatedException(String errMsg) {
        super(errMsg);
    }
}
