package com.gt.linker.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

// Thrown when a knowledge point has no identifier and no usable correct phrase to derive one from
@ResponseStatus(value = HttpStatus.UNPROCESSABLE_ENTITY)
public class IdentityUnresolvableException extends RuntimeException {

    public IdentityUnresolvableException(String errMsg) {
        super(errMsg);
    }
}
