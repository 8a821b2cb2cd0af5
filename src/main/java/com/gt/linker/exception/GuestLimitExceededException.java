package com.gt.linker.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(value = HttpStatus.CONFLICT)
public class GuestLimitExceededException extends RuntimeException {

    public GuestLimitExceededException(int limit) {
        super("Guest mode allows at most " + limit + " saved knowledge points");
    }
}
