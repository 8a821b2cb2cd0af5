package com.gt.linker.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(value = HttpStatus.SERVICE_UNAVAILABLE)
public class RemoteUnreachableException extends RuntimeException {

    public RemoteUnreachableException(String errMsg) {
        super(errMsg);
    }

    public RemoteUnreachableException(String errMsg, Exception ex) {
        super(errMsg, ex);
    }
}
