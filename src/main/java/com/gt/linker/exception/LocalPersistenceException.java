package com.gt.linker.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

// Thrown when the on-device store cannot be read or written. The operation is aborted and prior state kept.
@ResponseStatus(value = HttpStatus.INTERNAL_SERVER_ERROR)
public class LocalPersistenceException extends RuntimeException {

    public LocalPersistenceException(String errMsg)  {
        super(errMsg);
    }

    public LocalPersistenceException(String errMsg, Exception ex) {
        super(errMsg, ex);
    }
}
