package com.gt.linker.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(value = HttpStatus.BAD_REQUEST)
public class InvalidKnowledgePointException extends RuntimeException {

    public InvalidKnowledgePointException(String errMsg) {
        super(errMsg);
    }
}
