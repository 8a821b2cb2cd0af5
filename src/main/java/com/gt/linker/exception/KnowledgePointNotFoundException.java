package com.gt.linker.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(value = HttpStatus.NOT_FOUND)
public class KnowledgePointNotFoundException extends RuntimeException {

    public KnowledgePointNotFoundException(String effectiveId) {
        super("Knowledge point " + effectiveId + " does not exist");
    }
}
