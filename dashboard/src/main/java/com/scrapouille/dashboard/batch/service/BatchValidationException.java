package com.scrapouille.dashboard.batch.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class BatchValidationException extends RuntimeException {
    public BatchValidationException(String message) {
        super(message);
    }
}
