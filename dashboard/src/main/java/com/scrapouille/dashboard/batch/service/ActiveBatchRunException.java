package com.scrapouille.dashboard.batch.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class ActiveBatchRunException extends RuntimeException {
    public ActiveBatchRunException(String message) {
        super(message);
    }
}
