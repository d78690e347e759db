package com.delta.screener.screening.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InvalidResumeTextException extends RuntimeException {
    public InvalidResumeTextException(String message) {
        super(message);
    }
}
