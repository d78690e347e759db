package com.delta.screener.screening.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InvalidScreeningRequestException extends RuntimeException {
    public InvalidScreeningRequestException(String message) {
        super(message);
    }
}
