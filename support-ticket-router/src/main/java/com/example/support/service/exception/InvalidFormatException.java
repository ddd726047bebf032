package com.example.support.service.exception;

import org.springframework.http.HttpStatus;

public class InvalidFormatException extends ServiceException {

    public InvalidFormatException(String message, String errorCode) {
        super(HttpStatus.BAD_REQUEST, message, errorCode);
    }
}
