package com.newsverdict.service.scoring;

public class InsufficientInputException extends IllegalArgumentException {
    public InsufficientInputException(String message) {
        super(message);
    }
}
