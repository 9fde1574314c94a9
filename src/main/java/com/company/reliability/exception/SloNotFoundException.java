package com.company.reliability.exception;

public class SloNotFoundException extends RuntimeException {
    public SloNotFoundException(String sloId) {
        super("SLO not found: " + sloId);
    }
}
