package com.kbindex.index;

public class ScanInterruptedException extends RuntimeException {

    public ScanInterruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
