package com.kbindex.index;

public class IndexStorageException extends RuntimeException {

    public IndexStorageException(String message) {
        super(message);
    }

    public IndexStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
