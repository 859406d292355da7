package com.boarddb.core.scanner;

/**
 * Thrown when a fragment file name does not end in {@code _defconfig}.
 */
public class InvalidFragmentNameException extends RuntimeException {
    public InvalidFragmentNameException(String message) {
        super(message);
    }
}
