package com.queryhub.domain.error;

public class ResourceNotFoundException extends QueryException {

    public ResourceNotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message, false);
    }
}
