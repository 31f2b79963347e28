package com.queryhub.api.web;

/**
 * The request carries no usable caller identity. Answered with 401.
 */
public class CallerAuthenticationException extends RuntimeException {

    public CallerAuthenticationException(String message) {
        super(message);
    }
}
