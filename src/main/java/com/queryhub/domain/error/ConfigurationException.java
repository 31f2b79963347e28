package com.queryhub.domain.error;

/**
 * The workspace's integration is missing, disabled or misconfigured.
 */
public class ConfigurationException extends QueryException {

    public ConfigurationException(String message) {
        super(ErrorKind.CONFIGURATION_ERROR, message, false);
    }
}
