package com.ukboards.network.http;

public class RegistryConnectionException extends RuntimeException {
    public static final String DEFAULT_MESSAGE = "Your external IP address cannot be found. You may have lost "
        + "internet connectivity or have a restricted local connection without access to the wider internet, "
        + "including the IP check service, Companies House and Charity Commission APIs.";

    public RegistryConnectionException(String message) {
        super(message);
    }

    public RegistryConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
