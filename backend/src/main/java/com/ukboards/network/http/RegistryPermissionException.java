package com.ukboards.network.http;

/**
 * A registry refused a query (401 or 403). The message says what to check: the query, the API key
 * variable and key file, and the external IP address the key must allow.
 */
public class RegistryPermissionException extends RuntimeException {
    private final String query;
    private final String ipAddress;

    public RegistryPermissionException(String query, String apiKeyEnvName, String apiKeyPath, String ipAddress) {
        super(
            "Query: " + query + "\nreturned a 403 (forbidden) error. If that query seems correct, check the "
                + apiKeyEnvName + " is set in your local " + apiKeyPath + " file.\n"
                + "If both are correct, check the external IP address of this computer (" + ipAddress
                + ") is included in the list of Restricted IPs on your registered Companies House API Key."
        );
        this.query = query;
        this.ipAddress = ipAddress;
    }

    public String getQuery() {
        return query;
    }

    public String getIpAddress() {
        return ipAddress;
    }
}
