package com.example.loyaltyhook.security;

public interface VerifierStrategy {
    /**
     * Verify that the raw webhook body was signed with the shared secret.
     * Never throws: a missing header, blank secret or mismatch all yield false.
     *
     * @param rawBody         the exact bytes received
     * @param signatureHeader the signature header value, may be null
     * @param secret          the shared secret
     * @return true if valid, false otherwise
     */
    boolean verify(byte[] rawBody, String signatureHeader, String secret);
}
