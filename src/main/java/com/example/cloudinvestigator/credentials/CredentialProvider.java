package com.example.cloudinvestigator.credentials;

import com.example.cloudinvestigator.domain.Provider;

import java.util.Map;

/**
 * Supplies the credential entries handed to the query engine for a provider.
 * Entries are environment-style names (e.g. AWS_ACCESS_KEY_ID) and are opaque
 * to the agent.
 */
public interface CredentialProvider {

    Map<String, String> credentialsFor(Provider provider);
}
