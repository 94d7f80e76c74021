package com.example.cloudinvestigator.credentials;

import com.example.cloudinvestigator.config.InvestigatorProperties;
import com.example.cloudinvestigator.domain.Provider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Reads the standard provider credential variables from the process environment.
 */
@Slf4j
@Component
public class EnvironmentCredentialProvider implements CredentialProvider {

    private static final Map<Provider, List<String>> VARIABLES = Map.of(
            Provider.AWS, List.of("AWS_ACCESS_KEY_ID", "AWS_SECRET_ACCESS_KEY", "AWS_SESSION_TOKEN",
                    "AWS_REGION", "AWS_PROFILE"),
            Provider.AZURE, List.of("AZURE_CLIENT_ID", "AZURE_CLIENT_SECRET", "AZURE_TENANT_ID",
                    "AZURE_SUBSCRIPTION_ID"),
            Provider.GCP, List.of("GOOGLE_APPLICATION_CREDENTIALS", "GOOGLE_CLOUD_PROJECT", "GCLOUD_PROJECT"));

    private final Function<String, String> environment;
    private final String defaultAwsRegion;

    @Autowired
    public EnvironmentCredentialProvider(InvestigatorProperties properties) {
        this(System::getenv, properties.getSteampipe().getDefaultAwsRegion());
    }

    EnvironmentCredentialProvider(Function<String, String> environment, String defaultAwsRegion) {
        this.environment = environment;
        this.defaultAwsRegion = defaultAwsRegion;
    }

    @Override
    public Map<String, String> credentialsFor(Provider provider) {
        Map<String, String> credentials = new LinkedHashMap<>();
        for (String name : VARIABLES.get(provider)) {
            String value = environment.apply(name);
            if (value != null && !value.isEmpty()) {
                credentials.put(name, value);
            }
        }
        if (provider == Provider.AWS) {
            credentials.putIfAbsent("AWS_REGION", defaultAwsRegion);
        }
        log.debug("Resolved {} credential variable(s) for {}", credentials.size(), provider.getId());
        return credentials;
    }
}
