package com.niigaki.billing.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;

@Component
@ConfigurationProperties(prefix = "niigaki.asaas")
@Data
public class AsaasProperties {

    private static final String SANDBOX_URL = "https://sandbox.asaas.com/api/v3";
    private static final String PRODUCTION_URL = "https://api.asaas.com/v3";

    private String environment = "sandbox";
    private String apiBaseUrl;
    private String apiKey;
    private String webhookToken;
    private String defaultBillingType = "BOLETO";
    private Duration timeout = Duration.ofSeconds(30);

    public String resolveApiBaseUrl() {
        if (apiBaseUrl != null && !apiBaseUrl.isBlank()) {
            return apiBaseUrl;
        }
        String env = environment == null ? "" : environment.trim().toLowerCase(Locale.ROOT);
        return "production".equals(env) ? PRODUCTION_URL : SANDBOX_URL;
    }
}
