package com.onboarding.core.provisioning;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "onboarding.chat")
public class ChatProvisioningProperties {

    /** Least-privilege service account the chat worker acts as. */
    private String serviceAccountId = "";

    public String getServiceAccountId() {
        return serviceAccountId;
    }

    public void setServiceAccountId(String serviceAccountId) {
        this.serviceAccountId = serviceAccountId;
    }
}
