package com.phillippitts.jobpipeline.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashSet;
import java.util.Set;

/**
 * Static authorization settings.
 */
@ConfigurationProperties(prefix = "authorization")
public class AuthorizationProperties {

    /** Users allowed to cancel jobs they do not own. */
    private Set<String> adminUserIds = new HashSet<>();

    public Set<String> getAdminUserIds() {
        return adminUserIds;
    }

    public void setAdminUserIds(Set<String> adminUserIds) {
        this.adminUserIds = adminUserIds;
    }
}
