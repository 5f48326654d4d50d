package com.phillippitts.jobpipeline.service.auth;

import com.phillippitts.jobpipeline.config.properties.AuthorizationProperties;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Admins are the users listed in {@code authorization.admin-user-ids}.
 */
@Component
public class ConfiguredAuthorizationPolicy implements AuthorizationPolicy {

    private final Set<String> adminUserIds;

    public ConfiguredAuthorizationPolicy(AuthorizationProperties properties) {
        this.adminUserIds = Set.copyOf(properties.getAdminUserIds());
    }

    @Override
    public boolean isAdmin(String userId) {
        return userId != null && adminUserIds.contains(userId);
    }
}
