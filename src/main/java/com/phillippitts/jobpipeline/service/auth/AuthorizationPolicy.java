package com.phillippitts.jobpipeline.service.auth;

/**
 * Decides which users hold administrative rights over jobs they do not own.
 */
public interface AuthorizationPolicy {

    boolean isAdmin(String userId);
}
