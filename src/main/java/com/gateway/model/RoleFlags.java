package com.gateway.model;

/**
 * The role flags returned by the identity endpoint for one credential.
 *
 * @param superuser       Elevated privilege on the platform.
 * @param platformAuditor Read-only auditor on the platform.
 */
public record RoleFlags(boolean superuser, boolean platformAuditor) {
}
