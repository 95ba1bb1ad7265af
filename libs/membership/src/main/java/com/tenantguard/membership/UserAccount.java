package com.tenantguard.membership;

/**
 * A user known to the external identity provider. This subsystem only references users.
 *
 * @param id    user identifier
 * @param email primary email address
 */
public record UserAccount(String id, String email) {}
