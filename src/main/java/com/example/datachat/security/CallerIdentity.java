package com.example.datachat.security;

import com.example.datachat.model.entity.AppUser;

/**
 * Quién hace la petición, con lo justo para autorizar contra un proyecto.
 */
public record CallerIdentity(Long userId, String organizationId, AppUser.GlobalRole role) {

    public static CallerIdentity of(AppUser user) {
        return new CallerIdentity(user.getId(), user.getOrganizationId(), user.getRole());
    }

    public boolean isSuperadmin() {
        return role == AppUser.GlobalRole.SUPERADMIN;
    }
}
