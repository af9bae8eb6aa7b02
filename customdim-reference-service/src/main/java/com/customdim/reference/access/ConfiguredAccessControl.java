package com.customdim.reference.access;

import com.customdim.core.error.CustomDimensionException;
import com.customdim.core.error.ErrorCode;
import com.customdim.service.core.access.AccessControl;
import org.springframework.stereotype.Component;

/** Access decisions from static grants in configuration. Admin access implies view access. */
@Component
public class ConfiguredAccessControl implements AccessControl {

    private final AccessProperties properties;

    public ConfiguredAccessControl(AccessProperties properties) {
        this.properties = properties;
    }

    @Override
    public void checkUserHasViewAccess(int siteId) {
        if (properties.isSuperUser()
                || properties.getViewSites().contains(siteId)
                || properties.getAdminSites().contains(siteId)) {
            return;
        }
        throw denied("view", "site " + siteId);
    }

    @Override
    public void checkUserHasAdminAccess(int siteId) {
        if (properties.isSuperUser() || properties.getAdminSites().contains(siteId)) {
            return;
        }
        throw denied("admin", "site " + siteId);
    }

    @Override
    public void checkUserHasSomeAdminAccess() {
        if (properties.isSuperUser() || !properties.getAdminSites().isEmpty()) {
            return;
        }
        throw denied("admin", "any site");
    }

    private static CustomDimensionException denied(String level, String target) {
        return new CustomDimensionException(
                ErrorCode.UNAUTHORIZED, null, "You need " + level + " access to " + target + " for this operation");
    }
}
