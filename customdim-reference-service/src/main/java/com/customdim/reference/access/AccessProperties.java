package com.customdim.reference.access;

import java.util.HashSet;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/** Grants of the API principal this deployment serves. */
@Component
@ConfigurationProperties(prefix = "customdim.access")
public class AccessProperties {
    private boolean superUser = false;
    private Set<Integer> adminSites = new HashSet<>();
    private Set<Integer> viewSites = new HashSet<>();

    public boolean isSuperUser() {
        return superUser;
    }

    public void setSuperUser(boolean superUser) {
        this.superUser = superUser;
    }

    public Set<Integer> getAdminSites() {
        return adminSites;
    }

    public void setAdminSites(Set<Integer> adminSites) {
        this.adminSites = adminSites;
    }

    public Set<Integer> getViewSites() {
        return viewSites;
    }

    public void setViewSites(Set<Integer> viewSites) {
        this.viewSites = viewSites;
    }
}
