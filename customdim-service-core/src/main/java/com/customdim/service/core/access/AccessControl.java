package com.customdim.service.core.access;

/**
 * Answers whether the current caller may use an operation. Implementations throw a
 * {@code CustomDimensionException} with {@code UNAUTHORIZED} when access is missing.
 */
public interface AccessControl {

    void checkUserHasViewAccess(int siteId);

    void checkUserHasAdminAccess(int siteId);

    /** Admin access to at least one site. */
    void checkUserHasSomeAdminAccess();
}
