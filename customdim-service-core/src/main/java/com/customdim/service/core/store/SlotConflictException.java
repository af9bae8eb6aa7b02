package com.customdim.service.core.store;

import com.customdim.core.model.Scope;

/**
 * Raised by the store when the (siteId, scope, index) slot was taken between allocation and
 * insert. Nothing was written; the caller may allocate again.
 */
public class SlotConflictException extends RuntimeException {

    private final int siteId;
    private final Scope scope;
    private final int index;

    public SlotConflictException(int siteId, Scope scope, int index, Throwable cause) {
        super("Slot " + index + " of scope " + scope + " is already taken for site " + siteId, cause);
        this.siteId = siteId;
        this.scope = scope;
        this.index = index;
    }

    public int getSiteId() {
        return siteId;
    }

    public Scope getScope() {
        return scope;
    }

    public int getIndex() {
        return index;
    }
}
