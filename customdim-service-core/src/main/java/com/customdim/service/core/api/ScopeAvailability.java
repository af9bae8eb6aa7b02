package com.customdim.service.core.api;

/** Slot usage of one scope for a site. Used slots include deactivated dimensions. */
public record ScopeAvailability(String name, int numSlotsAvailable, int numSlotsUsed, int numSlotsLeft) {}
