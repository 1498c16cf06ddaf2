package com.isweep.core.model;

import java.time.Instant;

/**
 * A registered user together with the preferences it currently owns.
 */
public record UserAccount(
    long userId,
    String username,
    Instant createdAt,
    Preferences preferences
) {}
