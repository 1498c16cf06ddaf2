package com.isweep.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.isweep.core.model.Preferences;
import com.isweep.core.model.UserAccount;

public record UserResponse(
    @JsonProperty("user_id") long userId,
    String username,
    Preferences preferences
) {
    static UserResponse from(UserAccount account) {
        return new UserResponse(account.userId(), account.username(), account.preferences());
    }
}
