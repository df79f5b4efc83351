package com.carelog.core.store;

import com.carelog.core.model.UserProfile;

import reactor.core.publisher.Mono;

/**
 * Read-only access to user attributes owned by another part of the system.
 */
public interface UserDirectory {

    /**
     * Emits empty when the user does not exist.
     */
    Mono<UserProfile> findProfile(String userId);
}
