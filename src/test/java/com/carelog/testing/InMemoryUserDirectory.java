package com.carelog.testing;

import java.util.HashMap;
import java.util.Map;

import com.carelog.core.model.UserProfile;
import com.carelog.core.store.UserDirectory;

import reactor.core.publisher.Mono;

public class InMemoryUserDirectory implements UserDirectory {

    private final Map<String, UserProfile> users = new HashMap<>();

    public InMemoryUserDirectory add(String userId, String name, String language) {
        users.put(userId, new UserProfile(userId, name, language));
        return this;
    }

    @Override
    public Mono<UserProfile> findProfile(String userId) {
        return Mono.justOrEmpty(users.get(userId));
    }
}
