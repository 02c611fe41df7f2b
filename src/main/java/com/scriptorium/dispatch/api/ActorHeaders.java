package com.scriptorium.dispatch.api;

import com.scriptorium.core.model.Actor;

import java.util.UUID;

/**
 * Request headers carrying the caller identity set by the upstream authentication layer.
 */
final class ActorHeaders {

    static final String ID = "X-Actor-Id";
    static final String NAME = "X-Actor-Name";
    static final String EMAIL = "X-Actor-Email";

    private ActorHeaders() {
    }

    static Actor toActor(UUID id, String name, String email) {
        return new Actor(id, name, email);
    }
}
