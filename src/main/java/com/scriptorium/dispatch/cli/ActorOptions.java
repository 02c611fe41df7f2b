package com.scriptorium.dispatch.cli;

import com.scriptorium.core.model.Actor;
import picocli.CommandLine.Option;

import java.util.UUID;

/**
 * Identity options shared by commands that act on behalf of a user.
 */
public class ActorOptions {

    @Option(names = "--actor", required = true, description = "Acting user id (UUID)")
    UUID actorId;

    @Option(names = "--actor-name", description = "Author name for commits")
    String actorName;

    @Option(names = "--actor-email", description = "Author email for commits")
    String actorEmail;

    public Actor toActor() {
        return new Actor(actorId, actorName, actorEmail);
    }
}
