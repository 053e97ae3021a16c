package io.plinth.core.plan;

import java.util.Objects;

/// Instance-level relationship, pointing at a concrete target node instance.
///
/// @param type relationship type, not null
/// @param targetId id of the target node instance, not null
/// @param targetName id of the target's node, may be null
public record RelationshipInstance(String type, String targetId, String targetName) {

    public RelationshipInstance {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(targetId, "targetId must not be null");
    }
}
