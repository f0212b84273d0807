package com.taxprep.fdg.scenario;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A named, ordered list of modifications against the base input. Immutable;
 * edits produce new instances.
 */
public record Scenario(String id, String name, String description, List<Modification> modifications,
        Instant createdAt, Instant modifiedAt) {

    public Scenario {
        if (id == null || id.isBlank())
            id = UUID.randomUUID().toString();
        if (name == null)
            name = "";
        modifications = modifications == null ? List.of() : List.copyOf(modifications);
        if (createdAt == null)
            createdAt = Instant.now();
        if (modifiedAt == null)
            modifiedAt = createdAt;
    }

    public static Scenario create(String name, String description) {
        return new Scenario(null, name, description, List.of(), null, null);
    }

    public Scenario withMetadata(String newName, String newDescription) {
        return new Scenario(id, newName, newDescription, modifications, createdAt, Instant.now());
    }

    public Scenario withModifications(List<Modification> newModifications) {
        return new Scenario(id, name, description, newModifications, createdAt, Instant.now());
    }

    public Scenario plus(Modification m) {
        List<Modification> list = new ArrayList<>(modifications);
        list.add(m);
        return withModifications(list);
    }

    /** Same content under a new id and name. */
    public Scenario copyAs(String newName) {
        Instant now = Instant.now();
        return new Scenario(null, newName, description, modifications, now, now);
    }
}
