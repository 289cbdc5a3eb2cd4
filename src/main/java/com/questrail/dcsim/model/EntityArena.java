package com.questrail.dcsim.model;

import com.questrail.dcsim.kernel.InvariantViolation;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * EntityArena
 * -----------------------------------------------------------------------------
 * Flat table of one entity kind, keyed by id.
 *
 * <h2>Role in the architecture</h2>
 * Entities never hold references to each other; relations (VM to host, workload
 * to VM, replica to deployment) are id fields resolved through an arena. Entity
 * values are immutable, so a handler computes the next value first and only
 * then commits it with {@link #put(Entity)}. A handler that fails halfway
 * leaves the arena untouched.
 *
 * <p>
 * Iteration follows insertion order, which keeps every scan (allocation
 * candidates, retry order, reports) deterministic. Entities are never removed
 * during a run; terminal entities stay queryable.
 * </p>
 */
public final class EntityArena<E extends Entity>
{
    private final String kind;
    private final Map<String, E> entities = new LinkedHashMap<>();

    public EntityArena(String kind) {
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public String kind() {
        return kind;
    }

    public Optional<E> find(String id) {
        return Optional.ofNullable(entities.get(id));
    }

    /**
     * Returns the entity with the given id.
     *
     * @throws InvariantViolation if no such entity exists
     */
    public E require(String id) {
        E entity = entities.get(id);
        if (entity == null) {
            throw new InvariantViolation("unknown " + kind + ": " + id);
        }
        return entity;
    }

    public boolean contains(String id) {
        return entities.containsKey(id);
    }

    /**
     * Adds a new entity.
     *
     * @throws InvariantViolation if the id is already taken
     */
    public E create(E entity) {
        Objects.requireNonNull(entity, "entity");
        if (entities.containsKey(entity.id())) {
            throw new InvariantViolation("duplicate " + kind + ": " + entity.id());
        }
        entities.put(entity.id(), entity);
        return entity;
    }

    /**
     * Commits the next value of an existing entity.
     *
     * @throws InvariantViolation if the entity does not exist
     */
    public E put(E entity) {
        Objects.requireNonNull(entity, "entity");
        if (!entities.containsKey(entity.id())) {
            throw new InvariantViolation("unknown " + kind + ": " + entity.id());
        }
        entities.put(entity.id(), entity);
        return entity;
    }

    public Collection<E> values() {
        return Collections.unmodifiableCollection(entities.values());
    }

    public List<E> where(Predicate<? super E> filter) {
        return entities.values().stream().filter(filter).collect(Collectors.toList());
    }

    public int size() {
        return entities.size();
    }
}
