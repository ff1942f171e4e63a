package com.zeus.people.eventstore;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Uniqueness claims acquired and released in the same transaction as an append.
 *
 * <p>A claim key is held by at most one aggregate. Acquiring a key the aggregate already holds is a
 * no-op; acquiring a key held by another aggregate fails the append. Releasing only removes keys
 * held by the appending aggregate.
 */
public record ClaimSet(Set<String> acquire, Set<String> release) {

    private static final ClaimSet NONE = new ClaimSet(Set.of(), Set.of());

    public ClaimSet {
        acquire = Set.copyOf(acquire);
        release = Set.copyOf(release);
    }

    public static ClaimSet none() {
        return NONE;
    }

    public static ClaimSet acquiring(String... keys) {
        return new ClaimSet(Set.of(keys), Set.of());
    }

    public static ClaimSet releasing(String... keys) {
        return new ClaimSet(Set.of(), Set.of(keys));
    }

    public ClaimSet and(ClaimSet other) {
        var acquired = new LinkedHashSet<>(acquire);
        acquired.addAll(other.acquire);
        var released = new LinkedHashSet<>(release);
        released.addAll(other.release);
        return new ClaimSet(acquired, released);
    }

    public boolean isEmpty() {
        return acquire.isEmpty() && release.isEmpty();
    }
}
