package com.hivemind.core.model;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Normalises caller-supplied tag, module and trait collections: nulls dropped, copies immutable.
 */
final class Labels {

    private Labels() {}

    /** Sorted so the persisted and serialised form does not depend on hash order. */
    static Set<String> sortedSet(Collection<String> values) {
        if (values == null || values.isEmpty()) {
            return Set.of();
        }
        return Collections.unmodifiableSortedSet(values.stream()
                .filter(Objects::nonNull)
                .collect(Collectors.toCollection(TreeSet::new)));
    }

    static List<String> list(List<String> values) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        return values.stream().filter(Objects::nonNull).toList();
    }
}
