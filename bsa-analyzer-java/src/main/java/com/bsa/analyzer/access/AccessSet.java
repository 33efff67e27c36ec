package com.bsa.analyzer.access;

import java.util.Collections;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Variables read and written by one block. Names are plain identifiers or composite names
 * such as {@code s.x}, {@code m[k]} and {@code m[k1][k2]}. Sorted for stable output.
 */
public record AccessSet(SortedSet<String> reads, SortedSet<String> writes) {

    public AccessSet {
        reads = Collections.unmodifiableSortedSet(new TreeSet<>(reads));
        writes = Collections.unmodifiableSortedSet(new TreeSet<>(writes));
    }

    public static AccessSet empty() {
        return new AccessSet(new TreeSet<>(), new TreeSet<>());
    }

    public static AccessSet of(Set<String> reads, Set<String> writes) {
        return new AccessSet(clean(reads), clean(writes));
    }

    public AccessSet union(AccessSet other) {
        TreeSet<String> r = new TreeSet<>(reads);
        r.addAll(other.reads);
        TreeSet<String> w = new TreeSet<>(writes);
        w.addAll(other.writes);
        return of(r, w);
    }

    /** Drops empty names and call-shaped artifacts such as {@code address(0)}. */
    static SortedSet<String> clean(Set<String> names) {
        TreeSet<String> out = new TreeSet<>();
        for (String name : names) {
            if (name == null || name.isEmpty()) continue;
            if (name.contains("call[") || name.contains("call(") || name.contains(")")) continue;
            out.add(name);
        }
        return out;
    }
}
