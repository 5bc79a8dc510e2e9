package com.sleuth.path;

public sealed interface PathStep {
    record Member(String name) implements PathStep {}

    record Wildcard() implements PathStep {}

    /** Selects one array element. Negative positions count back from the end of the array. */
    record Index(int index) implements PathStep {}

    /** Keeps the array elements (or object member values) that satisfy {@code predicate}. */
    record Filter(FilterPredicate predicate) implements PathStep {}
}
