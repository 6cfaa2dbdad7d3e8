package com.netconfig.parser.model;

import java.util.function.Predicate;

import lombok.Builder;
import lombok.Value;

/**
 * Options for {@link ConfigLine#family(FamilyOptions)}.
 *
 * {@code includeAllDescendants} supersedes {@code includeChildren}. Setting
 * {@code cousinDepth} or {@code cousinUntil} moves the subject up the tree
 * first and always includes every descendant of the new subject.
 */
@Value
@Builder(toBuilder = true)
public class FamilyOptions {

    public static final FamilyOptions DEFAULTS = FamilyOptions.builder().build();

    @Builder.Default
    boolean includeAncestors = true;

    @Builder.Default
    boolean includeSelf = true;

    @Builder.Default
    boolean includeChildren = true;

    @Builder.Default
    boolean includeAllDescendants = true;

    /** Number of parents to climb before expanding; must be zero or more. */
    Integer cousinDepth;

    /** Climb until this matches; reaching a root without a match is an error. */
    Predicate<ConfigLine> cousinUntil;

    /**
     * True if the subject is replaced by an ancestor, which also forces all descendants.
     */
    public boolean hasCousinOption() {
        return cousinDepth != null || cousinUntil != null;
    }
}
