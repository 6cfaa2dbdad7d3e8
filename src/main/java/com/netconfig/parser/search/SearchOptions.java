package com.netconfig.parser.search;

import java.util.function.Predicate;

import com.netconfig.parser.model.ConfigLine;
import com.netconfig.parser.model.FamilyOptions;

import lombok.Builder;
import lombok.Value;

/**
 * Options for {@link ConfigSearch#find}. By default only the matching lines are returned.
 */
@Value
@Builder(toBuilder = true)
public class SearchOptions {

    public static final SearchOptions DEFAULTS = SearchOptions.builder().build();

    /**
     * In a chained search, look for the next term among all descendants of each match
     * rather than only its immediate children.
     */
    @Builder.Default
    boolean recurseSearch = true;

    /**
     * Drop family members already emitted for the immediately preceding match.
     */
    @Builder.Default
    boolean suppressCommonAncestors = true;

    @Builder.Default
    boolean includeAncestors = false;

    /**
     * Keep the matched line itself in its expanded family. Has no effect unless another
     * family option is set.
     */
    @Builder.Default
    boolean includeSelf = true;

    @Builder.Default
    boolean includeChildren = false;

    @Builder.Default
    boolean includeAllDescendants = false;

    Integer cousinDepth;

    Predicate<ConfigLine> cousinUntil;

    /**
     * True if matches are expanded to a family rather than returned alone.
     */
    public boolean expandsFamily() {
        return includeAncestors || includeChildren || includeAllDescendants
                || cousinDepth != null || cousinUntil != null;
    }

    public FamilyOptions toFamilyOptions() {
        return FamilyOptions.builder()
                .includeAncestors(includeAncestors)
                .includeSelf(includeSelf)
                .includeChildren(includeChildren)
                .includeAllDescendants(includeAllDescendants)
                .cousinDepth(cousinDepth)
                .cousinUntil(cousinUntil)
                .build();
    }
}
