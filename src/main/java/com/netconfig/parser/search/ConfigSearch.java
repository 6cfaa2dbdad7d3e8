package com.netconfig.parser.search;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.netconfig.parser.exception.InvalidQueryException;
import com.netconfig.parser.model.ConfigLine;
import com.netconfig.parser.model.FamilyOptions;

/**
 * Searches parsed configuration lines.
 *
 * A search spec is a {@link Predicate} over lines, a regular expression ({@link String} or
 * {@link java.util.regex.Pattern}, matched anywhere in the line) or an {@link Iterable} of those.
 * An iterable is a chain: each term is looked for among the descendants of the previous
 * term's matches, so {@code List.of("^router bgp", "neighbor 192.0.2.1")} finds that neighbour
 * only inside BGP configuration.
 *
 * Every search returns {@link Optional#empty()} when some term of the chain matched nothing;
 * this is distinct from a successful search.
 */
public final class ConfigSearch {
    private static final Logger log = LoggerFactory.getLogger(ConfigSearch.class);

    private ConfigSearch() {
        // Utility class
    }

    public static Optional<List<ConfigLine>> find(List<ConfigLine> lines, Object spec) {
        return find(lines, spec, SearchOptions.DEFAULTS);
    }

    /**
     * Find matching lines, expanded to their families as the options request, flattened into
     * one list in match order.
     *
     * @throws InvalidQueryException if the spec or the family options are invalid
     */
    public static Optional<List<ConfigLine>> find(List<ConfigLine> lines, Object spec, SearchOptions options) {
        return find(lines, spec, options, Function.identity(), Function.identity());
    }

    /**
     * Like {@link #find(List, Object, SearchOptions)}, converting every matched line with
     * {@code matchConverter} and every other family member with {@code familyConverter}.
     */
    public static <T> Optional<List<T>> find(List<ConfigLine> lines, Object spec, SearchOptions options,
                                             Function<ConfigLine, T> matchConverter,
                                             Function<ConfigLine, T> familyConverter) {
        Optional<List<ConfigLine>> found = matches(lines, spec, options.isRecurseSearch());
        if (found.isEmpty()) {
            return Optional.empty();
        }
        List<ConfigLine> matches = found.get();
        if (!options.expandsFamily()) {
            return Optional.of(matches.stream().map(matchConverter).collect(Collectors.toList()));
        }

        Set<ConfigLine> matched = identitySet(matches);
        FamilyOptions familyOptions = options.toFamilyOptions();
        CommonLineSuppressor suppressor = options.isSuppressCommonAncestors() ? new CommonLineSuppressor() : null;

        List<T> result = new ArrayList<>();
        for (ConfigLine match : matches) {
            List<ConfigLine> family = match.family(familyOptions);
            if (suppressor != null) {
                family = suppressor.suppress(family);
            }
            for (ConfigLine member : family) {
                result.add(matched.contains(member) ? matchConverter.apply(member) : familyConverter.apply(member));
            }
        }
        return Optional.of(result);
    }

    public static Optional<List<List<ConfigLine>>> findGrouped(List<ConfigLine> lines, Object spec,
                                                               SearchOptions options) {
        return findGrouped(lines, spec, options, Function.identity(), Function.identity());
    }

    /**
     * Like {@link #find}, but one inner list per match. Common ancestors are never suppressed.
     */
    public static <T> Optional<List<List<T>>> findGrouped(List<ConfigLine> lines, Object spec, SearchOptions options,
                                                          Function<ConfigLine, T> matchConverter,
                                                          Function<ConfigLine, T> familyConverter) {
        Optional<List<ConfigLine>> found = matches(lines, spec, options.isRecurseSearch());
        if (found.isEmpty()) {
            return Optional.empty();
        }
        List<ConfigLine> matches = found.get();
        Set<ConfigLine> matched = identitySet(matches);
        FamilyOptions familyOptions = options.toFamilyOptions();

        List<List<T>> groups = new ArrayList<>();
        for (ConfigLine match : matches) {
            List<ConfigLine> family = options.expandsFamily() ? match.family(familyOptions) : List.of(match);
            groups.add(family.stream()
                    .map(member -> matched.contains(member) ? matchConverter.apply(member) : familyConverter.apply(member))
                    .collect(Collectors.toList()));
        }
        return Optional.of(groups);
    }

    /**
     * Lines matching a regex or regex chain; empty when nothing matches.
     */
    public static List<ConfigLine> findObjects(List<ConfigLine> lines, Object regexSpec) {
        return find(lines, regexSpec).orElse(List.of());
    }

    public static List<ConfigLine> findParents(List<ConfigLine> lines, Object parentSpec, Object childSpec) {
        return findParents(lines, parentSpec, childSpec, true, false);
    }

    /**
     * Lines matching {@code parentSpec} that have at least one descendant (or, with
     * {@code recurse == false}, child) matching {@code childSpec}. With {@code negate} the
     * parent must have no such descendant. Only the parent lines are returned.
     *
     * {@code parentSpec} may instead be a two-element collection holding both terms, in which
     * case {@code childSpec} must be {@code null}.
     */
    public static List<ConfigLine> findParents(List<ConfigLine> lines, Object parentSpec, Object childSpec,
                                               boolean recurse, boolean negate) {
        List<Predicate<ConfigLine>> pair = LinePredicates.parentChildPair(parentSpec, childSpec);
        Predicate<ConfigLine> parentMatch = pair.get(0);
        Predicate<ConfigLine> childMatch = pair.get(1);

        Predicate<ConfigLine> search = line -> {
            if (!parentMatch.test(line)) {
                return false;
            }
            List<ConfigLine> candidates = recurse ? line.getDescendants() : line.getChildren();
            boolean hasMatchingChild = candidates.stream().anyMatch(childMatch);
            return negate != hasMatchingChild;
        };
        return find(lines, search, SearchOptions.builder().recurseSearch(recurse).build()).orElse(List.of());
    }

    public static List<ConfigLine> findParentsWithoutChild(List<ConfigLine> lines, Object parentSpec, Object childSpec,
                                                           boolean recurse) {
        return findParents(lines, parentSpec, childSpec, recurse, true);
    }

    /**
     * Lines matching {@code childSpec} below a line matching {@code parentSpec}. Only the
     * child lines are returned.
     */
    public static List<ConfigLine> findChildren(List<ConfigLine> lines, Object parentSpec, Object childSpec,
                                                boolean recurse) {
        List<Predicate<ConfigLine>> pair = LinePredicates.parentChildPair(parentSpec, childSpec);
        SearchOptions options = SearchOptions.builder()
                .recurseSearch(recurse)
                .includeAncestors(false)
                .includeChildren(false)
                .build();
        return find(lines, pair, options).orElse(List.of());
    }

    /**
     * Run the chain and return the final term's matches, or empty if any term matched nothing.
     */
    private static Optional<List<ConfigLine>> matches(List<ConfigLine> lines, Object spec, boolean recurse) {
        List<Predicate<ConfigLine>> chain = LinePredicates.chain(spec);
        List<ConfigLine> candidates = lines;
        for (int i = 0; i < chain.size() - 1; i++) {
            List<ConfigLine> stage = filter(candidates, chain.get(i));
            log.debug("Search term {} matched {} of {} lines", i, stage.size(), candidates.size());
            if (stage.isEmpty()) {
                return Optional.empty();
            }
            candidates = expand(stage, recurse);
        }
        List<ConfigLine> matches = filter(candidates, chain.get(chain.size() - 1));
        log.debug("Final search term matched {} of {} lines", matches.size(), candidates.size());
        return matches.isEmpty() ? Optional.empty() : Optional.of(matches);
    }

    private static List<ConfigLine> filter(List<ConfigLine> lines, Predicate<ConfigLine> predicate) {
        return lines.stream().filter(predicate).collect(Collectors.toList());
    }

    // Descendants (or children) of every match, each line once, in document order.
    private static List<ConfigLine> expand(List<ConfigLine> matches, boolean recurse) {
        Set<ConfigLine> expanded = new LinkedHashSet<>();
        for (ConfigLine match : matches) {
            expanded.addAll(recurse ? match.getDescendants() : match.getChildren());
        }
        List<ConfigLine> ordered = new ArrayList<>(expanded);
        ordered.sort(Comparator.comparingInt(ConfigLine::getLineNumber));
        return ordered;
    }

    private static Set<ConfigLine> identitySet(List<ConfigLine> lines) {
        Set<ConfigLine> set = Collections.newSetFromMap(new IdentityHashMap<>());
        set.addAll(lines);
        return set;
    }
}
