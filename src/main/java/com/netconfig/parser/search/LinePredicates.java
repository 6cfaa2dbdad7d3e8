package com.netconfig.parser.search;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import com.netconfig.parser.address.IpAddress;
import com.netconfig.parser.address.IpInterface;
import com.netconfig.parser.address.IpNetwork;
import com.netconfig.parser.exception.InvalidQueryException;
import com.netconfig.parser.model.ConfigLine;

import lombok.experimental.UtilityClass;

/**
 * Factories for line predicates and conversion of loose search specs into predicate chains.
 */
@UtilityClass
public class LinePredicates {

    /**
     * Matches lines whose text contains a match for the regular expression.
     */
    public static Predicate<ConfigLine> regex(String regex) {
        try {
            return regex(Pattern.compile(regex));
        } catch (PatternSyntaxException e) {
            throw new InvalidQueryException("Invalid regular expression: " + regex, e);
        }
    }

    public static Predicate<ConfigLine> regex(Pattern pattern) {
        return line -> line.matches(pattern);
    }

    /**
     * Matches lines carrying the given address, network or interface.
     *
     * @throws InvalidQueryException immediately if the query is of any other kind
     */
    public static Predicate<ConfigLine> hasAddress(Object query) {
        if (!(query instanceof IpAddress || query instanceof IpNetwork || query instanceof IpInterface)) {
            throw new InvalidQueryException("Unsupported address query type: "
                    + (query == null ? "null" : query.getClass().getName()));
        }
        return line -> line.hasAddress(query);
    }

    /**
     * Convert one search term: a {@link Predicate}, a regex {@link String} or a {@link Pattern}.
     */
    @SuppressWarnings("unchecked")
    public static Predicate<ConfigLine> term(Object term) {
        if (term instanceof Predicate<?> predicate) {
            return (Predicate<ConfigLine>) predicate;
        }
        if (term instanceof String regex) {
            return regex(regex);
        }
        if (term instanceof Pattern pattern) {
            return regex(pattern);
        }
        throw new InvalidQueryException("Unsupported search term: "
                + (term == null ? "null" : term.getClass().getName())
                + "; expected Predicate, String or Pattern");
    }

    /**
     * Convert a spec into an ordered chain: a single term yields a chain of one, an
     * {@link Iterable} of terms yields one predicate per element.
     *
     * @throws InvalidQueryException for an empty chain or an unsupported term
     */
    public static List<Predicate<ConfigLine>> chain(Object spec) {
        if (!(spec instanceof Iterable<?> terms)) {
            return List.of(term(spec));
        }
        List<Predicate<ConfigLine>> chain = new ArrayList<>();
        for (Object element : terms) {
            chain.add(term(element));
        }
        if (chain.isEmpty()) {
            throw new InvalidQueryException("Search chain must contain at least one term");
        }
        return chain;
    }

    /**
     * Resolve a parent/child pair given either as two arguments or as one two-element collection.
     *
     * @throws InvalidQueryException if both forms are used at once, the collection does not hold
     *                               exactly two terms, or no child term is given
     */
    static List<Predicate<ConfigLine>> parentChildPair(Object parentSpec, Object childSpec) {
        if (parentSpec instanceof Iterable<?> pair) {
            if (childSpec != null) {
                throw new InvalidQueryException("parentSpec is iterable and childSpec is set; supply one or the other");
            }
            List<Object> terms = new ArrayList<>();
            pair.forEach(terms::add);
            if (terms.size() != 2) {
                throw new InvalidQueryException("An iterable parentSpec must hold exactly 2 terms, got " + terms.size());
            }
            return List.of(term(terms.get(0)), term(terms.get(1)));
        }
        if (childSpec == null) {
            throw new InvalidQueryException("childSpec is required when parentSpec is a single term");
        }
        if (childSpec instanceof Collection<?>) {
            throw new InvalidQueryException("childSpec must be a single term");
        }
        return List.of(term(parentSpec), term(childSpec));
    }
}
