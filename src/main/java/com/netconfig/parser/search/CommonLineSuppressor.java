package com.netconfig.parser.search;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import com.netconfig.parser.model.ConfigLine;

/**
 * Removes lines shared with the immediately preceding family list.
 *
 * When several neighbours under {@code router bgp 65536 / vrf EXAMPLE} match, their
 * ancestors are emitted once instead of once per match:
 * <pre>
 * router bgp 65536
 *  vrf EXAMPLE
 *   neighbor 192.0.2.1
 *   neighbor 192.0.2.2     (no repeated "router bgp" / "vrf" lines before this one)
 * </pre>
 *
 * Only adjacency counts: a line is emitted again once an unrelated family has come in
 * between. One instance serves one search.
 */
public class CommonLineSuppressor {

    private Set<ConfigLine> previous = Set.of();

    public List<ConfigLine> suppress(List<ConfigLine> family) {
        Set<ConfigLine> seen = previous;
        List<ConfigLine> filtered = family.stream()
                .filter(line -> !seen.contains(line))
                .collect(Collectors.toList());
        previous = new HashSet<>(family);
        return filtered;
    }
}
