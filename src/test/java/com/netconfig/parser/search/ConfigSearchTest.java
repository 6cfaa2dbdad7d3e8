package com.netconfig.parser.search;

import com.netconfig.parser.address.IpAddress;
import com.netconfig.parser.address.IpNetwork;
import com.netconfig.parser.exception.InvalidQueryException;
import com.netconfig.parser.model.ConfigLine;
import com.netconfig.parser.model.ParseMode;
import com.netconfig.parser.parser.ConfigTreeBuilder;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.*;

class ConfigSearchTest {

    private static final String L2VPN_CONFIG = """
            l2vpn
             bridge group FOOBR
              bridge-domain FOOBR-100
               interface GigabitEthernet0/0/0/1.100
              bridge-domain FOOBR-200
               interface GigabitEthernet0/0/0/1.200
             bridge group OTHER
              bridge-domain OTHER-300
            interface BVI100
             description FOOBR
            !""";

    private static final String INTERFACE_CONFIG = """
            interface GigabitEthernet0/0/0/0
             ipv4 address 192.0.2.1 255.255.255.252
            !
            interface GigabitEthernet0/0/0/1
             ipv4 address 198.51.100.1 255.255.255.0
            !""";

    private List<ConfigLine> p;

    @BeforeEach
    void setUp() {
        p = parse(L2VPN_CONFIG);
    }

    private static List<ConfigLine> parse(String config) {
        return new ConfigTreeBuilder().build(config.lines().toList(), ParseMode.INDENTATION);
    }

    @Test
    void testSingleRegexReturnsMatchesOnly() {
        assertThat(ConfigSearch.find(p, "FOOBR")).contains(List.of(p.get(1), p.get(2), p.get(4), p.get(9)));
    }

    @Test
    void testChainedSearchWithSuppressedAncestors() {
        SearchOptions options = SearchOptions.builder().includeAncestors(true).build();

        Optional<List<ConfigLine>> result = ConfigSearch.find(p, List.of("l2vpn", "FOOBR"), options);

        assertThat(result).contains(List.of(p.get(0), p.get(1), p.get(2), p.get(4)));
        List<ConfigLine> lines = result.orElseThrow();
        for (int i = 1; i < lines.size(); i++) {
            assertThat(lines.get(i)).isNotSameAs(lines.get(i - 1));
        }
    }

    @Test
    void testChainedSearchWithoutSuppression() {
        SearchOptions options = SearchOptions.builder()
                .includeAncestors(true)
                .suppressCommonAncestors(false)
                .build();

        assertThat(ConfigSearch.find(p, List.of("l2vpn", "FOOBR"), options)).contains(List.of(
                p.get(0), p.get(1),
                p.get(0), p.get(1), p.get(2),
                p.get(0), p.get(1), p.get(4)));
    }

    @Test
    void testSuppressionOnlyDropsLinesSharedWithPreviousMatch() {
        SearchOptions options = SearchOptions.builder().includeAncestors(true).build();

        assertThat(ConfigSearch.find(p, "bridge-domain|description", options)).contains(List.of(
                p.get(0), p.get(1), p.get(2),
                p.get(4),
                p.get(6), p.get(7),
                p.get(8), p.get(9)));
    }

    @Test
    void testChainTermOutsideEarlierMatchesFindsNothing() {
        assertThat(ConfigSearch.find(p, List.of("l2vpn", "BVI"))).isEmpty();
        assertThat(ConfigSearch.find(p, List.of("no-such-section", "FOOBR"))).isEmpty();
        assertThat(ConfigSearch.find(p, "no-such-line")).isEmpty();
    }

    @Test
    void testShallowChainOnlyLooksAtChildren() {
        SearchOptions shallow = SearchOptions.builder().recurseSearch(false).build();

        assertThat(ConfigSearch.find(p, List.of("l2vpn", "FOOBR-100"), shallow)).isEmpty();
        assertThat(ConfigSearch.find(p, List.of("l2vpn", "FOOBR-100"))).contains(List.of(p.get(2)));
        assertThat(ConfigSearch.find(p, List.of("l2vpn", "bridge group"), shallow))
                .contains(List.of(p.get(1), p.get(6)));
    }

    @Test
    void testPatternAndPredicateTerms() {
        Predicate<ConfigLine> deep = line -> line.getGeneration() == 4;

        assertThat(ConfigSearch.find(p, Pattern.compile("^interface"))).contains(List.of(p.get(8)));
        assertThat(ConfigSearch.find(p, deep)).contains(List.of(p.get(3), p.get(5)));
        assertThat(ConfigSearch.find(p, List.of(Pattern.compile("OTHER"), deep))).isEmpty();
    }

    @Test
    void testInvalidSpecsAreRejected() {
        assertThatThrownBy(() -> ConfigSearch.find(p, 42)).isInstanceOf(InvalidQueryException.class);
        assertThatThrownBy(() -> ConfigSearch.find(p, List.of())).isInstanceOf(InvalidQueryException.class);
        assertThatThrownBy(() -> ConfigSearch.find(p, "bridge (group"))
                .isInstanceOf(InvalidQueryException.class)
                .hasMessageContaining("bridge (group");
    }

    @Test
    void testIncludeChildren() {
        SearchOptions options = SearchOptions.builder().includeChildren(true).build();

        assertThat(ConfigSearch.find(p, "^ bridge group", options))
                .contains(List.of(p.get(1), p.get(2), p.get(4), p.get(6), p.get(7)));
    }

    @Test
    void testExcludeSelfKeepsOnlyRelatives() {
        SearchOptions options = SearchOptions.builder()
                .includeAncestors(true)
                .includeSelf(false)
                .suppressCommonAncestors(false)
                .build();

        assertThat(ConfigSearch.find(p, "OTHER-300", options)).contains(List.of(p.get(0), p.get(6)));
        assertThat(ConfigSearch.findGrouped(p, "^ bridge group", SearchOptions.builder()
                .includeChildren(true)
                .includeSelf(false)
                .build()))
                .contains(List.of(List.of(p.get(2), p.get(4)), List.of(p.get(7))));
    }

    @Test
    void testIncludeAllDescendants() {
        SearchOptions options = SearchOptions.builder().includeAllDescendants(true).build();

        assertThat(ConfigSearch.find(p, "bridge group OTHER", options)).contains(List.of(p.get(6), p.get(7)));
    }

    @Test
    void testCousinDepthExpandsFromAncestor() {
        SearchOptions options = SearchOptions.builder().cousinDepth(2).build();

        assertThat(ConfigSearch.find(p, "GigabitEthernet0/0/0/1\\.100", options))
                .contains(p.subList(1, 6));
    }

    @Test
    void testCousinUntilExpandsFromMatchingAncestor() {
        SearchOptions options = SearchOptions.builder()
                .includeAncestors(true)
                .cousinUntil(line -> line.startsWith(" bridge group"))
                .build();

        assertThat(ConfigSearch.find(p, "OTHER-300", options)).contains(List.of(p.get(0), p.get(6), p.get(7)));
    }

    @Test
    void testGroupedResultsKeepEveryFamily() {
        SearchOptions options = SearchOptions.builder().includeAncestors(true).build();

        assertThat(ConfigSearch.findGrouped(p, List.of("l2vpn", "FOOBR"), options)).contains(List.of(
                List.of(p.get(0), p.get(1)),
                List.of(p.get(0), p.get(1), p.get(2)),
                List.of(p.get(0), p.get(1), p.get(4))));
    }

    @Test
    void testGroupedResultsWithoutFamily() {
        assertThat(ConfigSearch.findGrouped(p, "OTHER", SearchOptions.DEFAULTS))
                .contains(List.of(List.of(p.get(6)), List.of(p.get(7))));
        assertThat(ConfigSearch.findGrouped(p, "missing", SearchOptions.DEFAULTS)).isEmpty();
    }

    @Test
    void testConvertersDistinguishMatchesFromFamily() {
        SearchOptions options = SearchOptions.builder().includeAncestors(true).build();

        Optional<List<String>> result = ConfigSearch.find(p, "FOOBR-\\d+", options,
                line -> "> " + line.getTrimmedText(), ConfigLine::getTrimmedText);

        assertThat(result).contains(List.of(
                "l2vpn",
                "bridge group FOOBR",
                "> bridge-domain FOOBR-100",
                "> bridge-domain FOOBR-200"));
    }

    @Test
    void testFindObjects() {
        assertThat(ConfigSearch.findObjects(p, "^interface")).containsExactly(p.get(8));
        assertThat(ConfigSearch.findObjects(p, "missing")).isEmpty();
    }

    @Test
    void testFindParentsWithChild() {
        assertThat(ConfigSearch.findParents(p, "bridge group", "interface")).containsExactly(p.get(1));
        assertThat(ConfigSearch.findParents(p, "bridge-domain", "interface", false, false))
                .containsExactly(p.get(2), p.get(4));
        assertThat(ConfigSearch.findParents(p, "bridge group", "interface", false, false)).isEmpty();
    }

    @Test
    void testFindParentsWithoutChild() {
        assertThat(ConfigSearch.findParentsWithoutChild(p, "bridge group", "interface", true))
                .containsExactly(p.get(6));
        assertThat(ConfigSearch.findParents(p, "^interface", "shutdown", true, true)).containsExactly(p.get(8));
    }

    @Test
    void testFindParentsWithPairCollection() {
        assertThat(ConfigSearch.findParents(p, List.of("bridge group", "interface"), null))
                .containsExactly(p.get(1));
    }

    @Test
    void testAmbiguousParentChildPairsAreRejected() {
        assertThatThrownBy(() -> ConfigSearch.findParents(p, List.of("a", "b"), "c"))
                .isInstanceOf(InvalidQueryException.class);
        assertThatThrownBy(() -> ConfigSearch.findParents(p, List.of("a", "b", "c"), null))
                .isInstanceOf(InvalidQueryException.class)
                .hasMessageContaining("exactly 2");
        assertThatThrownBy(() -> ConfigSearch.findParents(p, "a", null))
                .isInstanceOf(InvalidQueryException.class);
        assertThatThrownBy(() -> ConfigSearch.findChildren(p, "a", List.of("b"), true))
                .isInstanceOf(InvalidQueryException.class);
    }

    @Test
    void testFindChildren() {
        assertThat(ConfigSearch.findChildren(p, "bridge group FOOBR", "interface", true))
                .containsExactly(p.get(3), p.get(5));
        assertThat(ConfigSearch.findChildren(p, "bridge group FOOBR", "interface", false)).isEmpty();
        assertThat(ConfigSearch.findChildren(p, List.of("^interface", "description"), null, false))
                .containsExactly(p.get(9));
    }

    @Test
    void testAddressPredicates() {
        List<ConfigLine> lines = parse(INTERFACE_CONFIG);
        Predicate<ConfigLine> inFirstSubnet = LinePredicates.hasAddress(IpAddress.parse("192.0.2.2"));

        assertThat(ConfigSearch.findParents(lines, "^interface", inFirstSubnet)).containsExactly(lines.get(0));
        assertThat(ConfigSearch.find(lines, List.of("^interface", inFirstSubnet),
                SearchOptions.builder().includeAncestors(true).build()))
                .contains(List.of(lines.get(0), lines.get(1)));
        assertThat(ConfigSearch.find(lines, LinePredicates.hasAddress(IpNetwork.parse("198.51.100.0/25"))))
                .contains(List.of(lines.get(4)));
    }

    @Test
    void testAddressPredicateRejectsUnsupportedQuery() {
        assertThatThrownBy(() -> LinePredicates.hasAddress("192.0.2.1"))
                .isInstanceOf(InvalidQueryException.class);
    }
}
