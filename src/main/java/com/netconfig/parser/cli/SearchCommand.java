package com.netconfig.parser.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.netconfig.parser.address.IpQueries;
import com.netconfig.parser.cli.output.SearchResultsPrinter;
import com.netconfig.parser.exception.InvalidQueryException;
import com.netconfig.parser.io.ConfigReader;
import com.netconfig.parser.model.ConfigDocument;
import com.netconfig.parser.model.ConfigLine;
import com.netconfig.parser.model.ParseMode;
import com.netconfig.parser.search.ConfigSearch;
import com.netconfig.parser.search.LinePredicates;
import com.netconfig.parser.search.SearchOptions;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * CLI command that parses a configuration file and prints the lines matching a search.
 */
@Command(
        name = "config-search",
        mixinStandardHelpOptions = true,
        version = "config-tree-parser 1.0.0",
        description = "Parses an indented or braced device configuration and prints lines matching a chained search."
)
public class SearchCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SearchCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", paramLabel = "FILE", description = "Configuration file to parse")
    private Path configFile;

    @Option(names = {"--regex", "-e"}, description = "Regular expression; repeat to search successive generations")
    private List<String> regexes = new ArrayList<>();

    @Option(names = {"--address"}, description = "Only match lines carrying this address or prefix (e.g. 192.0.2.1 or 192.0.2.0/30)")
    private String address;

    @Option(names = {"--mode"}, defaultValue = "AUTO", description = "Parse mode: AUTO, INDENTATION or BRACED")
    private ParseMode mode;

    @Option(names = {"--ancestors", "-a"}, description = "Include the ancestors of each match")
    private boolean ancestors;

    @Option(names = {"--children", "-c"}, description = "Include the immediate children of each match")
    private boolean children;

    @Option(names = {"--descendants", "-d"}, description = "Include all descendants of each match")
    private boolean descendants;

    @Option(names = {"--cousin-depth"}, description = "Climb this many parents and print the whole subtree")
    private Integer cousinDepth;

    @Option(names = {"--no-suppress"}, description = "Repeat common ancestors for every match")
    private boolean noSuppress;

    @Option(names = {"--shallow"}, description = "Search only immediate children for each following regex")
    private boolean shallow;

    @Option(names = {"--line-numbers", "-n"}, description = "Prefix every printed line with its line number")
    private boolean lineNumbers;

    @Override
    public Integer call() {
        if (regexes.isEmpty() && address == null) {
            log.error("At least one --regex or --address must be provided");
            return 1;
        }
        if (!Files.isRegularFile(configFile)) {
            log.error("Configuration file does not exist or is not a file: {}", configFile);
            return 1;
        }

        try {
            ConfigDocument document = new ConfigReader().read(configFile, mode);
            log.debug("Parsed {} as {} with {} warning(s)", configFile, document.getMode(),
                    document.getDiagnostics().getWarnings().size());

            Optional<List<ConfigLine>> result = ConfigSearch.find(document.getLines(), buildChain(), buildOptions());
            new SearchResultsPrinter(spec.commandLine().getOut(), lineNumbers).print(result.orElse(List.of()));

            if (result.isEmpty()) {
                log.info("No lines matched");
                return 1;
            }
            return 0;
        } catch (IOException e) {
            log.error("Failed to read {}: {}", configFile, e.getMessage());
            return 1;
        } catch (InvalidQueryException e) {
            log.error("Invalid search: {}", e.getMessage());
            return 1;
        }
    }

    private List<Predicate<ConfigLine>> buildChain() {
        List<Predicate<ConfigLine>> chain = new ArrayList<>();
        for (String regex : regexes) {
            chain.add(LinePredicates.regex(regex));
        }
        if (address != null) {
            Predicate<ConfigLine> addressMatch = LinePredicates.hasAddress(IpQueries.parse(address));
            if (chain.isEmpty()) {
                chain.add(addressMatch);
            } else {
                int last = chain.size() - 1;
                chain.set(last, chain.get(last).and(addressMatch));
            }
        }
        return chain;
    }

    private SearchOptions buildOptions() {
        return SearchOptions.builder()
                .recurseSearch(!shallow)
                .suppressCommonAncestors(!noSuppress)
                .includeAncestors(ancestors)
                .includeChildren(children)
                .includeAllDescendants(descendants)
                .cousinDepth(cousinDepth)
                .build();
    }
}
