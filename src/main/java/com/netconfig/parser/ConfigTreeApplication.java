package com.netconfig.parser;

import com.netconfig.parser.cli.SearchCommand;
import picocli.CommandLine;

/**
 * Main entry point: parse a configuration file and print the lines matching a search.
 */
public class ConfigTreeApplication {

    public static void main(String[] args) {
        System.exit(newCommandLine().execute(args));
    }

    public static CommandLine newCommandLine() {
        return new CommandLine(new SearchCommand())
                .setCaseInsensitiveEnumValuesAllowed(true);
    }
}
