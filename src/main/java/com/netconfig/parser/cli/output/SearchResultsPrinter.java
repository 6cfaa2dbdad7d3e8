package com.netconfig.parser.cli.output;

import java.io.PrintWriter;
import java.util.List;

import com.netconfig.parser.model.ConfigLine;

/**
 * Responsible only for writing search results. No parsing, no searching.
 */
public class SearchResultsPrinter {

    private final PrintWriter out;
    private final boolean lineNumbers;

    public SearchResultsPrinter(PrintWriter out, boolean lineNumbers) {
        this.out = out;
        this.lineNumbers = lineNumbers;
    }

    public void print(List<ConfigLine> lines) {
        for (ConfigLine line : lines) {
            if (lineNumbers) {
                out.printf("%5d: %s%n", line.getLineNumber(), line.getText());
            } else {
                out.println(line.getText());
            }
        }
        out.flush();
    }
}
