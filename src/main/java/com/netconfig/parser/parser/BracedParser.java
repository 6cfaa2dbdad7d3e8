package com.netconfig.parser.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.netconfig.parser.model.ConfigDocument;
import com.netconfig.parser.model.ConfigLine;
import com.netconfig.parser.model.LineText;
import com.netconfig.parser.model.ParseDiagnostics;
import com.netconfig.parser.model.ParseMode;

/**
 * Parser for brace-structured configurations such as Junos.
 *
 * A line ending in {@code {} opens a block; a line ending in {@code }} belongs to the block
 * it closes. Comment lines never open or close blocks.
 */
public class BracedParser implements ConfigLineParser {
    private static final Logger log = LoggerFactory.getLogger(BracedParser.class);

    private final List<String> rawLines;
    private final String commentMarkers;
    private final ParseDiagnostics diagnostics = new ParseDiagnostics();
    private final Deque<ConfigLine> openBlocks = new ArrayDeque<>();
    private boolean parsed;

    public BracedParser(List<String> rawLines, ParserConfig config) {
        this.rawLines = rawLines;
        this.commentMarkers = config.getBracedCommentMarkers();
    }

    @Override
    public ConfigDocument parse() {
        if (parsed) {
            throw new IllegalStateException("BracedParser instances parse a single document");
        }
        parsed = true;

        List<ConfigLine> lines = new ArrayList<>();
        int lineNumber = 0;
        for (String raw : rawLines) {
            lineNumber++;
            ConfigLine line = new ConfigLine(lineNumber, LineText.stripTrailing(raw));
            lines.add(line);

            if (!openBlocks.isEmpty()) {
                openBlocks.peek().addChild(line);
            }
            if (LineText.isComment(line.getText(), commentMarkers)) {
                continue;
            }

            char last = LineText.lastSignificantChar(line.getText());
            if (last == '{') {
                openBlocks.push(line);
            } else if (last == '}') {
                if (openBlocks.isEmpty()) {
                    warn("Unbalanced closing brace at line " + lineNumber);
                } else {
                    openBlocks.pop();
                }
            }
        }

        if (!openBlocks.isEmpty()) {
            warn("Unterminated block: " + openBlocks.size() + " block(s) still open at end of input, innermost opened at line "
                    + openBlocks.peek().getLineNumber());
        }

        lines.forEach(ConfigLine::seal);
        log.debug("Parsed {} braced lines", lines.size());

        return ConfigDocument.builder()
                .lines(List.copyOf(lines))
                .mode(ParseMode.BRACED)
                .diagnostics(diagnostics)
                .build();
    }

    private void warn(String message) {
        log.warn(message);
        diagnostics.warn(message);
    }
}
