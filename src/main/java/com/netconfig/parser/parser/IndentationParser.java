package com.netconfig.parser.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.netconfig.parser.model.ConfigDocument;
import com.netconfig.parser.model.ConfigLine;
import com.netconfig.parser.model.LineText;
import com.netconfig.parser.model.ParseDiagnostics;
import com.netconfig.parser.model.ParseMode;

/**
 * Parser for configurations whose nesting is expressed with leading spaces.
 *
 * The indentation unit is the leading-space count of the first indented line. Two lexical
 * regions are handled specially:
 * - banners ({@code banner <type> <delimiter>}): every following line up to and including
 *   the next line containing the delimiter is a child of the banner line, whatever its
 *   indentation
 * - route policies and sets ({@code route-policy NAME}, {@code prefix-set NAME}, ...):
 *   bodies are flattened so every line up to {@code end-...} is a direct child
 *
 * Anomalies are logged and recorded in {@link ParseDiagnostics}; they never stop the pass.
 */
public class IndentationParser implements ConfigLineParser {
    private static final Logger log = LoggerFactory.getLogger(IndentationParser.class);

    private static final Pattern BANNER_PATTERN = Pattern.compile("^banner\\s+(\\S+)\\s+(\\S+)");
    private static final Pattern FLAT_REGION_PATTERN = Pattern.compile("^(?:route-policy|\\w[\\w-]*-set)\\s+\\S");
    private static final String REGION_END_PREFIX = "end-";

    private final List<String> rawLines;
    private final ParseDiagnostics diagnostics = new ParseDiagnostics();
    private final List<ConfigLine> lines = new ArrayList<>();
    private final List<ConfigLine> ancestorStack = new ArrayList<>();

    private int unit = 0;
    private int currentLevel = 0;
    private ConfigLine previous;

    private String bannerDelimiter;
    private ConfigLine bannerLine;

    private boolean flattenMode;
    private ConfigLine flatRegionLine;

    private boolean parsed;

    public IndentationParser(List<String> rawLines) {
        this.rawLines = rawLines;
    }

    @Override
    public ConfigDocument parse() {
        if (parsed) {
            throw new IllegalStateException("IndentationParser instances parse a single document");
        }
        parsed = true;

        int lineNumber = 0;
        for (String raw : rawLines) {
            lineNumber++;
            processLine(new ConfigLine(lineNumber, LineText.stripTrailing(raw)));
        }

        if (bannerDelimiter != null) {
            warn("Unterminated banner: delimiter '" + bannerDelimiter + "' not found before end of input, banner opened at line "
                    + bannerLine.getLineNumber());
        }
        if (flattenMode) {
            warn("Unterminated region: no end-set or end-policy encountered before end of input within section "
                    + flatRegionLine.getText());
        }

        lines.forEach(ConfigLine::seal);
        log.debug("Parsed {} indented lines, unit={} spaces", lines.size(), unit);

        return ConfigDocument.builder()
                .lines(List.copyOf(lines))
                .mode(ParseMode.INDENTATION)
                .diagnostics(diagnostics)
                .build();
    }

    private void processLine(ConfigLine line) {
        String text = line.getText();
        lines.add(line);

        if (bannerDelimiter != null) {
            if (!BANNER_PATTERN.matcher(text).lookingAt()) {
                attach(line);
                if (text.contains(bannerDelimiter)) {
                    diagnostics.info("Banner at line " + bannerLine.getLineNumber() + " captured "
                            + bannerLine.getChildren().size() + " line(s)");
                    closeBanner();
                }
                return;
            }
            warn("Unterminated banner: delimiter '" + bannerDelimiter + "' not found before the next banner at line "
                    + line.getLineNumber() + ", banner opened at line " + bannerLine.getLineNumber());
            closeBanner();
        }

        int level = levelOf(line);
        adjustStackForLevel(level, line);
        attach(line);
        previous = line;

        Matcher banner = BANNER_PATTERN.matcher(text);
        if (banner.lookingAt()) {
            String delimiter = banner.group(2);
            if (text.indexOf(delimiter, banner.end()) < 0) {
                bannerDelimiter = delimiter;
                bannerLine = line;
                ancestorStack.add(line);
                log.debug("Banner capture started at line {} with delimiter '{}'", line.getLineNumber(), delimiter);
            }
            return;
        }

        if (FLAT_REGION_PATTERN.matcher(text).lookingAt()) {
            flattenMode = true;
            flatRegionLine = line;
        }
        if (flattenMode && text.startsWith(REGION_END_PREFIX)) {
            diagnostics.info("Region " + flatRegionLine.getText() + " flattened up to line " + line.getLineNumber());
            flattenMode = false;
            flatRegionLine = null;
        }
    }

    private int levelOf(ConfigLine line) {
        String text = line.getText();
        int spaces = line.getLeadingSpaces();
        if (unit == 0 && spaces > 0) {
            unit = spaces;
            log.debug("Indentation unit set to {} spaces at line {}", unit, line.getLineNumber());
        }
        int level = unit > 0 ? spaces / unit : 0;

        if (flattenMode) {
            boolean indented = !text.isEmpty() && Character.isWhitespace(text.charAt(0));
            if (indented || text.startsWith(REGION_END_PREFIX)) {
                return 1;
            }
            warn("Unterminated region: no end-set or end-policy encountered at line " + line.getLineNumber()
                    + " within section " + flatRegionLine.getText());
            flattenMode = false;
            flatRegionLine = null;
        }
        return level;
    }

    private void adjustStackForLevel(int level, ConfigLine line) {
        if (level > currentLevel) {
            if (level > currentLevel + 1) {
                warn("Indentation level jumped more than one step at line " + line.getLineNumber()
                        + " (" + currentLevel + " -> " + level + ")");
                level = currentLevel + 1;
            }
            if (previous == null) {
                warn("Indented line " + line.getLineNumber() + " has no preceding line to nest under");
                level = currentLevel;
            } else {
                ancestorStack.add(previous);
            }
        } else if (level < currentLevel) {
            truncateStack(level);
        }
        currentLevel = level;
    }

    private void attach(ConfigLine line) {
        if (!ancestorStack.isEmpty()) {
            ancestorStack.get(ancestorStack.size() - 1).addChild(line);
        }
    }

    private void closeBanner() {
        ancestorStack.remove(ancestorStack.size() - 1);
        bannerDelimiter = null;
        bannerLine = null;
    }

    private void truncateStack(int size) {
        while (ancestorStack.size() > size) {
            ancestorStack.remove(ancestorStack.size() - 1);
        }
    }

    private void warn(String message) {
        log.warn(message);
        diagnostics.warn(message);
    }
}
