package com.netconfig.parser.parser;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.netconfig.parser.model.LineText;
import com.netconfig.parser.model.ParseMode;

/**
 * Guesses whether a document is brace-structured by looking at how its first lines end.
 * Mixed or ambiguous input is treated as indented.
 */
public class ParseModeDetector {
    private static final Logger log = LoggerFactory.getLogger(ParseModeDetector.class);

    private final ParserConfig config;

    public ParseModeDetector(ParserConfig config) {
        this.config = config;
    }

    public ParseMode detect(List<String> lines) {
        int opening = 0;
        int closing = 0;
        int terminated = 0;
        int scanned = 0;
        int minimum = config.getMinimumBracedMatches();

        for (String line : lines) {
            if (LineText.isComment(line, config.getCommentMarkers())) {
                continue;
            }
            scanned++;
            switch (LineText.lastSignificantChar(line)) {
                case '{' -> opening++;
                case '}' -> closing++;
                case ';' -> terminated++;
            }
            if (opening > minimum && closing > minimum && terminated > minimum) {
                log.debug("Detected braced configuration after {} lines", scanned);
                return ParseMode.BRACED;
            }
            if (scanned >= config.getMaxDetectionLines()) {
                break;
            }
        }
        log.debug("Detected indented configuration (open={}, close={}, semicolon={} in {} lines)",
                opening, closing, terminated, scanned);
        return ParseMode.INDENTATION;
    }
}
