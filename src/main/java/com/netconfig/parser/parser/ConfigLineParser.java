package com.netconfig.parser.parser;

import com.netconfig.parser.model.ConfigDocument;

/**
 * One strategy for turning raw lines into a tree of {@link com.netconfig.parser.model.ConfigLine}s.
 *
 * Implementations hold the state of a single pass and are not reusable.
 */
public interface ConfigLineParser {

    /**
     * Run the pass. Every input line becomes exactly one line of the returned document,
     * in read order, and every line is sealed on return.
     */
    ConfigDocument parse();
}
