package com.netconfig.parser.parser;

import lombok.Builder;
import lombok.Value;

/**
 * Tuning knobs for the tree builder.
 */
@Value
@Builder
public class ParserConfig {

    /**
     * Maximum number of non-comment lines examined by auto-detection.
     */
    @Builder.Default
    int maxDetectionLines = 50;

    /**
     * Auto-detection picks the braced parser once the counts of lines ending in
     * {@code {}, {@code }} and {@code ;} all exceed this number.
     */
    @Builder.Default
    int minimumBracedMatches = 3;

    /**
     * Characters that start a comment line in indented configurations.
     */
    @Builder.Default
    String commentMarkers = "!#";

    /**
     * Characters that start a comment line in braced configurations.
     */
    @Builder.Default
    String bracedCommentMarkers = "#";

    public static ParserConfig defaults() {
        return ParserConfig.builder().build();
    }
}
