package com.netconfig.parser.parser;

import com.netconfig.parser.model.ParseMode;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ParseModeDetectorTest {

    private final ParseModeDetector detector = new ParseModeDetector(ParserConfig.defaults());

    @Test
    void testBracedConfigurationIsDetected() {
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            lines.add("block" + i + " {");
            lines.add("    leaf" + i + ";");
            lines.add("}");
        }

        assertThat(detector.detect(lines)).isEqualTo(ParseMode.BRACED);
    }

    @Test
    void testIndentedConfigurationIsDetected() {
        List<String> lines = List.of(
                "interface Loopback0",
                " ipv4 address 192.0.2.1 255.255.255.255",
                "!",
                "router bgp 65000",
                " bgp router-id 192.0.2.1");

        assertThat(detector.detect(lines)).isEqualTo(ParseMode.INDENTATION);
    }

    @Test
    void testThresholdMustBeExceeded() {
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            lines.add("block" + i + " {");
            lines.add("    leaf" + i + ";");
            lines.add("}");
        }

        assertThat(detector.detect(lines)).isEqualTo(ParseMode.INDENTATION);
    }

    @Test
    void testCommentLinesAreIgnored() {
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            lines.add("! {");
            lines.add("# };");
        }

        assertThat(detector.detect(lines)).isEqualTo(ParseMode.INDENTATION);
    }

    @Test
    void testDetectionGivesUpAfterScanLimit() {
        ParseModeDetector shortSighted = new ParseModeDetector(ParserConfig.builder().maxDetectionLines(5).build());
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            lines.add("hostname R" + i);
        }
        for (int i = 0; i < 4; i++) {
            lines.add("block" + i + " {");
            lines.add("    leaf" + i + ";");
            lines.add("}");
        }

        assertThat(shortSighted.detect(lines)).isEqualTo(ParseMode.INDENTATION);
        assertThat(detector.detect(lines)).isEqualTo(ParseMode.BRACED);
    }
}
