package com.solparser;

import com.google.common.flogger.GoogleLogger;
import com.solparser.ast.Node;
import com.solparser.ast.SourceLocation;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Looks for the SPDX license comment in the parts of a source file that no
 * top-level node covers.
 */
public final class LicenseFinder {
    private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

    private static final Pattern LICENSE_PATTERN =
        Pattern.compile("SPDX-License-Identifier:\\s*([a-zA-Z0-9 ()+.-]+)");

    private LicenseFinder() {
    }

    /**
     * Returns the single license identifier of {@code source}, or null. A missing
     * identifier is reported as warning 1878, more than one as error 3716.
     * Each gap between nodes contributes at most its first match.
     */
    public static String findLicense(String source, String sourceName, List<? extends Node> nodes, ErrorReporter reporter) {
        // One char per byte, so node offsets index it directly; the pattern is ASCII only
        String bytes = new String(source.getBytes(StandardCharsets.UTF_8), StandardCharsets.ISO_8859_1);
        List<String> matches = new ArrayList<>();
        for (int[] gap : gaps(bytes.length(), nodes)) {
            Matcher matcher = LICENSE_PATTERN.matcher(bytes).region(gap[0], gap[1]);
            if (matcher.find()) {
                String license = matcher.group(1).trim();
                if (!license.isEmpty()) {
                    matches.add(license);
                }
            }
        }

        SourceLocation nowhere = SourceLocation.empty(sourceName);
        if (matches.size() == 1) {
            logger.atFine().log("License of %s: %s", sourceName, matches.get(0));
            return matches.get(0);
        }
        if (matches.isEmpty()) {
            reporter.warning(1878, nowhere,
                "SPDX license identifier not provided in source file. "
                    + "Before publishing, consider adding a comment containing "
                    + "\"SPDX-License-Identifier: <SPDX-License>\" to each source file. "
                    + "Use \"SPDX-License-Identifier: UNLICENSED\" for non-open-source code. "
                    + "Please see https://spdx.org for more information.");
        } else {
            reporter.error(3716, nowhere,
                "Multiple SPDX license identifiers found in source file. "
                    + "Use \"AND\" or \"OR\" to combine multiple licenses. "
                    + "Please see https://spdx.org for more information.");
        }
        logger.atFine().log("No unique license in %s (%d matches)", sourceName, matches.size());
        return null;
    }

    // Non-empty source ranges not covered by any node that has text
    static List<int[]> gaps(int length, List<? extends Node> nodes) {
        List<int[]> gaps = new ArrayList<>();
        int gapStart = 0;
        for (Node node : nodes) {
            SourceLocation location = node.location();
            if (location.hasText()) {
                int gapEnd = Math.min(location.start(), length);
                if (gapStart < gapEnd) {
                    gaps.add(new int[] {gapStart, gapEnd});
                }
                gapStart = Math.max(gapStart, Math.min(location.end(), length));
            }
        }
        if (gapStart < length) {
            gaps.add(new int[] {gapStart, length});
        }
        return gaps;
    }
}
