package com.github.revdownloader.service.parser;

import com.github.revdownloader.model.BackendProgress;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for plain console progress such as
 * {@code [download]  42.3% of 10.00MiB at 1.00MiB/s ETA 00:06}. Only the
 * percentage is read; sizes printed with rounded units are not reliable enough
 * for speed calculation.
 */
public class PercentProgressParser implements ProgressParser {

    private static final Pattern PERCENT_PATTERN = Pattern.compile("(\\d+\\.?\\d*)%");

    @Override
    public BackendProgress parseLine(String line) {
        if (line == null || line.indexOf('%') < 0) {
            return null;
        }
        if (!line.toLowerCase(Locale.ROOT).contains("download")) {
            return null;
        }

        Matcher matcher = PERCENT_PATTERN.matcher(line);
        if (!matcher.find()) {
            return null;
        }
        try {
            double percent = Double.parseDouble(matcher.group(1));
            return BackendProgress.ofFraction(Math.min(percent, 100.0) / 100.0);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    @Override
    public void reset() {
        // Stateless
    }
}
