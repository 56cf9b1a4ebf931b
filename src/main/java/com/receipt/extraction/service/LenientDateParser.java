package com.receipt.extraction.service;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the date shapes that turn up on receipts:
 * <ul>
 *   <li>{@code 03/15/2024}, {@code 3-15-24} month first, falling back to day first
 *       when the leading number cannot be a month</li>
 *   <li>{@code 2024/03/15} year first</li>
 *   <li>{@code Mar 15, 2024}, {@code March 15 2024}</li>
 *   <li>{@code 15 March 2024}, {@code 15 Sept. 2024}</li>
 * </ul>
 * Two-digit years land in the century that puts them within 50 years of today.
 * Anything else throws {@link DateTimeException}.
 */
class LenientDateParser {

    private static final List<String> MONTHS = List.of(
            "january", "february", "march", "april", "may", "june",
            "july", "august", "september", "october", "november", "december");

    private static final Pattern NUMERIC = Pattern.compile("(\\d{1,4})[/-](\\d{1,2})[/-](\\d{1,4})");
    private static final Pattern MONTH_FIRST = Pattern.compile("([A-Za-z]+)\\.?\\s+(\\d{1,2}),?\\s+(\\d{4})");
    private static final Pattern DAY_FIRST = Pattern.compile("(\\d{1,2})\\s+([A-Za-z]+)\\.?\\s+(\\d{4})");

    private final Clock clock;

    LenientDateParser(Clock clock) {
        this.clock = clock;
    }

    LocalDate parse(String raw) {
        String text = raw.trim();

        Matcher m = NUMERIC.matcher(text);
        if (m.matches()) {
            return parseNumeric(m.group(1), m.group(2), m.group(3));
        }

        m = MONTH_FIRST.matcher(text);
        if (m.matches()) {
            return LocalDate.of(Integer.parseInt(m.group(3)), monthOf(m.group(1)), Integer.parseInt(m.group(2)));
        }

        m = DAY_FIRST.matcher(text);
        if (m.matches()) {
            return LocalDate.of(Integer.parseInt(m.group(3)), monthOf(m.group(2)), Integer.parseInt(m.group(1)));
        }

        throw new DateTimeException("Unrecognized date: " + raw);
    }

    private LocalDate parseNumeric(String first, String second, String third) {
        if (first.length() == 4) {
            return LocalDate.of(Integer.parseInt(first), Integer.parseInt(second), Integer.parseInt(third));
        }

        int month = Integer.parseInt(first);
        int day = Integer.parseInt(second);
        if (month > 12 && day <= 12) {
            int swap = month;
            month = day;
            day = swap;
        }
        return LocalDate.of(expandYear(third), month, day);
    }

    private int expandYear(String digits) {
        int year = Integer.parseInt(digits);
        if (digits.length() > 2) {
            return year;
        }
        int currentYear = LocalDate.now(clock).getYear();
        year += currentYear / 100 * 100;
        if (year >= currentYear + 50) {
            year -= 100;
        } else if (year < currentYear - 50) {
            year += 100;
        }
        return year;
    }

    private static int monthOf(String word) {
        String w = word.toLowerCase(Locale.ROOT);
        if (w.length() >= 3) {
            for (int i = 0; i < MONTHS.size(); i++) {
                String full = MONTHS.get(i);
                if (full.startsWith(w)) {
                    return i + 1;
                }
            }
        }
        throw new DateTimeException("Unknown month: " + word);
    }
}
