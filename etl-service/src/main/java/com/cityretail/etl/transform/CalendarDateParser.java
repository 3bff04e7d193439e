package com.cityretail.etl.transform;

import com.cityretail.etl.domain.DataTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.IsoFields;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses the calendar {@code date} column and derives {@code weeknumber} (ISO week) and
 * {@code isweekend}. Unparsable dates become {@code null} along with both derived fields.
 */
@Component
@Slf4j
public class CalendarDateParser {

    static final String DATE = "date";
    static final String WEEK_NUMBER = "weeknumber";
    static final String IS_WEEKEND = "isweekend";

    private static final List<DateTimeFormatter> DATE_PATTERNS = List.of(
            strict("uuuu-MM-dd"),
            // ambiguous slash dates read month first
            strict("MM/dd/uuuu"),
            strict("dd/MM/uuuu"),
            strict("uuuu/MM/dd"),
            strict("uuuuMMdd"));

    private static final DateTimeFormatter DATE_TIME_PATTERN = strict("uuuu-MM-dd HH:mm:ss");

    public DataTable parse(DataTable calendar) {
        List<String> columns = new ArrayList<>(calendar.columns());
        for (String derived : List.of(DATE, WEEK_NUMBER, IS_WEEKEND)) {
            if (!columns.contains(derived)) {
                columns.add(derived);
            }
        }

        int[] failed = {0};
        DataTable parsed = calendar.mapRows(columns, row -> {
            LocalDate date = parseDate(row.get(DATE));
            if (date == null) {
                failed[0]++;
            }
            row.put(DATE, date);
            row.put(WEEK_NUMBER, date == null ? null : date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
            row.put(IS_WEEKEND, date == null ? null : isWeekend(date));
            return row;
        });

        if (failed[0] > 0) {
            log.warn("Some calendar dates could not be parsed. ({} of {} rows)", failed[0], calendar.size());
        }
        return parsed;
    }

    static LocalDate parseDate(Object value) {
        if (value instanceof LocalDate date) {
            return date;
        }
        if (value == null || value.toString().isBlank()) {
            return null;
        }
        String text = value.toString().trim();
        for (DateTimeFormatter formatter : DATE_PATTERNS) {
            try {
                return LocalDate.parse(text, formatter);
            } catch (DateTimeParseException e) {
                log.trace("Pattern {} did not match '{}'", formatter, text);
            }
        }
        try {
            return LocalDateTime.parse(text, DATE_TIME_PATTERN).toLocalDate();
        } catch (DateTimeParseException e) {
            log.debug("Unparsable calendar date '{}'", text);
            return null;
        }
    }

    private static boolean isWeekend(LocalDate date) {
        DayOfWeek day = date.getDayOfWeek();
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
    }
}
