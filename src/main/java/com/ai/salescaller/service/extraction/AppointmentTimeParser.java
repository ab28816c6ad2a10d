package com.ai.salescaller.service.extraction;

import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Grammar for spoken appointment requests: a day (today, tomorrow, a weekday, or M/D[/Y])
 * followed by a clock time or a part of the day. Both parts are required; past times are rejected.
 */
@Component
public class AppointmentTimeParser {

    private static final Pattern DAY = Pattern.compile(
            "\\b(today|tomorrow|(?:next |this )?(monday|tuesday|wednesday|thursday|friday|saturday|sunday)|"
                    + "(\\d{1,2})/(\\d{1,2})(?:/(\\d{2}|\\d{4}))?)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern CLOCK = Pattern.compile(
            "\\b(?:at|around|by|for)?\\s*(\\d{1,2})(?::(\\d{2}))?\\s*(a\\.?m\\.?|p\\.?m\\.?|o'?clock)?(?=\\W|$)",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern PART_OF_DAY = Pattern.compile(
            "\\b(morning|noon|midday|afternoon|evening)\\b", Pattern.CASE_INSENSITIVE);

    private final Clock clock;

    public AppointmentTimeParser(Clock clock) {
        this.clock = clock;
    }

    public Optional<AppointmentTime> parse(String transcript) {
        if (StringUtils.isBlank(transcript)) {
            return Optional.empty();
        }
        String text = transcript.toLowerCase(Locale.ROOT);
        LocalDateTime now = LocalDateTime.now(clock);

        Matcher day = DAY.matcher(text);
        if (!day.find()) {
            return Optional.empty();
        }
        Optional<LocalDate> date = resolveDate(day, now.toLocalDate());
        if (date.isEmpty()) {
            return Optional.empty();
        }

        // look for the time after the day phrase first, then anywhere else
        String rest = text.substring(day.end());
        Optional<LocalTime> time = resolveTime(rest);
        if (time.isEmpty()) {
            time = resolveTime(text.substring(0, day.start()));
        }
        if (time.isEmpty()) {
            return Optional.empty();
        }

        LocalDateTime when = LocalDateTime.of(date.get(), time.get());
        if (!when.isAfter(now)) {
            return Optional.empty();
        }
        return Optional.of(new AppointmentTime(when));
    }

    private Optional<LocalDate> resolveDate(Matcher day, LocalDate today) {
        String phrase = day.group(1);
        if ("today".equals(phrase)) {
            return Optional.of(today);
        }
        if ("tomorrow".equals(phrase)) {
            return Optional.of(today.plusDays(1));
        }
        if (day.group(2) != null) {
            DayOfWeek dow = DayOfWeek.valueOf(day.group(2).toUpperCase(Locale.ROOT));
            return Optional.of(today.with(TemporalAdjusters.next(dow)));
        }
        try {
            int month = Integer.parseInt(day.group(3));
            int dom = Integer.parseInt(day.group(4));
            if (day.group(5) != null) {
                int year = Integer.parseInt(day.group(5));
                if (year < 100) {
                    year += 2000;
                }
                return Optional.of(LocalDate.of(year, month, dom));
            }
            LocalDate candidate = LocalDate.of(today.getYear(), month, dom);
            return Optional.of(candidate.isBefore(today) ? candidate.plusYears(1) : candidate);
        } catch (DateTimeException | NumberFormatException e) {
            return Optional.empty();
        }
    }

    private Optional<LocalTime> resolveTime(String text) {
        Matcher clockMatch = CLOCK.matcher(text);
        while (clockMatch.find()) {
            int hour = Integer.parseInt(clockMatch.group(1));
            int minute = clockMatch.group(2) != null ? Integer.parseInt(clockMatch.group(2)) : 0;
            String suffix = clockMatch.group(3);
            boolean hasContext = suffix != null || clockMatch.group(2) != null
                    || clockMatch.group().trim().matches("(?i)(at|around|by|for)\\s.*");
            if (!hasContext || hour > 23 || minute > 59) {
                continue;
            }
            String marker = suffix != null ? suffix.replace(".", "").toLowerCase(Locale.ROOT) : "";
            if (marker.startsWith("pm") && hour < 12) {
                hour += 12;
            } else if (marker.startsWith("am") && hour == 12) {
                hour = 0;
            } else if (!marker.startsWith("am") && !marker.startsWith("pm") && hour >= 1 && hour <= 7) {
                // bare "at 3" during business hours means the afternoon
                hour += 12;
            }
            return Optional.of(LocalTime.of(hour, minute));
        }
        Matcher part = PART_OF_DAY.matcher(text);
        if (part.find()) {
            switch (part.group(1).toLowerCase(Locale.ROOT)) {
                case "morning":
                    return Optional.of(LocalTime.of(10, 0));
                case "noon":
                case "midday":
                    return Optional.of(LocalTime.NOON);
                case "afternoon":
                    return Optional.of(LocalTime.of(14, 0));
                default:
                    return Optional.of(LocalTime.of(17, 0));
            }
        }
        return Optional.empty();
    }
}
