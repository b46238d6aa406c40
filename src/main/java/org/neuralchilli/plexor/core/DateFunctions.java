package org.neuralchilli.plexor.core;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * Date helpers exposed to templates as {@code date}.
 * Dates are ISO strings ({@code yyyy-MM-dd}).
 */
public class DateFunctions {

    private final Clock clock;

    public DateFunctions() {
        this(Clock.systemDefaultZone());
    }

    public DateFunctions(Clock clock) {
        this.clock = clock;
    }

    /**
     * Today's date in ISO format
     */
    public String today() {
        return LocalDate.now(clock).toString();
    }

    /**
     * Current date and time in the given pattern
     */
    public String now(String pattern) {
        return LocalDateTime.now(clock).format(DateTimeFormatter.ofPattern(pattern));
    }

    /**
     * Add time to a date
     *
     * @param unit days, weeks, months or years
     */
    public String add(String dateStr, long amount, String unit) {
        LocalDate date = LocalDate.parse(dateStr);

        return switch (unit.toLowerCase()) {
            case "days", "day" -> date.plusDays(amount).toString();
            case "weeks", "week" -> date.plusWeeks(amount).toString();
            case "months", "month" -> date.plusMonths(amount).toString();
            case "years", "year" -> date.plusYears(amount).toString();
            default -> throw new IllegalArgumentException(
                    "Invalid unit: " + unit + ". Use: days, weeks, months, years"
            );
        };
    }

    public String sub(String dateStr, long amount, String unit) {
        return add(dateStr, -amount, unit);
    }

    public String format(String dateStr, String pattern) {
        return LocalDate.parse(dateStr).format(DateTimeFormatter.ofPattern(pattern));
    }

    public long daysBetween(String startDate, String endDate) {
        return ChronoUnit.DAYS.between(LocalDate.parse(startDate), LocalDate.parse(endDate));
    }
}
