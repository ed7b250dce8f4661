package io.github.pierce.gdelt.batch;

import io.github.pierce.gdelt.ValidationException;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Validates GDELT 15-minute timestamps ({@code yyyyMMddHHmmss}) and expands ranges of them.
 */
public final class TimestampRangeExpander {

    public static final DateTimeFormatter FORMAT =
            DateTimeFormatter.ofPattern("uuuuMMddHHmmss").withResolverStyle(ResolverStyle.STRICT);

    private static final int STEP_MINUTES = 15;
    private static final Set<Integer> ALIGNED_MINUTES = Set.of(0, 15, 30, 45);

    private TimestampRangeExpander() {
    }

    /**
     * @throws ValidationException if the value is not a real date-time, has non-zero seconds,
     *                             or minutes other than 00, 15, 30 or 45
     */
    public static LocalDateTime validate(String timestamp) {
        if (timestamp == null || !timestamp.matches("\\d{14}")) {
            throw new ValidationException("Invalid timestamp format (expected yyyyMMddHHmmss): " + timestamp);
        }
        LocalDateTime parsed;
        try {
            parsed = LocalDateTime.parse(timestamp, FORMAT);
        } catch (DateTimeParseException e) {
            throw new ValidationException("Invalid timestamp: " + timestamp, e);
        }
        if (parsed.getSecond() != 0) {
            throw new ValidationException("Invalid timestamp seconds (must be 00): " + timestamp);
        }
        if (!ALIGNED_MINUTES.contains(parsed.getMinute())) {
            throw new ValidationException("Invalid timestamp minutes (must be 00/15/30/45): " + timestamp);
        }
        return parsed;
    }

    /**
     * Every 15-minute timestamp from {@code start} to {@code end}, both inclusive. A null or
     * blank end yields just {@code start}.
     */
    public static List<String> expand(String start, String end) {
        LocalDateTime startTime = validate(start);
        if (end == null || end.isBlank()) {
            return List.of(start);
        }
        LocalDateTime endTime = validate(end.strip());
        if (endTime.isBefore(startTime)) {
            throw new ValidationException("timestamp_end must be >= timestamp_start. Got start="
                    + start + ", end=" + end);
        }

        List<String> out = new ArrayList<>();
        for (LocalDateTime current = startTime; !current.isAfter(endTime); current = current.plusMinutes(STEP_MINUTES)) {
            out.add(FORMAT.format(current));
        }
        return out;
    }
}
