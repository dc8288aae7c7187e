package com.validatorpayments.payments.range;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * Maps a UTC interval onto beacon slots. Slot {@code n} starts at {@code genesis + n * secondsPerSlot}.
 * The start bound is inclusive, the end bound exclusive: a slot belongs to the range when it starts
 * at or after the start instant and strictly before the end instant.
 */
public class SlotRangeResolver {

    private final long secondsPerSlot;

    public SlotRangeResolver(long secondsPerSlot) {
        if (secondsPerSlot <= 0) {
            throw new IllegalArgumentException("secondsPerSlot must be positive");
        }
        this.secondsPerSlot = secondsPerSlot;
    }

    /**
     * @param startDate ISO date (YYYY-MM-DD), read as 00:00:00 UTC
     * @param endDate   ISO date (YYYY-MM-DD), read as 00:00:00 UTC, exclusive
     */
    public SlotRange resolve(String startDate, String endDate, long genesisTimeSeconds) {
        return resolve(parseDate(startDate, "startDate"), parseDate(endDate, "endDate"), genesisTimeSeconds);
    }

    public SlotRange resolve(LocalDate startDate, LocalDate endDate, long genesisTimeSeconds) {
        if (startDate == null || endDate == null) {
            throw new InvalidRangeException("startDate and endDate are required");
        }
        return resolve(startDate.atStartOfDay(ZoneOffset.UTC).toInstant(),
                endDate.atStartOfDay(ZoneOffset.UTC).toInstant(),
                genesisTimeSeconds);
    }

    public SlotRange resolve(Instant start, Instant end, long genesisTimeSeconds) {
        long startSlot = Math.max(0L, ceilDiv(start.getEpochSecond() - genesisTimeSeconds, secondsPerSlot));
        long endSlot = ceilDiv(end.getEpochSecond() - genesisTimeSeconds, secondsPerSlot) - 1;
        if (startSlot > endSlot) {
            throw new InvalidRangeException("Start slot " + startSlot + " is after end slot " + endSlot
                    + " for [" + start + ", " + end + ")");
        }
        return new SlotRange(startSlot, endSlot);
    }

    public long getSecondsPerSlot() {
        return secondsPerSlot;
    }

    /**
     * Parses an ISO date; invalid input is a range error.
     */
    public static LocalDate parseDate(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new InvalidRangeException(field + " is required");
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidRangeException("Invalid " + field + " '" + value + "', expected YYYY-MM-DD", e);
        }
    }

    private static long ceilDiv(long dividend, long divisor) {
        return -Math.floorDiv(-dividend, divisor);
    }
}
