// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.chunk;

import java.time.LocalDate;
import java.util.Collection;

import static com.google.common.base.Preconditions.checkArgument;

/// An inclusive range of calendar dates.
public record DateRange (LocalDate first, LocalDate last) {

    public DateRange {
        checkArgument(!last.isBefore(first), "Date range ends (%s) before it starts (%s).", last, first);
    }

    public static DateRange single (LocalDate date) {
        return new DateRange(date, date);
    }

    /// The smallest range containing all of the given dates.
    public static DateRange containing (Collection<LocalDate> dates) {
        checkArgument(!dates.isEmpty(), "Cannot make a range from no dates.");
        LocalDate min = dates.stream().min(LocalDate::compareTo).get();
        LocalDate max = dates.stream().max(LocalDate::compareTo).get();
        return new DateRange(min, max);
    }

    public boolean contains (LocalDate date) {
        return !date.isBefore(first) && !date.isAfter(last);
    }

    @Override
    public String toString () {
        return first.equals(last) ? first.toString() : first + "/" + last;
    }
}
