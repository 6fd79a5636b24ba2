// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.chunk;

import java.time.LocalDate;
import java.time.YearMonth;

/// The calendar unit acquisitions are grouped by when comparing periods in batch mode.
public enum CalendarPeriod {
    YEAR, MONTH;

    /// A sortable key identifying the period the date falls in.
    public String key (LocalDate date) {
        return switch (this) {
            case YEAR -> Integer.toString(date.getYear());
            case MONTH -> YearMonth.from(date).toString();
        };
    }
}
