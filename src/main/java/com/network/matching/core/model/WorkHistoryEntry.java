package com.network.matching.core.model;

import java.time.LocalDate;

/**
 * One position in a profile's work history.
 *
 * @param company   employer name, may be null
 * @param title     position title, may be null
 * @param startDate start of the position, may be null
 * @param endDate   end of the position, null while current
 * @param current   whether this is the profile's current position
 */
public record WorkHistoryEntry(
        String company,
        String title,
        LocalDate startDate,
        LocalDate endDate,
        boolean current
) {
    public WorkHistoryEntry {
        if (startDate != null && endDate != null && endDate.isBefore(startDate)) {
            throw new IllegalArgumentException("endDate must not precede startDate");
        }
    }

    public boolean hasCompany() {
        return company != null && !company.isBlank();
    }
}
