package com.costpilot.analytics.repository;

import com.costpilot.analytics.model.CostPoint;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface DailyCostLoader {

    /**
     * Loads one aggregated point per calendar day, ascending by date.
     *
     * @param service restricts the totals to a single service when present
     */
    List<CostPoint> loadDailyCosts(Optional<String> service, LocalDate startInclusive, LocalDate endInclusive);
}
