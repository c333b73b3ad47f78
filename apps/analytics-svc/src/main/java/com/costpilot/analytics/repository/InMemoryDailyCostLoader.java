package com.costpilot.analytics.repository;

import com.costpilot.analytics.model.CostPoint;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.springframework.stereotype.Repository;

/**
 * Keeps raw cost entries in memory and aggregates them per UTC day on read.
 */
@Repository
public class InMemoryDailyCostLoader implements DailyCostLoader {

    private final List<CostEntry> entries = new CopyOnWriteArrayList<>();

    public void record(Instant timestamp, String service, double amount) {
        entries.add(new CostEntry(timestamp, service, amount));
    }

    public void clear() {
        entries.clear();
    }

    @Override
    public List<CostPoint> loadDailyCosts(Optional<String> service, LocalDate startInclusive, LocalDate endInclusive) {
        Map<LocalDate, List<Double>> byDay = new TreeMap<>();
        for (CostEntry entry : entries) {
            LocalDate day = LocalDate.ofInstant(entry.timestamp(), ZoneOffset.UTC);
            if (day.isBefore(startInclusive) || day.isAfter(endInclusive)) {
                continue;
            }
            if (service.isPresent() && !service.get().equals(entry.service())) {
                continue;
            }
            byDay.computeIfAbsent(day, d -> new ArrayList<>()).add(entry.amount());
        }
        List<CostPoint> points = new ArrayList<>(byDay.size());
        byDay.forEach((day, amounts) -> {
            double total = amounts.stream().mapToDouble(Double::doubleValue).sum();
            points.add(new CostPoint(day, total, amounts.size(), total / amounts.size()));
        });
        return points;
    }

    private record CostEntry(Instant timestamp, String service, double amount) {
    }
}
