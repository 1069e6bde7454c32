package com.kreasipositif.ipcacorrection.engine;

import com.kreasipositif.ipcacorrection.domain.MonetaryCorrection;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Rebuilds a correction timeline from the original entries, new entries and in-place updates.
 *
 * <p>A timeline never holds two IPCA/IGPM entries for the same year-month: an index insertion
 * whose period is already taken is logged and dropped.
 */
@Slf4j
public final class CorrectionTimelineMerger {

    private static final Comparator<MonetaryCorrection> BY_EFFECTIVE_DATE = Comparator.comparing(
            (MonetaryCorrection c) -> c.effectiveDate().orElse(null),
            Comparator.nullsFirst(Comparator.<Instant>naturalOrder()));

    private CorrectionTimelineMerger() {
    }

    public static List<MonetaryCorrection> merge(List<MonetaryCorrection> original,
                                                 List<MonetaryCorrection> insertions,
                                                 List<CorrectionUpdate> updates) {
        Map<YearMonth, CorrectionUpdate> updatesByPeriod = new LinkedHashMap<>();
        updates.forEach(u -> updatesByPeriod.put(u.getPeriod(), u));

        List<MonetaryCorrection> merged = new ArrayList<>(original.size() + insertions.size());
        Set<YearMonth> indexPeriods = new HashSet<>();
        Set<YearMonth> updated = new HashSet<>();

        for (MonetaryCorrection entry : original) {
            Optional<YearMonth> period = indexPeriod(entry);
            MonetaryCorrection kept = entry;
            if (period.isPresent() && updatesByPeriod.containsKey(period.get()) && updated.add(period.get())) {
                kept = applyUpdate(entry, updatesByPeriod.get(period.get()));
            }
            merged.add(kept);
            period.ifPresent(indexPeriods::add);
        }

        updatesByPeriod.keySet().stream()
                .filter(p -> !updated.contains(p))
                .forEach(p -> log.warn("No index entry for {} to update, update ignored", p));

        for (MonetaryCorrection insertion : insertions) {
            Optional<YearMonth> period = indexPeriod(insertion);
            if (period.isPresent() && !indexPeriods.add(period.get())) {
                log.warn("Index entry for {} already present, skipping {} insertion", period.get(), insertion.getType());
                continue;
            }
            merged.add(insertion);
        }

        merged.sort(BY_EFFECTIVE_DATE);
        return merged;
    }

    private static Optional<YearMonth> indexPeriod(MonetaryCorrection entry) {
        return entry.isIndexCorrection() ? entry.period() : Optional.empty();
    }

    private static MonetaryCorrection applyUpdate(MonetaryCorrection entry, CorrectionUpdate update) {
        var base = update.getNewBase() != null ? update.getNewBase() : entry.getOriginalValueBeforeCorrection();
        var builder = entry.toBuilder()
                .recognizedValueWithOverhead(update.getNewValue())
                .originalValueBeforeCorrection(base)
                .observation(update.getObservation())
                .creationDate(update.getUpdatedAt());
        if (base != null) {
            builder.differenceValue(update.getNewValue().subtract(base));
        }
        return builder.build();
    }
}
