package com.kreasipositif.ipcacorrection.analysis;

import com.kreasipositif.ipcacorrection.config.CorrectionProperties;
import com.kreasipositif.ipcacorrection.domain.CostAccount;
import com.kreasipositif.ipcacorrection.domain.DuplicateCorrection;
import com.kreasipositif.ipcacorrection.domain.Gap;
import com.kreasipositif.ipcacorrection.domain.GapAnalysisResult;
import com.kreasipositif.ipcacorrection.domain.IndexType;
import com.kreasipositif.ipcacorrection.domain.InterveningChange;
import com.kreasipositif.ipcacorrection.domain.Money;
import com.kreasipositif.ipcacorrection.domain.MonetaryCorrection;
import com.kreasipositif.ipcacorrection.domain.OutOfPeriodCorrection;
import com.kreasipositif.ipcacorrection.domain.Periods;
import com.kreasipositif.ipcacorrection.repository.RateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Walks the anniversaries of a cost account and reports what went wrong with each one.
 *
 * <p>For every anniversary that has been reached the analyzer looks for an IPCA/IGPM entry in
 * the anniversary month. If there is none it searches for a late one; if that also fails the
 * anniversary is a gap. Duplicated index entries are reported independently.
 *
 * <p>The analyzer never writes; repeating it over the same account gives the same result.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GapAnalyzer {

    private final AnniversaryCalendar calendar;
    private final RateRepository rateRepository;
    private final CorrectionProperties properties;
    private final Clock clock;

    // ─── Public API ──────────────────────────────────────────────────────────────

    public GapAnalysisResult analyze(CostAccount account) {
        Optional<YearMonth> recognition = account.recognitionPeriod();
        if (recognition.isEmpty()) {
            log.debug("Cost account {} has no recognition date, nothing to analyze", account.getId());
            return GapAnalysisResult.builder().build();
        }

        Instant now = clock.instant();
        LocalDate today = now.atZone(ZoneOffset.UTC).toLocalDate();
        List<MonetaryCorrection> indexEntries = account.correctionsOrEmpty().stream()
                .filter(c -> c.isIndexCorrection() && c.effectiveDate().isPresent())
                .toList();
        Map<YearMonth, MonetaryCorrection> byPeriod = new HashMap<>();
        indexEntries.forEach(c -> byPeriod.put(c.period().orElseThrow(), c));

        GapAnalysisResult.GapAnalysisResultBuilder result = GapAnalysisResult.builder();
        for (YearMonth anniversary = calendar.firstAnniversary(recognition.get());
             calendar.isDue(anniversary, today);
             anniversary = anniversary.plusYears(1)) {

            if (byPeriod.containsKey(anniversary)) {
                log.debug("{}: anniversary {} corrected on time", account.getId(), anniversary);
                continue;
            }

            Optional<MonetaryCorrection> late = findLateCorrection(indexEntries, anniversary);
            if (late.isPresent()) {
                Instant appliedAt = late.get().effectiveDate().orElseThrow();
                if (appliedAt.isAfter(calendar.deadline(anniversary))) {
                    result.outOfPeriodCorrection(describeLateCorrection(account, late.get(), anniversary));
                }
                continue;
            }

            buildGap(account, anniversary, now).ifPresent(result::gap);
        }

        result.duplicates(findDuplicates(account.correctionsOrEmpty()));
        GapAnalysisResult analysis = result.build();
        log.debug("{}: {} gap(s), {} out-of-period, {} duplicate(s)", account.getId(),
                analysis.getGaps().size(), analysis.getOutOfPeriodCorrections().size(), analysis.getDuplicates().size());
        return analysis;
    }

    /**
     * Second and later IPCA/IGPM entries for a year-month already covered by an earlier entry.
     */
    public List<DuplicateCorrection> findDuplicates(List<MonetaryCorrection> corrections) {
        Map<YearMonth, Integer> firstSeen = new HashMap<>();
        List<DuplicateCorrection> duplicates = new ArrayList<>();
        for (int i = 0; i < corrections.size(); i++) {
            MonetaryCorrection correction = corrections.get(i);
            if (!correction.isIndexCorrection() || correction.period().isEmpty()) {
                continue;
            }
            YearMonth period = correction.period().get();
            Integer firstIndex = firstSeen.get(period);
            if (firstIndex == null) {
                firstSeen.put(period, i);
                continue;
            }
            Instant originalDate = corrections.get(firstIndex).effectiveDate().orElseThrow();
            Instant duplicateDate = correction.effectiveDate().orElseThrow();
            if (duplicateDate.isAfter(originalDate)) {
                duplicates.add(DuplicateCorrection.builder()
                        .index(i)
                        .originalIndex(firstIndex)
                        .year(period.getYear())
                        .month(period.getMonthValue())
                        .duplicatedValue(Money.orZero(correction.getDifferenceValue()))
                        .duplicatedCorrection(correction)
                        .originalEntryDate(originalDate)
                        .build());
            }
        }
        return duplicates;
    }

    // ─── Internal helpers ────────────────────────────────────────────────────────

    /**
     * First index entry of the anniversary year, then of the following year, applied after the
     * late window opens and less than the maximum lag after the anniversary.
     */
    private Optional<MonetaryCorrection> findLateCorrection(List<MonetaryCorrection> indexEntries,
                                                            YearMonth anniversary) {
        Instant windowStart = calendar.lateWindowStart(anniversary);
        List<MonetaryCorrection> candidates = new ArrayList<>();
        for (int year : new int[]{anniversary.getYear(), anniversary.getYear() + 1}) {
            indexEntries.stream()
                    .filter(c -> c.period().orElseThrow().getYear() == year)
                    .forEach(candidates::add);
        }

        for (MonetaryCorrection candidate : candidates) {
            if (!candidate.effectiveDate().orElseThrow().isAfter(windowStart)) {
                continue;
            }
            long lag = calendar.monthsBetween(anniversary, candidate.period().orElseThrow());
            if (lag < properties.getMaxLagMonths()) {
                return Optional.of(candidate);
            }
            log.warn("Ignoring {} correction of {} for anniversary {}: {} months late",
                    candidate.getType(), candidate.period().orElseThrow(), anniversary, lag);
        }
        return Optional.empty();
    }

    private OutOfPeriodCorrection describeLateCorrection(CostAccount account, MonetaryCorrection correction,
                                                         YearMonth anniversary) {
        Instant deadline = calendar.deadline(anniversary);
        Instant appliedAt = correction.effectiveDate().orElseThrow();
        YearMonth appliedPeriod = correction.period().orElseThrow();
        IndexType indexType = correction.getType().indexType().orElseThrow();

        List<InterveningChange> changes = account.correctionsOrEmpty().stream()
                .filter(c -> !c.isIndexCorrection() && c.effectiveDate().isPresent())
                .filter(c -> !c.effectiveDate().get().isBefore(deadline) && !c.effectiveDate().get().isAfter(appliedAt))
                .sorted(Comparator.comparing(c -> c.effectiveDate().orElseThrow()))
                .map(this::toInterveningChange)
                .toList();

        BigDecimal appliedRate = correction.rateOrOne();
        BigDecimal expectedRate = rateRepository.findFactor(indexType, calendar.ratePeriod(anniversary)).orElse(null);
        BigDecimal rateDifference = expectedRate == null
                ? BigDecimal.ZERO
                : appliedRate.subtract(expectedRate).abs();
        boolean needsAdjustment = expectedRate == null || rateDifference.compareTo(properties.getRateTolerance()) > 0;

        BigDecimal baseBefore;
        BigDecimal baseAtApplication;
        if (changes.isEmpty()) {
            baseBefore = Money.orZero(correction.getOriginalValueBeforeCorrection());
            baseAtApplication = baseBefore;
        } else if (changes.size() == 1) {
            baseBefore = changes.get(0).getValueBefore();
            baseAtApplication = changes.get(0).getValueAfter();
        } else {
            BigDecimal reconstructed = account.currentValue();
            for (int i = changes.size() - 1; i >= 0; i--) {
                reconstructed = reconstructed.subtract(changes.get(i).getImpact());
            }
            baseBefore = reconstructed;
            baseAtApplication = reconstructed;
        }

        long delayDays = Duration.between(deadline, appliedAt).toDays();
        log.debug("{}: anniversary {} corrected late on {} ({} days, {} intervening change(s))",
                account.getId(), anniversary, appliedPeriod, delayDays, changes.size());

        return OutOfPeriodCorrection.builder()
                .anniversaryYear(anniversary.getYear())
                .anniversaryMonth(anniversary.getMonthValue())
                .appliedYear(appliedPeriod.getYear())
                .appliedMonth(appliedPeriod.getMonthValue())
                .deadline(deadline)
                .appliedAt(appliedAt)
                .delayDays(delayDays)
                .indexType(indexType)
                .appliedRate(appliedRate)
                .expectedRate(expectedRate)
                .rateDifference(rateDifference)
                .needsAdjustment(needsAdjustment)
                .interveningChanges(changes)
                .baseValueBeforeChanges(baseBefore)
                .baseValueAtApplication(baseAtApplication)
                .build();
    }

    private InterveningChange toInterveningChange(MonetaryCorrection change) {
        BigDecimal before = Money.orZero(change.getOriginalValueBeforeCorrection());
        BigDecimal after = change.getRecognizedValueWithOverhead();
        BigDecimal impact = after.subtract(before);
        BigDecimal impactPercent = before.signum() > 0
                ? impact.multiply(BigDecimal.valueOf(100)).divide(before, Money.SCALE, Money.ROUNDING)
                : BigDecimal.ZERO;
        return InterveningChange.builder()
                .type(change.getType())
                .appliedAt(change.effectiveDate().orElseThrow())
                .valueBefore(before)
                .valueAfter(after)
                .impact(impact)
                .impactPercent(impactPercent)
                .build();
    }

    private Optional<Gap> buildGap(CostAccount account, YearMonth anniversary, Instant now) {
        Instant deadline = calendar.deadline(anniversary);
        BigDecimal base = account.correctionsOrEmpty().stream()
                .filter(c -> c.effectiveDate().isPresent() && c.effectiveDate().get().isBefore(deadline))
                .max(Comparator.comparing(c -> c.effectiveDate().orElseThrow()))
                .map(MonetaryCorrection::getRecognizedValueWithOverhead)
                .orElseGet(account::rootValue);

        if (!Money.isPositive(base)) {
            log.warn("{}: skipping gap {} because its base value is {}", account.getId(),
                    Periods.label(anniversary), base);
            return Optional.empty();
        }

        YearMonth ratePeriod = calendar.ratePeriod(anniversary);
        return Optional.of(Gap.builder()
                .year(anniversary.getYear())
                .month(anniversary.getMonthValue())
                .rateYear(ratePeriod.getYear())
                .rateMonth(ratePeriod.getMonthValue())
                .baseValue(base)
                .deadline(deadline)
                .priority(calendar.priority(anniversary, now))
                .build());
    }
}
