package com.kreasipositif.ipcacorrection.engine;

import com.kreasipositif.ipcacorrection.analysis.AnniversaryCalendar;
import com.kreasipositif.ipcacorrection.config.CorrectionProperties;
import com.kreasipositif.ipcacorrection.domain.CascadeStep;
import com.kreasipositif.ipcacorrection.domain.CorrectionEntryType;
import com.kreasipositif.ipcacorrection.domain.CorrectionProposal;
import com.kreasipositif.ipcacorrection.domain.CostAccount;
import com.kreasipositif.ipcacorrection.domain.DuplicateCorrection;
import com.kreasipositif.ipcacorrection.domain.Gap;
import com.kreasipositif.ipcacorrection.domain.IndexType;
import com.kreasipositif.ipcacorrection.domain.Money;
import com.kreasipositif.ipcacorrection.domain.MonetaryCorrection;
import com.kreasipositif.ipcacorrection.domain.OutOfPeriodCorrection;
import com.kreasipositif.ipcacorrection.domain.Periods;
import com.kreasipositif.ipcacorrection.domain.ProposalType;
import com.kreasipositif.ipcacorrection.domain.Scenario;
import com.kreasipositif.ipcacorrection.exception.CorrectionApplyException;
import com.kreasipositif.ipcacorrection.repository.CostAccountRepository;
import com.kreasipositif.ipcacorrection.repository.RateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Computes correction proposals for each scenario and applies approved proposal sets.
 *
 * <p>All amounts are {@link BigDecimal} rounded to {@link Money#SCALE} places, half-up. Applying
 * never touches the source record: the rebuilt account is saved as a corrected copy.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CorrectionEngine {

    static final String RULE_GAP_ONLY = "CENARIO_0_GAP_SIMPLES";
    static final String RULE_GAP_WITH_LATER = "CENARIO_1_GAP_COM_POSTERIOR";
    static final String RULE_GAP_WITH_RECOVERY = "CENARIO_2_GAP_COM_RECUPERACAO";
    static final String RULE_DUPLICATES = "CENARIO_DUPLICATAS_REMOCAO";
    static final String RULE_CURRENT_YEAR = "IPCA_VIGENTE";

    static final String PERIOD_COMPENSATION = "COMPENSACAO";
    static final String PERIOD_REACTIVATION = "REATIVACAO";
    static final String PERIOD_ADJUSTMENT = "AJUSTE";
    static final String PERIOD_CHANGE_ORDER = "CHANGE_ORDER";

    static final String DESC_GAP = "Correção IPCA faltante para %s";
    static final String DESC_MISSING_RATE = "Taxa IPCA não encontrada para %s";
    static final String DESC_UPDATE = "Recálculo de correção %s %s";
    static final String DESC_CURRENT_YEAR = "Correção IPCA vigente para %s";
    static final String DESC_CHANGE_ORDER = "Antecipação da retificação para antes da correção vigente de %s";
    static final String DESC_REACTIVATION = "Reativação da CCO - flgRecuperado: true → false";
    static final String DESC_DUPLICATE_REMOVAL = "Remoção de correção %s duplicada em %s (posição %d)";
    static final String DESC_DUPLICATE_ADJUSTMENT = "Ajuste compensatório por remoção de %d duplicata(s). Efeito cascata: %s";
    static final String DESC_DUPLICATE_CASCADE = "%s: R$ %s → R$ %s (%d correção(ões) posterior(es))";
    static final String DESC_COMPENSATION = "Compensação por gaps IPCA/IGPM aplicados após recuperação. Valor base gaps: R$ %s";
    static final String DESC_COMPENSATION_NO_CASCADE = ". Nenhuma correção posterior identificada";
    static final String DESC_COMPENSATION_CASCADE = ". Efeito cascata aplicado sobre %d correção(ões) posterior(es): %s";
    static final String DESC_COMPENSATION_STEP = "%s (taxa %s): R$ %s → R$ %s";
    static final String DESC_COMPENSATION_FINAL = ". Compensação final: R$ ";

    private final RateRepository rateRepository;
    private final AnniversaryCalendar calendar;
    private final CorrectionEntryFactory entryFactory;
    private final CostAccountRepository costAccountRepository;
    private final CorrectionProperties properties;
    private final Clock clock;

    // ─── Proposal calculation ────────────────────────────────────────────────────

    /**
     * Missing anniversaries only: one IPCA addition per gap, each chained on the previous result.
     */
    public List<CorrectionProposal> calculateScenario0(CostAccount account, List<Gap> gaps) {
        return proposalsOf(calculateGapCorrections(account, gaps, Scenario.CENARIO_0, RULE_GAP_ONLY));
    }

    /**
     * Gaps plus recalculation of every later index correction whose base missed the gap impacts.
     */
    public List<CorrectionProposal> calculateScenario1(CostAccount account, List<Gap> gaps,
                                                       List<OutOfPeriodCorrection> outOfPeriod) {
        List<GapCorrection> gapCorrections =
                calculateGapCorrections(account, gaps, Scenario.CENARIO_1, RULE_GAP_WITH_LATER);
        List<CorrectionProposal> proposals = new ArrayList<>(proposalsOf(gapCorrections));
        if (gapCorrections.isEmpty()) {
            return proposals;
        }

        Instant earliestGapStart = gapCorrections.stream()
                .map(gc -> Periods.startOfDay(gc.gap().period(), 1))
                .min(Comparator.naturalOrder())
                .orElseThrow();
        Set<YearMonth> updatedPeriods = new HashSet<>();

        for (MonetaryCorrection entry : account.correctionsOrEmpty()) {
            if (!entry.isIndexCorrection() || entry.effectiveDate().isEmpty()
                    || !entry.effectiveDate().get().isAfter(earliestGapStart)) {
                continue;
            }
            YearMonth period = entry.period().orElseThrow();
            List<GapCorrection> prior = resolvedGapsBefore(gapCorrections, period);
            if (prior.isEmpty() || !updatedPeriods.add(period)) {
                continue;
            }
            BigDecimal incorrectBase = Money.orZero(entry.getOriginalValueBeforeCorrection());
            BigDecimal correctBase = incorrectBase.add(sumImpacts(prior));
            BigDecimal rate = entry.rateOrOne();
            BigDecimal newValue = Money.multiply(correctBase, rate);
            BigDecimal currentValue = entry.getRecognizedValueWithOverhead();
            proposals.add(updateProposal(entry.getType().name(), period, entry.effectiveDate().get(),
                    correctBase, currentValue, newValue, rate, prior));
        }

        for (OutOfPeriodCorrection late : outOfPeriod) {
            YearMonth period = late.appliedPeriod();
            if (updatedPeriods.contains(period)) {
                log.debug("{}: late correction {} already recalculated from the timeline", account.getId(), period);
                continue;
            }
            List<GapCorrection> prior = resolvedGapsBefore(gapCorrections, period);
            if (prior.isEmpty()) {
                continue;
            }
            updatedPeriods.add(period);
            BigDecimal incorrectBase = Money.orZero(late.getBaseValueAtApplication());
            BigDecimal correctBase = incorrectBase.add(sumImpacts(prior));
            BigDecimal rate = late.getAppliedRate();
            BigDecimal oldValue = Money.multiply(incorrectBase, rate);
            BigDecimal newValue = Money.multiply(correctBase, rate);
            proposals.add(updateProposal(late.getIndexType().name(), period, late.getAppliedAt(),
                    correctBase, oldValue, newValue, rate, prior));
        }

        log.info("{}: scenario 1 produced {} proposal(s)", account.getId(), proposals.size());
        return proposals;
    }

    /**
     * Gaps on a recovered account: the gap impacts that predate the recovery are carried through
     * every later index rate and paid back as a compensation, then the account is reactivated.
     */
    public List<CorrectionProposal> calculateScenario2(CostAccount account, List<Gap> gaps) {
        List<GapCorrection> gapCorrections =
                calculateGapCorrections(account, gaps, Scenario.CENARIO_2, RULE_GAP_WITH_RECOVERY);
        List<CorrectionProposal> proposals = new ArrayList<>(proposalsOf(gapCorrections));

        Optional<Instant> latestRecovery = account.correctionsOrEmpty().stream()
                .filter(c -> c.getType() == CorrectionEntryType.RECUPERACAO)
                .map(MonetaryCorrection::effectiveDate)
                .flatMap(Optional::stream)
                .max(Comparator.naturalOrder());

        if (latestRecovery.isPresent() && !gapCorrections.isEmpty()) {
            List<GapCorrection> prior = gapCorrections.stream()
                    .filter(gc -> !gc.proposal().isUnresolvable())
                    .filter(gc -> Periods.startOfDay(gc.gap().period(), 1).isBefore(latestRecovery.get()))
                    .filter(gc -> Money.isPositive(gc.proposal().getImpact()))
                    .toList();
            BigDecimal gapTotal = sumImpacts(prior);
            if (Money.isPositive(gapTotal)) {
                proposals.add(compensationProposal(account, prior, gapTotal));
            }
        }

        BigDecimal totalImpact = proposals.stream()
                .map(CorrectionProposal::getImpact)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        if (account.isRecovered() && Money.isPositive(totalImpact)) {
            BigDecimal balance = proposals.stream()
                    .filter(p -> p.getType().isIndexProposal())
                    .map(CorrectionProposal::getImpact)
                    .reduce(BigDecimal.ZERO, BigDecimal::add);
            proposals.add(reactivationProposal(Scenario.CENARIO_2, balance, RULE_GAP_WITH_RECOVERY));
        }

        log.info("{}: scenario 2 produced {} proposal(s)", account.getId(), proposals.size());
        return proposals;
    }

    /**
     * One removal per duplicated entry and a single adjustment for what the duplicates earned
     * through the rates applied after them.
     */
    public List<CorrectionProposal> calculateDuplicates(CostAccount account, List<DuplicateCorrection> duplicates) {
        List<MonetaryCorrection> corrections = account.correctionsOrEmpty();
        List<CorrectionProposal> proposals = new ArrayList<>();
        List<String> removalIds = new ArrayList<>();
        List<String> cascadeDetails = new ArrayList<>();
        BigDecimal totalRemoved = BigDecimal.ZERO;
        BigDecimal compensation = BigDecimal.ZERO;

        for (DuplicateCorrection duplicate : duplicates) {
            Instant duplicateDate = duplicate.getDuplicatedCorrection().effectiveDate().orElseThrow();
            List<MonetaryCorrection> later = new ArrayList<>();
            for (int i = duplicate.getIndex() + 1; i < corrections.size(); i++) {
                MonetaryCorrection c = corrections.get(i);
                if (c.isIndexCorrection() && c.effectiveDate().filter(d -> d.isAfter(duplicateDate)).isPresent()) {
                    later.add(c);
                }
            }
            BigDecimal value = duplicate.getDuplicatedValue();
            CascadeResult cascade = CascadeCalculator.cascade(value, later);
            compensation = compensation.add(cascade.getFinalValue());
            totalRemoved = totalRemoved.add(value);
            cascadeDetails.add(DESC_DUPLICATE_CASCADE.formatted(
                    duplicate.periodLabel(), value.toPlainString(),
                    cascade.getFinalValue().toPlainString(), later.size()));

            CorrectionProposal removal = CorrectionProposal.builder()
                    .id(newId())
                    .type(ProposalType.DUPLICATA_REMOVAL)
                    .scenario(Scenario.CENARIO_DUPLICATAS)
                    .targetDate(duplicateDate)
                    .targetPeriod(duplicate.periodLabel())
                    .currentValue(value)
                    .proposedValue(BigDecimal.ZERO)
                    .impact(value.negate())
                    .rateApplied(BigDecimal.ONE)
                    .description(DESC_DUPLICATE_REMOVAL.formatted(
                            duplicate.getDuplicatedCorrection().getType(), duplicate.periodLabel(),
                            duplicate.getIndex()))
                    .businessRule(RULE_DUPLICATES)
                    .indexToRemove(duplicate.getIndex())
                    .cascadeSteps(cascade.getSteps())
                    .build();
            removalIds.add(removal.getId());
            proposals.add(removal);
        }

        if (Money.isPositive(totalRemoved) || Money.isPositive(compensation)) {
            BigDecimal adjustment = compensation.max(totalRemoved);
            proposals.add(CorrectionProposal.builder()
                    .id(newId())
                    .type(ProposalType.DUPLICATA_ADJUSTMENT)
                    .scenario(Scenario.CENARIO_DUPLICATAS)
                    .targetDate(clock.instant())
                    .targetPeriod(PERIOD_ADJUSTMENT)
                    .currentValue(BigDecimal.ZERO)
                    .proposedValue(adjustment.negate())
                    .impact(compensation.negate())
                    .rateApplied(BigDecimal.ONE)
                    .description(DESC_DUPLICATE_ADJUSTMENT.formatted(
                            duplicates.size(), String.join("; ", cascadeDetails)))
                    .dependencies(removalIds)
                    .businessRule(RULE_DUPLICATES)
                    .build());
        }

        BigDecimal remaining = account.currentValue().subtract(compensation);
        if (account.isRecovered() && remaining.signum() != 0) {
            proposals.add(reactivationProposal(Scenario.CENARIO_DUPLICATAS, remaining, RULE_DUPLICATES));
        }

        log.info("{}: {} duplicate(s) produced {} proposal(s), compensation {}", account.getId(),
                duplicates.size(), proposals.size(), compensation.toPlainString());
        return proposals;
    }

    /**
     * Checks whether this year's anniversary is due and still uncorrected.
     */
    public CurrentYearAssessment assessCurrentYear(CostAccount account) {
        BigDecimal currentValue = account.currentValue();
        if (!Money.isPositive(currentValue)) {
            return CurrentYearAssessment.notApplicable(
                    "Balance is %s; nothing to correct.".formatted(currentValue.toPlainString()), null);
        }
        Optional<YearMonth> recognition = account.recognitionPeriod();
        if (recognition.isEmpty()) {
            return CurrentYearAssessment.notApplicable("Cost account has no recognition date.", null);
        }

        Instant now = clock.instant();
        LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);
        YearMonth anniversary = calendar.anniversaryIn(today.getYear(), recognition.get());
        Instant dueDate = calendar.currentYearDueDate(anniversary);

        if (anniversary.isBefore(calendar.firstAnniversary(recognition.get()))) {
            return CurrentYearAssessment.notApplicable(
                    "First anniversary %s is after %s.".formatted(
                            Periods.label(calendar.firstAnniversary(recognition.get())), Periods.label(anniversary)),
                    dueDate);
        }
        if (now.isBefore(dueDate)) {
            return CurrentYearAssessment.notApplicable(
                    "Anniversary %s not reached yet.".formatted(Periods.label(anniversary)), dueDate);
        }
        boolean alreadyCorrected = account.correctionsOrEmpty().stream()
                .filter(MonetaryCorrection::isIndexCorrection)
                .anyMatch(c -> c.period().filter(anniversary::equals).isPresent());
        if (alreadyCorrected) {
            return CurrentYearAssessment.notApplicable(
                    "Anniversary %s already has an index correction.".formatted(Periods.label(anniversary)),
                    dueDate);
        }
        YearMonth ratePeriod = calendar.ratePeriod(anniversary);
        Optional<BigDecimal> rate = rateRepository.findFactor(IndexType.IPCA, ratePeriod);
        if (rate.isEmpty()) {
            return CurrentYearAssessment.notApplicable(
                    "IPCA rate for %s is not available.".formatted(Periods.label(ratePeriod)), dueDate);
        }

        BigDecimal proposedValue = Money.multiply(currentValue, rate.get());
        CurrentYearAssessment.CurrentYearAssessmentBuilder assessment = CurrentYearAssessment.builder()
                .applicable(true)
                .reason("Anniversary %s is due.".formatted(Periods.label(anniversary)))
                .anniversaryDate(dueDate)
                .proposal(CorrectionProposal.builder()
                        .id(newId())
                        .type(ProposalType.IPCA_ADDITION)
                        .scenario(Scenario.CENARIO_IPCA_VIGENTE)
                        .targetDate(calendar.gapEntryDate(anniversary))
                        .targetPeriod(Periods.label(anniversary))
                        .baseValue(currentValue)
                        .currentValue(currentValue)
                        .proposedValue(proposedValue)
                        .impact(proposedValue.subtract(currentValue))
                        .rateApplied(rate.get())
                        .rateReferencePeriod(Periods.label(ratePeriod))
                        .description(DESC_CURRENT_YEAR.formatted(Periods.label(anniversary)))
                        .businessRule(RULE_CURRENT_YEAR)
                        .build());

        account.lastCorrection()
                .filter(last -> last.getType() == CorrectionEntryType.RETIFICACAO)
                .ifPresent(last -> assessment.proposal(CorrectionProposal.builder()
                        .id(newId())
                        .type(ProposalType.CORRECTION_DATE_CHANGE)
                        .scenario(Scenario.CENARIO_IPCA_VIGENTE)
                        .targetDate(calendar.lateWindowStart(anniversary))
                        .targetPeriod(PERIOD_CHANGE_ORDER)
                        .currentValue(BigDecimal.ZERO)
                        .proposedValue(BigDecimal.ZERO)
                        .impact(BigDecimal.ZERO)
                        .description(DESC_CHANGE_ORDER.formatted(Periods.label(anniversary)))
                        .businessRule(RULE_CURRENT_YEAR)
                        .build()));

        return assessment.build();
    }

    // ─── Apply ───────────────────────────────────────────────────────────────────

    /**
     * Applies an approved proposal set and persists the corrected copy.
     *
     * @throws CorrectionApplyException when the set cannot be applied to the account
     */
    public AppliedCorrection apply(Scenario scenario, CostAccount account, List<CorrectionProposal> approved,
                                   String sessionId) {
        AppliedCorrection applied = switch (scenario) {
            case CENARIO_0, CENARIO_1, CENARIO_2 -> applyTimelineRebuild(account, approved, sessionId);
            case CENARIO_DUPLICATAS -> applyDuplicateRemoval(account, approved, sessionId);
            case CENARIO_IPCA_VIGENTE -> applyCurrentYear(account, approved, sessionId);
            case CENARIO_CORRECAO_FORA_APENAS, CENARIO_COMPLEXO ->
                    throw new CorrectionApplyException("Scenario %s has no automatic correction.".formatted(scenario));
        };
        CostAccount saved = costAccountRepository.saveCorrected(applied.getCorrectedAccount());
        log.info("Session {}: {} applied to {} as {} (+{} / ~{} / -{} entries, reactivated={})", sessionId,
                scenario, account.getId(), saved.getId(), applied.getEntriesAdded(), applied.getEntriesUpdated(),
                applied.getEntriesRemoved(), applied.isReactivated());
        return AppliedCorrection.builder()
                .correctedAccount(saved)
                .entriesAdded(applied.getEntriesAdded())
                .entriesUpdated(applied.getEntriesUpdated())
                .entriesRemoved(applied.getEntriesRemoved())
                .reactivated(applied.isReactivated())
                .build();
    }

    private AppliedCorrection applyTimelineRebuild(CostAccount account, List<CorrectionProposal> approved,
                                                   String sessionId) {
        Instant now = clock.instant();
        List<MonetaryCorrection> insertions = new ArrayList<>();
        List<CorrectionUpdate> updates = new ArrayList<>();
        for (CorrectionProposal proposal : approved) {
            if (proposal.isUnresolvable()) {
                throw new CorrectionApplyException("Proposal %s cannot be applied: %s"
                        .formatted(proposal.getId(), proposal.getError()));
            }
            switch (proposal.getType()) {
                case IPCA_ADDITION -> insertions.add(entryFactory.gapEntry(account, proposal));
                case COMPENSATION -> insertions.add(entryFactory.compensationEntry(account, proposal));
                case IPCA_UPDATE -> updates.add(CorrectionUpdate.builder()
                        .period(Periods.parseLabel(proposal.getTargetPeriod()))
                        .newValue(proposal.getProposedValue())
                        .newBase(proposal.getBaseValue())
                        .observation("%s - Recalculado em %s".formatted(proposal.getDescription(), entryFactory.today()))
                        .updatedAt(now)
                        .build());
                default -> log.debug("{} handled outside the timeline", proposal.getType());
            }
        }

        List<MonetaryCorrection> merged =
                CorrectionTimelineMerger.merge(account.correctionsOrEmpty(), insertions, updates);
        boolean reactivated = account.isRecovered()
                && approved.stream().anyMatch(p -> p.getType() == ProposalType.REACTIVATION);

        return AppliedCorrection.builder()
                .correctedAccount(correctedCopy(account, AccumulatedIndexCalculator.rederive(merged),
                        account.isRecovered() && !reactivated, sessionId))
                .entriesAdded(merged.size() - account.correctionsOrEmpty().size())
                .entriesUpdated(updates.size())
                .reactivated(reactivated)
                .build();
    }

    private AppliedCorrection applyDuplicateRemoval(CostAccount account, List<CorrectionProposal> approved,
                                                    String sessionId) {
        List<MonetaryCorrection> corrections = new ArrayList<>(account.correctionsOrEmpty());
        List<CorrectionProposal> removals = approved.stream()
                .filter(p -> p.getType() == ProposalType.DUPLICATA_REMOVAL)
                .sorted(Comparator.comparing(CorrectionProposal::getIndexToRemove).reversed())
                .toList();
        List<String> removedPeriods = new ArrayList<>();
        for (CorrectionProposal removal : removals) {
            int index = removal.getIndexToRemove();
            if (index < 0 || index >= corrections.size()) {
                throw new CorrectionApplyException("Duplicate index %d is outside a timeline of %d entries."
                        .formatted(index, corrections.size()));
            }
            corrections.remove(index);
            removedPeriods.add(0, removal.getTargetPeriod());
        }

        BigDecimal adjustmentTotal = approved.stream()
                .filter(p -> p.getType() == ProposalType.DUPLICATA_ADJUSTMENT)
                .map(CorrectionProposal::getProposedValue)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        int added = 0;
        if (adjustmentTotal.signum() != 0) {
            CostAccount afterRemoval = account.toBuilder().corrections(corrections).build();
            corrections.add(entryFactory.duplicateAdjustmentEntry(afterRemoval, adjustmentTotal, removedPeriods));
            added = 1;
        }

        List<MonetaryCorrection> rederived = AccumulatedIndexCalculator.rederive(corrections);
        BigDecimal finalValue = account.toBuilder().corrections(rederived).build().currentValue();
        boolean reactivated = account.isRecovered()
                && finalValue.signum() != 0
                && approved.stream().anyMatch(p -> p.getType() == ProposalType.REACTIVATION);

        return AppliedCorrection.builder()
                .correctedAccount(correctedCopy(account, rederived, account.isRecovered() && !reactivated, sessionId))
                .entriesAdded(added)
                .entriesRemoved(removals.size())
                .reactivated(reactivated)
                .build();
    }

    private AppliedCorrection applyCurrentYear(CostAccount account, List<CorrectionProposal> approved,
                                               String sessionId) {
        List<CorrectionProposal> additions = approved.stream()
                .filter(p -> p.getType() == ProposalType.IPCA_ADDITION)
                .toList();
        if (additions.size() > 1) {
            throw new CorrectionApplyException(
                    "Only one current-year correction can be applied, got %d.".formatted(additions.size()));
        }

        List<MonetaryCorrection> corrections = new ArrayList<>(account.correctionsOrEmpty());
        int updated = 0;
        Optional<CorrectionProposal> dateChange = approved.stream()
                .filter(p -> p.getType() == ProposalType.CORRECTION_DATE_CHANGE)
                .findFirst();
        if (dateChange.isPresent() && !corrections.isEmpty()) {
            int last = corrections.size() - 1;
            corrections.set(last, corrections.get(last).toBuilder()
                    .correctionDate(dateChange.get().getTargetDate())
                    .build());
            updated = 1;
        }
        additions.forEach(p -> corrections.add(entryFactory.currentYearEntry(account, p)));

        return AppliedCorrection.builder()
                .correctedAccount(correctedCopy(account, AccumulatedIndexCalculator.rederive(corrections),
                        account.isRecovered(), sessionId))
                .entriesAdded(additions.size())
                .entriesUpdated(updated)
                .build();
    }

    private CostAccount correctedCopy(CostAccount account, List<MonetaryCorrection> corrections, boolean recovered,
                                      String sessionId) {
        String sourceId = account.getSourceEntityId() != null ? account.getSourceEntityId() : account.getId();
        return account.toBuilder()
                .id(sourceId + properties.getCorrectedIdSuffix())
                .corrections(new ArrayList<>(corrections))
                .recovered(recovered)
                .sourceEntityId(sourceId)
                .correctionSessionId(sessionId)
                .correctedAt(clock.instant())
                .build();
    }

    // ─── Internal helpers ────────────────────────────────────────────────────────

    private List<GapCorrection> calculateGapCorrections(CostAccount account, List<Gap> gaps, Scenario scenario,
                                                        String rule) {
        List<Gap> ordered = gaps.stream().sorted(Comparator.comparing(Gap::period)).toList();
        List<GapCorrection> results = new ArrayList<>();
        BigDecimal previousCorrected = null;

        for (Gap gap : ordered) {
            BigDecimal base = previousCorrected != null ? previousCorrected : gap.getBaseValue();
            if (!Money.isPositive(base)) {
                log.warn("{}: gap {} skipped, base value {}", account.getId(), gap.periodLabel(), base);
                continue;
            }
            YearMonth ratePeriod = gap.ratePeriod();
            Optional<BigDecimal> rate = rateRepository.findFactor(IndexType.IPCA, ratePeriod);
            CorrectionProposal.CorrectionProposalBuilder proposal = CorrectionProposal.builder()
                    .id(newId())
                    .type(ProposalType.IPCA_ADDITION)
                    .scenario(scenario)
                    .targetDate(calendar.gapEntryDate(gap.period()))
                    .targetPeriod(gap.periodLabel())
                    .rateReferencePeriod(Periods.label(ratePeriod))
                    .description(DESC_GAP.formatted(gap.periodLabel()))
                    .businessRule(rule);

            if (rate.isEmpty()) {
                log.warn("{}: IPCA rate for {} missing, gap {} cannot be computed", account.getId(),
                        Periods.label(ratePeriod), gap.periodLabel());
                results.add(new GapCorrection(gap, proposal
                        .baseValue(BigDecimal.ZERO)
                        .currentValue(BigDecimal.ZERO)
                        .proposedValue(BigDecimal.ZERO)
                        .impact(BigDecimal.ZERO)
                        .rateApplied(BigDecimal.ZERO)
                        .error(DESC_MISSING_RATE.formatted(Periods.label(ratePeriod)))
                        .build()));
                // later gaps restart from their own base instead of compounding over the hole
                previousCorrected = null;
                continue;
            }

            BigDecimal corrected = Money.multiply(base, rate.get());
            results.add(new GapCorrection(gap, proposal
                    .baseValue(base)
                    .currentValue(base)
                    .proposedValue(corrected)
                    .impact(corrected.subtract(base))
                    .rateApplied(rate.get())
                    .build()));
            previousCorrected = corrected;
        }
        return results;
    }

    private CorrectionProposal updateProposal(String indexName, YearMonth period, Instant targetDate,
                                              BigDecimal correctBase, BigDecimal currentValue, BigDecimal newValue,
                                              BigDecimal rate, List<GapCorrection> prior) {
        return CorrectionProposal.builder()
                .id(newId())
                .type(ProposalType.IPCA_UPDATE)
                .scenario(Scenario.CENARIO_1)
                .targetDate(targetDate)
                .targetPeriod(Periods.label(period))
                .baseValue(correctBase)
                .currentValue(currentValue)
                .proposedValue(newValue)
                .impact(newValue.subtract(currentValue))
                .rateApplied(rate)
                .rateReferencePeriod(Periods.label(calendar.ratePeriod(period)))
                .description(DESC_UPDATE.formatted(indexName, Periods.label(period)))
                .dependencies(prior.stream().map(gc -> gc.proposal().getId()).toList())
                .businessRule(RULE_GAP_WITH_LATER)
                .build();
    }

    private CorrectionProposal compensationProposal(CostAccount account, List<GapCorrection> prior,
                                                    BigDecimal gapTotal) {
        Instant latestGapStart = prior.stream()
                .map(gc -> Periods.startOfDay(gc.gap().period(), 1))
                .max(Comparator.naturalOrder())
                .orElseThrow();
        List<MonetaryCorrection> subsequent = account.correctionsOrEmpty().stream()
                .filter(MonetaryCorrection::isIndexCorrection)
                .filter(c -> c.effectiveDate().filter(d -> d.isAfter(latestGapStart)).isPresent())
                .sorted(Comparator.comparing(c -> c.effectiveDate().orElseThrow()))
                .toList();
        CascadeResult cascade = CascadeCalculator.cascade(gapTotal, subsequent);
        for (CascadeStep step : cascade.getSteps()) {
            log.debug("{}: cascade {} × {}: {} → {} (+{})", account.getId(), step.getPeriod(), step.getRate(),
                    step.getValueBefore().toPlainString(), step.getValueAfter().toPlainString(),
                    step.increment().toPlainString());
        }

        StringBuilder description = new StringBuilder(
                DESC_COMPENSATION.formatted(gapTotal.toPlainString()));
        if (cascade.getSteps().isEmpty()) {
            description.append(DESC_COMPENSATION_NO_CASCADE);
        } else {
            description.append(DESC_COMPENSATION_CASCADE.formatted(
                    cascade.getSteps().size(), cascade.getSteps().stream()
                            .map(s -> DESC_COMPENSATION_STEP.formatted(s.getPeriod(),
                                    s.getRate().toPlainString(), s.getValueBefore().toPlainString(),
                                    s.getValueAfter().toPlainString()))
                            .collect(Collectors.joining("; "))));
        }
        description.append(DESC_COMPENSATION_FINAL).append(cascade.getFinalValue().toPlainString());

        return CorrectionProposal.builder()
                .id(newId())
                .type(ProposalType.COMPENSATION)
                .scenario(Scenario.CENARIO_2)
                .targetDate(clock.instant())
                .targetPeriod(PERIOD_COMPENSATION)
                .baseValue(gapTotal)
                .currentValue(BigDecimal.ZERO)
                .proposedValue(cascade.getFinalValue())
                .impact(cascade.getFinalValue())
                .rateApplied(BigDecimal.ONE)
                .description(description.toString())
                .dependencies(prior.stream().map(gc -> gc.proposal().getId()).toList())
                .businessRule(RULE_GAP_WITH_RECOVERY)
                .cascadeSteps(cascade.getSteps())
                .build();
    }

    private CorrectionProposal reactivationProposal(Scenario scenario, BigDecimal balance, String rule) {
        return CorrectionProposal.builder()
                .id(newId())
                .type(ProposalType.REACTIVATION)
                .scenario(scenario)
                .targetDate(clock.instant())
                .targetPeriod(PERIOD_REACTIVATION)
                .currentValue(BigDecimal.ZERO)
                .proposedValue(balance)
                .impact(BigDecimal.ZERO)
                .description(DESC_REACTIVATION)
                .businessRule(rule)
                .build();
    }

    private static List<GapCorrection> resolvedGapsBefore(List<GapCorrection> gapCorrections, YearMonth period) {
        return gapCorrections.stream()
                .filter(gc -> !gc.proposal().isUnresolvable())
                .filter(gc -> gc.gap().period().isBefore(period))
                .toList();
    }

    private static BigDecimal sumImpacts(List<GapCorrection> gapCorrections) {
        return gapCorrections.stream()
                .map(gc -> gc.proposal().getImpact())
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static List<CorrectionProposal> proposalsOf(List<GapCorrection> gapCorrections) {
        return gapCorrections.stream().map(GapCorrection::proposal).toList();
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }

    private record GapCorrection(Gap gap, CorrectionProposal proposal) {
    }
}
