package com.kreasipositif.ipcacorrection.service;

import com.kreasipositif.ipcacorrection.analysis.GapAnalyzer;
import com.kreasipositif.ipcacorrection.domain.CorrectionProposal;
import com.kreasipositif.ipcacorrection.domain.CorrectionSession;
import com.kreasipositif.ipcacorrection.domain.CostAccount;
import com.kreasipositif.ipcacorrection.domain.FinancialImpact;
import com.kreasipositif.ipcacorrection.domain.GapAnalysisResult;
import com.kreasipositif.ipcacorrection.domain.ProposalType;
import com.kreasipositif.ipcacorrection.domain.Scenario;
import com.kreasipositif.ipcacorrection.domain.SessionStatus;
import com.kreasipositif.ipcacorrection.domain.ValidationReport;
import com.kreasipositif.ipcacorrection.dto.AnalysisStartResponse;
import com.kreasipositif.ipcacorrection.dto.ApplyResponse;
import com.kreasipositif.ipcacorrection.dto.ApprovalResponse;
import com.kreasipositif.ipcacorrection.dto.CurrentYearEvaluation;
import com.kreasipositif.ipcacorrection.dto.ProposalGenerationResponse;
import com.kreasipositif.ipcacorrection.dto.SessionStatusResponse;
import com.kreasipositif.ipcacorrection.engine.AppliedCorrection;
import com.kreasipositif.ipcacorrection.engine.CorrectionEngine;
import com.kreasipositif.ipcacorrection.engine.CorrectionValidator;
import com.kreasipositif.ipcacorrection.engine.CurrentYearAssessment;
import com.kreasipositif.ipcacorrection.exception.CorrectionException;
import com.kreasipositif.ipcacorrection.exception.CorrectionSessionNotFoundException;
import com.kreasipositif.ipcacorrection.exception.CorrectionValidationException;
import com.kreasipositif.ipcacorrection.exception.CostAccountNotFoundException;
import com.kreasipositif.ipcacorrection.repository.CorrectionSessionStore;
import com.kreasipositif.ipcacorrection.repository.CostAccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * Drives a correction session through analysis, proposal, approval and application.
 *
 * <p>Lifecycle: {@code ANALYZING → PREVIEW → APPROVED → APPLIED}. A session may be rejected from
 * PREVIEW or APPROVED, and moves to ERROR when proposal generation or application fails. Every
 * call reloads the session and checks its status before touching it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CorrectionOrchestrator {

    private final CostAccountRepository costAccountRepository;
    private final CorrectionSessionStore sessionStore;
    private final GapAnalyzer gapAnalyzer;
    private final ScenarioClassifier scenarioClassifier;
    private final CorrectionEngine correctionEngine;
    private final CorrectionValidator correctionValidator;
    private final Clock clock;

    // ─── Public API ──────────────────────────────────────────────────────────────

    /**
     * Analyzes a cost account and opens a session for it.
     *
     * @throws CostAccountNotFoundException if the account does not exist
     */
    public AnalysisStartResponse startAnalysis(String entityId, String userId) {
        CostAccount account = loadSource(entityId);
        GapAnalysisResult analysis = gapAnalyzer.analyze(account);
        Scenario scenario = scenarioClassifier.classify(account, analysis);
        Instant now = clock.instant();

        CorrectionSession session = sessionStore.save(CorrectionSession.builder()
                .id(UUID.randomUUID().toString())
                .targetEntityId(entityId)
                .userId(userId)
                .status(SessionStatus.ANALYZING)
                .scenarioDetected(scenario)
                .gapsIdentified(new ArrayList<>(analysis.getGaps()))
                .correctionsOutOfPeriod(new ArrayList<>(analysis.getOutOfPeriodCorrections()))
                .duplicatesFound(new ArrayList<>(analysis.getDuplicates()))
                .createdAt(now)
                .updatedAt(now)
                .build());

        log.info("Session {} opened for {} by {}: scenario={}, gaps={}, outOfPeriod={}, duplicates={}",
                session.getId(), entityId, userId, scenario, analysis.getGaps().size(),
                analysis.getOutOfPeriodCorrections().size(), analysis.getDuplicates().size());

        return AnalysisStartResponse.builder()
                .sessionId(session.getId())
                .entityId(entityId)
                .status(session.getStatus())
                .scenario(scenario)
                .gapsCount(analysis.getGaps().size())
                .outOfPeriodCount(analysis.getOutOfPeriodCorrections().size())
                .duplicatesCount(analysis.getDuplicates().size())
                .autoCorrectable(scenario.isAutoCorrectable())
                .build();
    }

    /**
     * Computes proposals for the detected scenario and moves the session to PREVIEW.
     * Calling it again from PREVIEW recomputes the proposals and clears any approval.
     */
    public ProposalGenerationResponse generateProposals(String sessionId) {
        CorrectionSession session = loadSession(sessionId);
        requireStatus(session, "generate proposals", SessionStatus.ANALYZING, SessionStatus.PREVIEW);
        if (session.getScenarioDetected() == Scenario.CENARIO_IPCA_VIGENTE) {
            throw new CorrectionValidationException(
                    "Session %s was opened by a current-year evaluation; its proposals are fixed.".formatted(sessionId));
        }
        CostAccount account = loadSource(session.getTargetEntityId());

        List<CorrectionProposal> proposals;
        try {
            proposals = calculate(session, account);
        } catch (RuntimeException e) {
            markError(session, e);
            throw new CorrectionException("Proposal generation failed for session %s".formatted(sessionId), e);
        }

        FinancialImpact impact = summarizeImpact(proposals);
        ValidationReport report = correctionValidator.validate(proposals);
        session.setCorrectionsProposed(new ArrayList<>(proposals));
        session.setCorrectionsApproved(new LinkedHashSet<>());
        session.setFinancialImpact(impact);
        session.setValidationReport(report);
        session.setStatus(SessionStatus.PREVIEW);
        session.setUpdatedAt(clock.instant());
        sessionStore.save(session);

        log.info("Session {}: {} proposal(s) generated, total impact {}, {} warning(s), {} error(s)",
                sessionId, proposals.size(), impact.getTotalImpact().toPlainString(),
                report.getWarnings().size(), report.getErrors().size());

        return ProposalGenerationResponse.builder()
                .sessionId(sessionId)
                .status(session.getStatus())
                .scenario(session.getScenarioDetected())
                .proposals(proposals)
                .financialImpact(impact)
                .validationReport(report)
                .build();
    }

    /**
     * Records which proposals the user accepted.
     *
     * @throws CorrectionValidationException if an id is unknown or refers to a proposal that
     *                                       cannot be computed; the session is left untouched
     */
    public ApprovalResponse approveCorrections(String sessionId, List<String> proposalIds) {
        CorrectionSession session = loadSession(sessionId);
        requireStatus(session, "approve corrections", SessionStatus.PREVIEW, SessionStatus.APPROVED);

        List<String> unknown = proposalIds.stream()
                .filter(id -> session.findProposal(id).isEmpty())
                .toList();
        if (!unknown.isEmpty()) {
            throw new CorrectionValidationException(
                    "Unknown proposal id(s) for session %s: %s".formatted(sessionId, unknown));
        }
        List<String> unresolvable = proposalIds.stream()
                .filter(id -> session.findProposal(id).map(CorrectionProposal::isUnresolvable).orElse(false))
                .toList();
        if (!unresolvable.isEmpty()) {
            throw new CorrectionValidationException(
                    "Proposal(s) %s cannot be computed and cannot be approved.".formatted(unresolvable));
        }

        session.setCorrectionsApproved(new LinkedHashSet<>(proposalIds));
        session.setStatus(SessionStatus.APPROVED);
        session.setUpdatedAt(clock.instant());
        sessionStore.save(session);

        List<CorrectionProposal> approved = session.approvedProposals();
        BigDecimal total = finalPreviewTotal(approved);
        log.info("Session {}: {} proposal(s) approved, impact {}", sessionId, approved.size(), total.toPlainString());

        return ApprovalResponse.builder()
                .sessionId(sessionId)
                .status(session.getStatus())
                .approvedCount(approved.size())
                .approvedProposals(approved)
                .totalFinancialImpact(total)
                .validationReport(correctionValidator.validate(approved))
                .readyToApply(!approved.isEmpty())
                .build();
    }

    /**
     * Applies the approved proposals. A failure moves the session to ERROR and is reported in
     * the response rather than thrown; the same approved set can be applied again from ERROR
     * once the cause is fixed.
     */
    public ApplyResponse applyCorrections(String sessionId) {
        CorrectionSession session = loadSession(sessionId);
        requireStatus(session, "apply corrections", SessionStatus.APPROVED, SessionStatus.ERROR);
        List<CorrectionProposal> approved = session.approvedProposals();
        if (approved.isEmpty()) {
            throw new CorrectionValidationException("Session %s has no approved corrections.".formatted(sessionId));
        }
        CostAccount account = session.getScenarioDetected() == Scenario.CENARIO_IPCA_VIGENTE
                ? loadLatest(session.getTargetEntityId())
                : loadSource(session.getTargetEntityId());

        AppliedCorrection applied;
        try {
            applied = correctionEngine.apply(session.getScenarioDetected(), account, approved, sessionId);
        } catch (RuntimeException e) {
            markError(session, e);
            return ApplyResponse.builder()
                    .sessionId(sessionId)
                    .status(session.getStatus())
                    .success(false)
                    .appliedCount(0)
                    .errorMessage(session.getErrorMessage())
                    .build();
        }

        Instant now = clock.instant();
        session.setStatus(SessionStatus.APPLIED);
        session.setErrorMessage(null);
        session.setAppliedAt(now);
        session.setUpdatedAt(now);
        session.setCorrectedEntityId(applied.getCorrectedAccount().getId());
        sessionStore.save(session);

        return ApplyResponse.builder()
                .sessionId(sessionId)
                .status(session.getStatus())
                .success(true)
                .appliedAt(now)
                .correctedEntityId(applied.getCorrectedAccount().getId())
                .appliedCount(approved.size())
                .entriesAdded(applied.getEntriesAdded())
                .entriesUpdated(applied.getEntriesUpdated())
                .entriesRemoved(applied.getEntriesRemoved())
                .reactivated(applied.isReactivated())
                .build();
    }

    public SessionStatusResponse rejectSession(String sessionId) {
        CorrectionSession session = loadSession(sessionId);
        requireStatus(session, "reject", SessionStatus.PREVIEW, SessionStatus.APPROVED);
        session.setStatus(SessionStatus.REJECTED);
        session.setUpdatedAt(clock.instant());
        sessionStore.save(session);
        log.info("Session {} rejected", sessionId);
        return toStatus(session);
    }

    public SessionStatusResponse getSessionStatus(String sessionId) {
        return toStatus(loadSession(sessionId));
    }

    /**
     * Checks whether this year's anniversary correction is due. When it is, a session is opened
     * directly in PREVIEW with the proposals ready for approval.
     */
    public CurrentYearEvaluation evaluateCurrentYear(String entityId, String userId) {
        CostAccount account = loadLatest(entityId);
        CurrentYearAssessment assessment = correctionEngine.assessCurrentYear(account);
        if (!assessment.isApplicable()) {
            log.info("Current-year correction not applicable to {}: {}", entityId, assessment.getReason());
            return CurrentYearEvaluation.builder()
                    .entityId(entityId)
                    .applicable(false)
                    .reason(assessment.getReason())
                    .anniversaryDate(assessment.getAnniversaryDate())
                    .proposals(List.of())
                    .build();
        }

        List<CorrectionProposal> proposals = assessment.getProposals();
        FinancialImpact impact = summarizeImpact(proposals);
        Instant now = clock.instant();
        CorrectionSession session = sessionStore.save(CorrectionSession.builder()
                .id(UUID.randomUUID().toString())
                .targetEntityId(entityId)
                .userId(userId)
                .status(SessionStatus.PREVIEW)
                .scenarioDetected(Scenario.CENARIO_IPCA_VIGENTE)
                .correctionsProposed(new ArrayList<>(proposals))
                .financialImpact(impact)
                .validationReport(correctionValidator.validate(proposals))
                .createdAt(now)
                .updatedAt(now)
                .build());
        log.info("Session {} opened for current-year correction of {}", session.getId(), entityId);

        return CurrentYearEvaluation.builder()
                .entityId(entityId)
                .applicable(true)
                .reason(assessment.getReason())
                .sessionId(session.getId())
                .anniversaryDate(assessment.getAnniversaryDate())
                .proposals(proposals)
                .financialImpact(impact)
                .build();
    }

    /**
     * additions + updates + Σ duplicate adjustments; compensation is reported separately.
     */
    public static FinancialImpact summarizeImpact(List<CorrectionProposal> proposals) {
        BigDecimal additions = sumImpact(proposals, p -> p.getType() == ProposalType.IPCA_ADDITION);
        BigDecimal updates = sumImpact(proposals, p -> p.getType() == ProposalType.IPCA_UPDATE);
        BigDecimal compensation = sumImpact(proposals, p -> p.getType() == ProposalType.COMPENSATION);
        BigDecimal remove = proposals.stream()
                .filter(p -> p.getType() == ProposalType.DUPLICATA_ADJUSTMENT)
                .map(CorrectionProposal::getProposedValue)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return FinancialImpact.builder()
                .totalImpact(additions.add(updates).add(remove))
                .totalAdditions(additions)
                .totalUpdates(updates)
                .totalRemove(remove)
                .totalCompensation(compensation)
                .proposalsCount(proposals.size())
                .build();
    }

    // ─── Internal helpers ────────────────────────────────────────────────────────

    private List<CorrectionProposal> calculate(CorrectionSession session, CostAccount account) {
        Scenario scenario = session.getScenarioDetected();
        return switch (scenario) {
            case CENARIO_0 -> correctionEngine.calculateScenario0(account, session.getGapsIdentified());
            case CENARIO_1 -> correctionEngine.calculateScenario1(account, session.getGapsIdentified(),
                    session.getCorrectionsOutOfPeriod());
            case CENARIO_2 -> correctionEngine.calculateScenario2(account, session.getGapsIdentified());
            case CENARIO_DUPLICATAS -> correctionEngine.calculateDuplicates(account, session.getDuplicatesFound());
            case CENARIO_CORRECAO_FORA_APENAS, CENARIO_COMPLEXO, CENARIO_IPCA_VIGENTE -> {
                log.warn("Session {}: scenario {} is reported only, no proposals generated", session.getId(), scenario);
                yield List.of();
            }
        };
    }

    private static BigDecimal finalPreviewTotal(List<CorrectionProposal> approved) {
        boolean hasCompensation = approved.stream().anyMatch(p -> p.getType() == ProposalType.COMPENSATION);
        return hasCompensation
                ? sumImpact(approved, p -> p.getType() == ProposalType.COMPENSATION)
                : sumImpact(approved, p -> p.getType().isIndexProposal());
    }

    private static BigDecimal sumImpact(List<CorrectionProposal> proposals, Predicate<CorrectionProposal> filter) {
        return proposals.stream()
                .filter(filter)
                .map(CorrectionProposal::getImpact)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private void markError(CorrectionSession session, RuntimeException cause) {
        log.error("Session {} failed in status {}", session.getId(), session.getStatus(), cause);
        session.setStatus(SessionStatus.ERROR);
        session.setErrorMessage(cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName());
        session.setUpdatedAt(clock.instant());
        sessionStore.save(session);
    }

    private static void requireStatus(CorrectionSession session, String action, SessionStatus... allowed) {
        Set<SessionStatus> permitted = Set.of(allowed);
        if (!permitted.contains(session.getStatus())) {
            throw new CorrectionValidationException("Cannot %s: session %s is %s, expected one of %s".formatted(
                    action, session.getId(), session.getStatus(), Arrays.toString(allowed)));
        }
    }

    private CorrectionSession loadSession(String sessionId) {
        return sessionStore.findById(sessionId)
                .orElseThrow(() -> new CorrectionSessionNotFoundException(sessionId));
    }

    private CostAccount loadSource(String entityId) {
        return costAccountRepository.findById(entityId)
                .orElseThrow(() -> new CostAccountNotFoundException(entityId));
    }

    /** Latest corrected copy when one exists, otherwise the source record. */
    private CostAccount loadLatest(String entityId) {
        return costAccountRepository.findCorrectedBySourceId(entityId)
                .or(() -> costAccountRepository.findById(entityId))
                .orElseThrow(() -> new CostAccountNotFoundException(entityId));
    }

    private static SessionStatusResponse toStatus(CorrectionSession session) {
        return SessionStatusResponse.builder()
                .sessionId(session.getId())
                .entityId(session.getTargetEntityId())
                .userId(session.getUserId())
                .status(session.getStatus())
                .scenario(session.getScenarioDetected())
                .gapsCount(session.getGapsIdentified().size())
                .outOfPeriodCount(session.getCorrectionsOutOfPeriod().size())
                .duplicatesCount(session.getDuplicatesFound().size())
                .proposalsCount(session.getCorrectionsProposed().size())
                .approvedCount(session.getCorrectionsApproved().size())
                .financialImpact(session.getFinancialImpact())
                .createdAt(session.getCreatedAt())
                .updatedAt(session.getUpdatedAt())
                .appliedAt(session.getAppliedAt())
                .correctedEntityId(session.getCorrectedEntityId())
                .errorMessage(session.getErrorMessage())
                .build();
    }
}
