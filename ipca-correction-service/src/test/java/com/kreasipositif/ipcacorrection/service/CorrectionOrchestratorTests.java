package com.kreasipositif.ipcacorrection.service;

import com.kreasipositif.ipcacorrection.domain.CorrectionProposal;
import com.kreasipositif.ipcacorrection.domain.ProposalType;
import com.kreasipositif.ipcacorrection.domain.Scenario;
import com.kreasipositif.ipcacorrection.domain.SessionStatus;
import com.kreasipositif.ipcacorrection.exception.CorrectionSessionNotFoundException;
import com.kreasipositif.ipcacorrection.exception.CorrectionValidationException;
import com.kreasipositif.ipcacorrection.exception.CostAccountNotFoundException;
import com.kreasipositif.ipcacorrection.repository.memory.InMemoryCorrectionSessionStore;
import com.kreasipositif.ipcacorrection.repository.memory.InMemoryCostAccountRepository;
import com.kreasipositif.ipcacorrection.support.FixedClockConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

import static com.kreasipositif.ipcacorrection.support.CostAccountFixtures.account;
import static com.kreasipositif.ipcacorrection.support.CostAccountFixtures.duplicatedCorrection;
import static com.kreasipositif.ipcacorrection.support.CostAccountFixtures.gapWithRecovery;
import static com.kreasipositif.ipcacorrection.support.CostAccountFixtures.singleGap;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Integration tests for the session lifecycle driven by {@link CorrectionOrchestrator}.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(FixedClockConfig.class)
class CorrectionOrchestratorTests {

    private static final String USER = "analyst@sgpp";

    @Autowired
    private CorrectionOrchestrator orchestrator;

    @Autowired
    private AppliedCorrectionsReportService reportService;

    @Autowired
    private InMemoryCostAccountRepository accounts;

    @Autowired
    private InMemoryCorrectionSessionStore sessions;

    @BeforeEach
    void setUp() {
        accounts.clear();
        sessions.clear();
    }

    // ─── Full lifecycle ───────────────────────────────────────────────────────

    @Test
    @DisplayName("Recovered account with a gap → analyzed, previewed, approved and applied to a corrected copy")
    void recoveredAccountFullLifecycle() {
        accounts.putSource(gapWithRecovery("S2"));

        var started = orchestrator.startAnalysis("S2", USER);
        assertThat(started.getStatus()).isEqualTo(SessionStatus.ANALYZING);
        assertThat(started.getScenario()).isEqualTo(Scenario.CENARIO_2);
        assertThat(started.getGapsCount()).isEqualTo(1);
        assertThat(started.isAutoCorrectable()).isTrue();

        var generated = orchestrator.generateProposals(started.getSessionId());
        assertThat(generated.getStatus()).isEqualTo(SessionStatus.PREVIEW);
        assertThat(generated.getProposals()).hasSize(3);
        assertThat(generated.getFinancialImpact().getTotalAdditions()).isEqualByComparingTo("50000");
        assertThat(generated.getFinancialImpact().getTotalCompensation()).isEqualByComparingTo("51500");
        assertThat(generated.getFinancialImpact().getTotalImpact()).isEqualByComparingTo("50000");
        assertThat(generated.getValidationReport().isValid()).isTrue();

        var approval = orchestrator.approveCorrections(started.getSessionId(), ids(generated.getProposals()));
        assertThat(approval.getStatus()).isEqualTo(SessionStatus.APPROVED);
        assertThat(approval.getApprovedCount()).isEqualTo(3);
        assertThat(approval.getTotalFinancialImpact()).isEqualByComparingTo("51500");
        assertThat(approval.isReadyToApply()).isTrue();

        var applied = orchestrator.applyCorrections(started.getSessionId());
        assertThat(applied.isSuccess()).isTrue();
        assertThat(applied.getStatus()).isEqualTo(SessionStatus.APPLIED);
        assertThat(applied.getCorrectedEntityId()).isEqualTo("S2_corrigida");
        assertThat(applied.getAppliedCount()).isEqualTo(3);
        assertThat(applied.isReactivated()).isTrue();

        var status = orchestrator.getSessionStatus(started.getSessionId());
        assertThat(status.getStatus()).isEqualTo(SessionStatus.APPLIED);
        assertThat(status.getUserId()).isEqualTo(USER);
        assertThat(status.getProposalsCount()).isEqualTo(3);
        assertThat(status.getApprovedCount()).isEqualTo(3);
        assertThat(status.getAppliedAt()).isEqualTo(FixedClockConfig.NOW);

        var source = accounts.findById("S2").orElseThrow();
        assertThat(source.getCorrections()).hasSize(2);
        assertThat(source.isRecovered()).isTrue();
        var corrected = accounts.findCorrectedById("S2_corrigida").orElseThrow();
        assertThat(corrected.getCorrections()).hasSize(4);
        assertThat(corrected.isRecovered()).isFalse();
    }

    @Test
    void duplicatesLifecycle() {
        accounts.putSource(duplicatedCorrection("DUP1"));

        var started = orchestrator.startAnalysis("DUP1", USER);
        assertThat(started.getScenario()).isEqualTo(Scenario.CENARIO_DUPLICATAS);
        assertThat(started.getDuplicatesCount()).isEqualTo(1);

        var generated = orchestrator.generateProposals(started.getSessionId());
        assertThat(generated.getFinancialImpact().getTotalRemove()).isEqualByComparingTo("-54075");
        assertThat(generated.getFinancialImpact().getTotalImpact()).isEqualByComparingTo("-54075");

        orchestrator.approveCorrections(started.getSessionId(), ids(generated.getProposals()));
        var applied = orchestrator.applyCorrections(started.getSessionId());

        assertThat(applied.isSuccess()).isTrue();
        assertThat(applied.getEntriesRemoved()).isEqualTo(1);
        assertThat(applied.getEntriesAdded()).isEqualTo(1);
        assertThat(accounts.findCorrectedById("DUP1_corrigida").orElseThrow().currentValue())
                .isEqualByComparingTo("1081500");
    }

    @Test
    void partialApprovalAppliesOnlyTheSelectedProposals() {
        accounts.putSource(account("C1", "2022-08-10", "1000000"));
        var sessionId = orchestrator.startAnalysis("C1", USER).getSessionId();
        var proposals = orchestrator.generateProposals(sessionId).getProposals();

        var approval = orchestrator.approveCorrections(sessionId, List.of(proposals.get(0).getId()));
        var applied = orchestrator.applyCorrections(sessionId);

        assertThat(approval.getTotalFinancialImpact()).isEqualByComparingTo("40000");
        assertThat(applied.getEntriesAdded()).isEqualTo(1);
        assertThat(accounts.findCorrectedById("C1_corrigida").orElseThrow().currentValue())
                .isEqualByComparingTo("1040000");
    }

    @Test
    void appliedCorrectionsAreReported() {
        accounts.putSource(gapWithRecovery("S2"));
        var sessionId = orchestrator.startAnalysis("S2", USER).getSessionId();
        var proposals = orchestrator.generateProposals(sessionId).getProposals();
        orchestrator.approveCorrections(sessionId, ids(proposals));
        orchestrator.applyCorrections(sessionId);

        var report = reportService.generate();

        assertThat(report.getSessionsCount()).isEqualTo(1);
        assertThat(report.getRows()).hasSize(3);
        assertThat(report.getByScenario().get(Scenario.CENARIO_2).count()).isEqualTo(3);
        assertThat(report.getByType().get(ProposalType.COMPENSATION).totalImpact()).isEqualByComparingTo("51500");
        assertThat(reportService.totalAppliedImpact()).isEqualByComparingTo("101500");
    }

    // ─── Reported-only scenarios ──────────────────────────────────────────────

    @Test
    @DisplayName("Nothing due yet → complex scenario, no proposals, nothing to apply")
    void complexScenarioProducesNoProposals() {
        accounts.putSource(account("N1", "2024-06-10", "1000000"));

        var started = orchestrator.startAnalysis("N1", USER);
        assertThat(started.getScenario()).isEqualTo(Scenario.CENARIO_COMPLEXO);
        assertThat(started.isAutoCorrectable()).isFalse();

        var generated = orchestrator.generateProposals(started.getSessionId());
        assertThat(generated.getProposals()).isEmpty();
        assertThat(generated.getFinancialImpact().getProposalsCount()).isZero();

        var approval = orchestrator.approveCorrections(started.getSessionId(), List.of());
        assertThat(approval.isReadyToApply()).isFalse();
        assertThatThrownBy(() -> orchestrator.applyCorrections(started.getSessionId()))
                .isInstanceOf(CorrectionValidationException.class)
                .hasMessageContaining("no approved corrections");
    }

    // ─── Invalid transitions ──────────────────────────────────────────────────

    @Test
    void unknownProposalIdIsRejectedAndSessionStaysInPreview() {
        accounts.putSource(singleGap("A1"));
        var sessionId = orchestrator.startAnalysis("A1", USER).getSessionId();
        orchestrator.generateProposals(sessionId);

        assertThatThrownBy(() -> orchestrator.approveCorrections(sessionId, List.of("not-a-proposal")))
                .isInstanceOf(CorrectionValidationException.class)
                .hasMessageContaining("not-a-proposal");
        assertThat(orchestrator.getSessionStatus(sessionId).getStatus()).isEqualTo(SessionStatus.PREVIEW);
    }

    @Test
    void unresolvableProposalCannotBeApproved() {
        accounts.putSource(account("D1", "2022-12-05", "1000000"));
        var sessionId = orchestrator.startAnalysis("D1", USER).getSessionId();
        var generated = orchestrator.generateProposals(sessionId);
        assertThat(generated.getValidationReport().isValid()).isFalse();

        assertThatThrownBy(() -> orchestrator.approveCorrections(sessionId, ids(generated.getProposals())))
                .isInstanceOf(CorrectionValidationException.class)
                .hasMessageContaining("cannot be approved");
    }

    @Test
    void applyBeforeApprovalIsRejected() {
        accounts.putSource(singleGap("A1"));
        var sessionId = orchestrator.startAnalysis("A1", USER).getSessionId();
        orchestrator.generateProposals(sessionId);

        assertThatThrownBy(() -> orchestrator.applyCorrections(sessionId))
                .isInstanceOf(CorrectionValidationException.class)
                .hasMessageContaining("PREVIEW");
    }

    @Test
    void rejectedSessionCannotBeApproved() {
        accounts.putSource(singleGap("A1"));
        var sessionId = orchestrator.startAnalysis("A1", USER).getSessionId();
        var proposals = orchestrator.generateProposals(sessionId).getProposals();

        var rejected = orchestrator.rejectSession(sessionId);

        assertThat(rejected.getStatus()).isEqualTo(SessionStatus.REJECTED);
        assertThatThrownBy(() -> orchestrator.approveCorrections(sessionId, ids(proposals)))
                .isInstanceOf(CorrectionValidationException.class);
    }

    @Test
    void unknownEntityAndSessionAreNotFound() {
        assertThatThrownBy(() -> orchestrator.startAnalysis("missing", USER))
                .isInstanceOf(CostAccountNotFoundException.class)
                .hasMessageContaining("missing");
        assertThatThrownBy(() -> orchestrator.getSessionStatus("no-such-session"))
                .isInstanceOf(CorrectionSessionNotFoundException.class);
    }

    // ─── Helpers ──────────────────────────────────────────────────────────────

    private static List<String> ids(List<CorrectionProposal> proposals) {
        return proposals.stream().map(CorrectionProposal::getId).toList();
    }
}
