package com.kreasipositif.ipcacorrection.service;

import com.kreasipositif.ipcacorrection.domain.CorrectionProposal;
import com.kreasipositif.ipcacorrection.domain.CorrectionSession;
import com.kreasipositif.ipcacorrection.domain.Money;
import com.kreasipositif.ipcacorrection.domain.ProposalType;
import com.kreasipositif.ipcacorrection.domain.Scenario;
import com.kreasipositif.ipcacorrection.domain.SessionStatus;
import com.kreasipositif.ipcacorrection.dto.AppliedCorrectionsReport;
import com.kreasipositif.ipcacorrection.dto.AppliedCorrectionsReport.Row;
import com.kreasipositif.ipcacorrection.dto.AppliedCorrectionsReport.ScenarioTotals;
import com.kreasipositif.ipcacorrection.dto.AppliedCorrectionsReport.TypeTotals;
import com.kreasipositif.ipcacorrection.repository.CorrectionSessionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Summarizes the corrections applied across all sessions.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AppliedCorrectionsReportService {

    private final CorrectionSessionStore sessionStore;
    private final Clock clock;

    public AppliedCorrectionsReport generate() {
        List<CorrectionSession> sessions = sessionStore.findByStatus(SessionStatus.APPLIED);
        List<Row> rows = new ArrayList<>();
        for (CorrectionSession session : sessions) {
            for (CorrectionProposal p : session.approvedProposals()) {
                rows.add(new Row(session.getId(), session.getTargetEntityId(), session.getUserId(),
                        session.getScenarioDetected(), session.getAppliedAt(), p.getType(), p.getTargetPeriod(),
                        Money.orZero(p.getCurrentValue()), Money.orZero(p.getProposedValue()),
                        Money.orZero(p.getImpact()), p.getRateApplied(), p.getDescription()));
            }
        }

        Map<Scenario, ScenarioTotals> byScenario = new EnumMap<>(Scenario.class);
        Map<ProposalType, TypeTotals> byType = new EnumMap<>(ProposalType.class);
        for (Row row : rows) {
            byScenario.merge(row.scenario(),
                    new ScenarioTotals(1, row.impact(), row.currentValue(), row.proposedValue()),
                    (a, b) -> new ScenarioTotals(a.count() + b.count(), a.totalImpact().add(b.totalImpact()),
                            a.totalCurrent().add(b.totalCurrent()), a.totalProposed().add(b.totalProposed())));
            byType.merge(row.type(), new TypeTotals(1, row.impact()),
                    (a, b) -> new TypeTotals(a.count() + b.count(), a.totalImpact().add(b.totalImpact())));
        }

        log.info("Applied corrections report: {} session(s), {} correction(s)", sessions.size(), rows.size());
        return AppliedCorrectionsReport.builder()
                .generatedAt(clock.instant())
                .sessionsCount(sessions.size())
                .rows(rows)
                .byScenario(byScenario)
                .byType(byType)
                .build();
    }

    /** Total impact of everything applied so far. */
    public BigDecimal totalAppliedImpact() {
        return generate().getByType().values().stream()
                .map(TypeTotals::totalImpact)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
