package com.kreasipositif.ipcacorrection.dto;

import com.kreasipositif.ipcacorrection.domain.ProposalType;
import com.kreasipositif.ipcacorrection.domain.Scenario;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Every correction applied through a session, with totals per scenario and per proposal type.
 */
@Getter
@Builder
public class AppliedCorrectionsReport {

    private final Instant generatedAt;
    private final int sessionsCount;
    private final List<Row> rows;
    private final Map<Scenario, ScenarioTotals> byScenario;
    private final Map<ProposalType, TypeTotals> byType;

    public record Row(String sessionId, String entityId, String userId, Scenario scenario, Instant appliedAt,
                      ProposalType type, String targetPeriod, BigDecimal currentValue, BigDecimal proposedValue,
                      BigDecimal impact, BigDecimal rateApplied, String description) {}

    public record ScenarioTotals(int count, BigDecimal totalImpact, BigDecimal totalCurrent,
                                 BigDecimal totalProposed) {}

    public record TypeTotals(int count, BigDecimal totalImpact) {}
}
