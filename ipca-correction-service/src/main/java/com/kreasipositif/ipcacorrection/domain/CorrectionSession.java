package com.kreasipositif.ipcacorrection.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Workflow state of one correction run over one cost account.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "ipca_correction_sessions")
public class CorrectionSession {

    @Id
    private String id;

    private String targetEntityId;
    private String userId;
    private SessionStatus status;
    private Scenario scenarioDetected;

    @Builder.Default
    private List<Gap> gapsIdentified = new ArrayList<>();

    @Builder.Default
    private List<OutOfPeriodCorrection> correctionsOutOfPeriod = new ArrayList<>();

    @Builder.Default
    private List<DuplicateCorrection> duplicatesFound = new ArrayList<>();

    @Builder.Default
    private List<CorrectionProposal> correctionsProposed = new ArrayList<>();

    @Builder.Default
    private Set<String> correctionsApproved = new LinkedHashSet<>();

    private FinancialImpact financialImpact;
    private ValidationReport validationReport;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant appliedAt;
    private String errorMessage;
    private String correctedEntityId;

    public Optional<CorrectionProposal> findProposal(String proposalId) {
        return correctionsProposed.stream()
                .filter(p -> p.getId().equals(proposalId))
                .findFirst();
    }

    /** Approved proposals in proposal order. */
    public List<CorrectionProposal> approvedProposals() {
        return correctionsProposed.stream()
                .filter(p -> correctionsApproved.contains(p.getId()))
                .toList();
    }
}
