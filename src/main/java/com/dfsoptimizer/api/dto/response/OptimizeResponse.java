package com.dfsoptimizer.api.dto.response;

import com.dfsoptimizer.domain.enums.BatchStatus;
import com.dfsoptimizer.domain.enums.BatchStopReason;
import com.dfsoptimizer.domain.enums.InfeasibilityCause;
import com.dfsoptimizer.portfolio.StackAuditor.StackAuditEntry;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OptimizeResponse {

    private String batchId;
    private BatchStatus status;
    private int requested;
    private int delivered;
    private BatchStopReason stopReason;
    private InfeasibilityCause stopCause;
    private String message;
    private long elapsedMs;
    private List<LineupResponse> lineups;
    private List<StackAuditEntry> stackAudit;
}
