package com.dfsoptimizer.exception;

import com.dfsoptimizer.domain.enums.InfeasibilityCause;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;

/**
 * A well-formed constraint system that admits no lineup. The cause names the constraint class
 * that triggered it when it can be determined, so the caller knows what to relax.
 */
@Getter
public class InfeasibleException extends BaseException {

    private final InfeasibilityCause infeasibilityCause;

    public InfeasibleException(InfeasibilityCause infeasibilityCause, String message) {
        this(infeasibilityCause, message, null);
    }

    public InfeasibleException(InfeasibilityCause infeasibilityCause, String message, Map<String, Object> details) {
        super(ErrorCode.INFEASIBLE, message, withCause(infeasibilityCause, details));
        this.infeasibilityCause = infeasibilityCause;
    }

    private static Map<String, Object> withCause(InfeasibilityCause cause, Map<String, Object> details) {
        Map<String, Object> merged = new LinkedHashMap<>();
        merged.put("cause", cause.name());
        if (details != null) {
            merged.putAll(details);
        }
        return merged;
    }
}
