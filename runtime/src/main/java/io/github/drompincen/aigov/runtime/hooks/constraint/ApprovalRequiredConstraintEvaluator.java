package io.github.drompincen.aigov.runtime.hooks.constraint;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.aigov.protocol.api.ApprovalRequiredConstraint;
import io.github.drompincen.aigov.runtime.approval.ApprovalService;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Satisfied by a granted approval for the project, role, tool and approver; the grant is consumed
 * only when the call is admitted. Without one, the call is rejected and a pending approval request
 * is filed unless an equivalent one is already waiting.
 */
@Component
public class ApprovalRequiredConstraintEvaluator implements ConstraintEvaluator<ApprovalRequiredConstraint> {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ApprovalService approvalService;

    public ApprovalRequiredConstraintEvaluator(ApprovalService approvalService) {
        this.approvalService = approvalService;
    }

    @Override
    public Class<ApprovalRequiredConstraint> constraintType() {
        return ApprovalRequiredConstraint.class;
    }

    @Override
    public boolean isViolated(ApprovalRequiredConstraint constraint, ConstraintCheck check) {
        String projectId = check.request().project();
        String roleName = check.role().name();
        if (approvalService.hasGrant(projectId, roleName, check.toolName(), constraint.approver())) {
            return false;
        }
        if (!approvalService.hasPendingRequest(projectId, roleName, check.toolName(), constraint.approver())) {
            Map<String, Object> input = check.toolInput() == null || check.toolInput().isNull()
                    ? Map.of()
                    : MAPPER.convertValue(check.toolInput(), new TypeReference<Map<String, Object>>() {});
            approvalService.createRequest(projectId, check.sessionId(), roleName, check.toolName(),
                    constraint.approver(), input);
        }
        return true;
    }

    @Override
    public boolean admit(ApprovalRequiredConstraint constraint, ConstraintCheck check) {
        return approvalService.consumeGrant(check.request().project(), check.role().name(), check.toolName(),
                constraint.approver());
    }
}
