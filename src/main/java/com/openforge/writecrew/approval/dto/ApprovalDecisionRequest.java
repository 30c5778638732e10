package com.openforge.writecrew.approval.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record ApprovalDecisionRequest(
        @NotNull Boolean approved,
        @Size(max = 2000) String feedback
) {}
