package com.openforge.writecrew.approval;

import com.openforge.writecrew.permission.ActionType;
import com.openforge.writecrew.permission.AgentAction;
import com.openforge.writecrew.permission.TargetScope;

/**
 * Rough blast radius shown next to an approval prompt.
 */
public record ImpactEstimate(int wordCount, TargetScope scope, boolean reversible, RiskLevel riskLevel) {

    public enum RiskLevel { LOW, MEDIUM, HIGH }

    public static ImpactEstimate of(AgentAction action) {
        boolean reversible = action.type() != ActionType.DELETE;
        RiskLevel risk = reversible ? RiskLevel.LOW : RiskLevel.HIGH;
        TargetScope scope = action.targetScope();
        if (scope == TargetScope.DOCUMENT || scope == TargetScope.SECTION) {
            risk = risk == RiskLevel.LOW ? RiskLevel.MEDIUM : RiskLevel.HIGH;
        }
        return new ImpactEstimate(action.estimatedWords(), scope, reversible, risk);
    }
}
