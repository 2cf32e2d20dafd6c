package io.trading.executor.model;

/**
 * A risk event raised by the upstream risk engine.
 *
 * @param timestamp     Event time in milliseconds
 * @param riskEventType Upstream risk event code
 * @param remark        Free-text description
 */
public record RiskManageTrigger(
    long timestamp,
    int riskEventType,
    String remark
) implements Trigger {
    public RiskManageTrigger {
        if (remark == null) {
            remark = "";
        }
    }

    @Override
    public TriggerType type() {
        return TriggerType.RISK_MANAGE;
    }
}
