package com.amannmalik.ucp.api.checkout.model;

import com.amannmalik.ucp.util.Ensure;

public record RiskSignals(String ipAddress, String browser) {
    public RiskSignals {
        ipAddress = Ensure.nonBlank("risk_signals.ip", ipAddress);
        browser = Ensure.nonBlank("risk_signals.browser", browser);
    }

    public static RiskSignals agentDefaults() {
        return new RiskSignals("127.0.0.1", "ucp-agent");
    }
}
