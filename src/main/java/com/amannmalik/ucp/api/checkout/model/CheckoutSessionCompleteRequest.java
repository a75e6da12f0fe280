package com.amannmalik.ucp.api.checkout.model;

import com.amannmalik.ucp.util.Ensure;

public record CheckoutSessionCompleteRequest(PaymentData paymentData, RiskSignals riskSignals) {
    public CheckoutSessionCompleteRequest {
        paymentData = Ensure.notNull("checkout_session.payment_data", paymentData);
        riskSignals = Ensure.notNull("checkout_session.risk_signals", riskSignals);
    }
}
