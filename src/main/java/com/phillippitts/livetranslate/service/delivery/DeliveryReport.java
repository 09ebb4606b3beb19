package com.phillippitts.livetranslate.service.delivery;

import java.util.List;
import java.util.Optional;

/**
 * Ledger of one broadcast: one outcome per attempted listener, plus listeners skipped because
 * they had no usable language.
 */
public record DeliveryReport(List<DeliveryOutcome> outcomes, int skipped) {

    public DeliveryReport {
        outcomes = List.copyOf(outcomes);
    }

    public static DeliveryReport empty() {
        return new DeliveryReport(List.of(), 0);
    }

    public int deliveredCount() {
        return (int) outcomes.stream().filter(DeliveryOutcome::delivered).count();
    }

    public int failedCount() {
        return outcomes.size() - deliveredCount();
    }

    public boolean allDelivered() {
        return failedCount() == 0;
    }

    public Optional<DeliveryOutcome> outcomeFor(String connectionId) {
        return outcomes.stream().filter(o -> o.connectionId().equals(connectionId)).findFirst();
    }
}
