package org.relaychat;

import java.util.List;

// Outcome of one broadcast
public record DeliveryReport(List<ClientId> delivered, List<ClientId> failed) {

    public DeliveryReport {
        delivered = List.copyOf(delivered);
        failed = List.copyOf(failed);
    }

    public int recipientCount() {
        return delivered.size() + failed.size();
    }

    public boolean allDelivered() {
        return failed.isEmpty();
    }
}
