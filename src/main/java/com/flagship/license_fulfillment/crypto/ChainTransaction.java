package com.flagship.license_fulfillment.crypto;

import java.time.Instant;
import java.util.List;

/**
 * A transaction as reported by a block explorer.
 *
 * @param time block or first-seen time; null for unconfirmed transactions on
 *             explorers that do not report one
 */
public record ChainTransaction(String txid, Instant time, boolean confirmed, List<ChainOutput> outputs) {

    public ChainTransaction {
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
    }
}
