package com.flagship.license_fulfillment.crypto;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Finds the transaction that pays a pending crypto payment.
 *
 * An output matches when it goes to the payment address and differs from the
 * expected amount by strictly less than the tolerance. Transactions older
 * than the payment are skipped; transactions without a timestamp (not yet
 * mined) are still considered. The first match in explorer order wins.
 */
public final class TransactionMatcher {

    private TransactionMatcher() {
    }

    public static Optional<TransactionMatch> findMatchingTransaction(List<ChainTransaction> transactions,
                                                                     String address,
                                                                     BigDecimal expectedAmount,
                                                                     BigDecimal tolerance,
                                                                     Instant since) {
        for (ChainTransaction tx : transactions) {
            if (tx.time() != null && tx.time().isBefore(since)) {
                continue;
            }
            for (ChainOutput output : tx.outputs()) {
                if (address.equals(output.address())
                        && output.amount().subtract(expectedAmount).abs().compareTo(tolerance) < 0) {
                    return Optional.of(new TransactionMatch(tx.txid(), output.amount(), tx.confirmed()));
                }
            }
        }
        return Optional.empty();
    }
}
