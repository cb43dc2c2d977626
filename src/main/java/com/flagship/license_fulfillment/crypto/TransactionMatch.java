package com.flagship.license_fulfillment.crypto;

import java.math.BigDecimal;

public record TransactionMatch(String txid, BigDecimal amount, boolean confirmed) {
}
