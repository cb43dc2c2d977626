package com.flagship.license_fulfillment.crypto;

import java.math.BigDecimal;

/**
 * One transaction output, with the amount already converted from the smallest
 * unit (satoshis/litoshis) to whole coins.
 */
public record ChainOutput(String address, BigDecimal amount) {
}
