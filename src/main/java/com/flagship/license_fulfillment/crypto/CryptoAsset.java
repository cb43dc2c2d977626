package com.flagship.license_fulfillment.crypto;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * Cryptocurrencies accepted for payment.
 */
public enum CryptoAsset {

    BTC("Bitcoin", "bitcoin", "https://blockstream.info/tx/"),

    LTC("Litecoin", "litecoin", "https://blockchair.com/litecoin/transaction/");

    private final String displayName;
    private final String priceId;
    private final String explorerTxUrl;

    CryptoAsset(String displayName, String priceId, String explorerTxUrl) {
        this.displayName = displayName;
        this.priceId = priceId;
        this.explorerTxUrl = explorerTxUrl;
    }

    public String getDisplayName() {
        return displayName;
    }

    /** Identifier used by the price API. */
    public String getPriceId() {
        return priceId;
    }

    public String explorerLink(String txid) {
        return explorerTxUrl + txid;
    }

    @JsonCreator
    public static CryptoAsset of(String symbol) {
        if (symbol == null) {
            throw new IllegalArgumentException("Crypto asset is required");
        }
        try {
            return valueOf(symbol.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported crypto asset: " + symbol);
        }
    }
}
