package com.flagship.license_fulfillment.crypto;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.license_fulfillment.config.FulfillmentProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Spot USD prices from the CoinGecko simple-price endpoint.
 */
@Component
@Slf4j
public class PriceOracle {

    static final int CRYPTO_SCALE = 8;

    private final RestClient http;
    private final String baseUrl;

    public PriceOracle(RestClient chainRestClient, FulfillmentProperties properties) {
        this.http = chainRestClient;
        this.baseUrl = properties.getChain().getCoingeckoBaseUrl();
    }

    /**
     * @throws ChainDataException if no usable price could be fetched
     */
    public BigDecimal usdPrice(CryptoAsset asset) {
        JsonNode body;
        try {
            body = http.get()
                    .uri(baseUrl + "/simple/price?ids={id}&vs_currencies=usd", asset.getPriceId())
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new ChainDataException("Failed to get " + asset + " exchange rate", e);
        }
        JsonNode price = body == null ? null : body.path(asset.getPriceId()).path("usd");
        if (price == null || !price.isNumber() || price.decimalValue().signum() <= 0) {
            throw new ChainDataException("Failed to get " + asset + " exchange rate");
        }
        return price.decimalValue();
    }

    /**
     * Converts a USD amount to the asset at the current price, rounded to 8 decimals.
     */
    public BigDecimal quote(CryptoAsset asset, BigDecimal usdAmount) {
        BigDecimal price = usdPrice(asset);
        BigDecimal amount = toCryptoAmount(usdAmount, price);
        log.debug("Quoted {} USD as {} {} at {} USD", usdAmount, amount.toPlainString(), asset, price);
        return amount;
    }

    static BigDecimal toCryptoAmount(BigDecimal usdAmount, BigDecimal usdPrice) {
        return usdAmount.divide(usdPrice, CRYPTO_SCALE, RoundingMode.HALF_UP);
    }
}
