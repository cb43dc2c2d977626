package com.flagship.license_fulfillment.crypto;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.license_fulfillment.config.FulfillmentProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Bitcoin transactions from the Blockstream Esplora API
 * ({@code GET /address/{address}/txs}).
 */
@Component
@Slf4j
public class BlockstreamChainDataSource implements ChainDataSource {

    static final BigDecimal SATOSHIS_PER_COIN = new BigDecimal("100000000");

    private final RestClient http;
    private final String baseUrl;

    public BlockstreamChainDataSource(RestClient chainRestClient, FulfillmentProperties properties) {
        this.http = chainRestClient;
        this.baseUrl = properties.getChain().getBlockstreamBaseUrl();
    }

    @Override
    public CryptoAsset asset() {
        return CryptoAsset.BTC;
    }

    @Override
    public List<ChainTransaction> fetchTransactions(String address) {
        JsonNode body;
        try {
            body = http.get()
                    .uri(baseUrl + "/address/{address}/txs", address)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new ChainDataException("Blockstream lookup failed for " + address, e);
        }
        if (body == null || !body.isArray()) {
            throw new ChainDataException("Unexpected Blockstream response for " + address);
        }
        return parse(body);
    }

    static List<ChainTransaction> parse(JsonNode txs) {
        List<ChainTransaction> result = new ArrayList<>();
        for (JsonNode tx : txs) {
            JsonNode status = tx.path("status");
            Instant time = status.hasNonNull("block_time")
                    ? Instant.ofEpochSecond(status.get("block_time").asLong())
                    : null;

            List<ChainOutput> outputs = new ArrayList<>();
            for (JsonNode vout : tx.path("vout")) {
                String recipient = vout.path("scriptpubkey_address").asText(null);
                if (recipient != null && vout.has("value")) {
                    outputs.add(new ChainOutput(recipient, toCoins(vout.get("value").asLong())));
                }
            }
            result.add(new ChainTransaction(tx.path("txid").asText(), time,
                    status.path("confirmed").asBoolean(false), outputs));
        }
        return result;
    }

    static BigDecimal toCoins(long smallestUnits) {
        return BigDecimal.valueOf(smallestUnits).divide(SATOSHIS_PER_COIN);
    }
}
