package com.flagship.license_fulfillment.crypto;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.license_fulfillment.config.FulfillmentProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Litecoin transactions from Blockchair.
 *
 * The address dashboard only lists transaction hashes, so each one is looked
 * up through the transaction dashboard. A transaction that cannot be fetched
 * is skipped; a failing address lookup fails the whole poll.
 */
@Component
@Slf4j
public class BlockchairChainDataSource implements ChainDataSource {

    private static final DateTimeFormatter BLOCKCHAIR_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final RestClient http;
    private final String baseUrl;
    private final int transactionLimit;

    public BlockchairChainDataSource(RestClient chainRestClient, FulfillmentProperties properties) {
        this.http = chainRestClient;
        this.baseUrl = properties.getChain().getBlockchairBaseUrl();
        this.transactionLimit = properties.getChain().getTransactionLimit();
    }

    @Override
    public CryptoAsset asset() {
        return CryptoAsset.LTC;
    }

    @Override
    public List<ChainTransaction> fetchTransactions(String address) {
        JsonNode dashboard;
        try {
            dashboard = http.get()
                    .uri(baseUrl + "/dashboards/address/{address}?limit={limit}", address, transactionLimit)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new ChainDataException("Blockchair address lookup failed for " + address, e);
        }
        if (dashboard == null) {
            throw new ChainDataException("Empty Blockchair response for " + address);
        }

        List<ChainTransaction> result = new ArrayList<>();
        for (JsonNode hash : dashboard.path("data").path(address).path("transactions")) {
            String txid = hash.asText();
            try {
                JsonNode tx = http.get()
                        .uri(baseUrl + "/dashboards/transaction/{txid}", txid)
                        .retrieve()
                        .body(JsonNode.class);
                if (tx != null) {
                    parseTransaction(txid, tx.path("data").path(txid)).ifPresent(result::add);
                }
            } catch (RestClientException e) {
                log.warn("Skipping LTC transaction {}: {}", txid, e.getMessage());
            }
        }
        return result;
    }

    static Optional<ChainTransaction> parseTransaction(String txid, JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return Optional.empty();
        }
        JsonNode transaction = node.path("transaction");
        List<ChainOutput> outputs = new ArrayList<>();
        for (JsonNode output : node.path("outputs")) {
            String recipient = output.path("recipient").asText(null);
            if (recipient != null && output.has("value")) {
                outputs.add(new ChainOutput(recipient, BlockstreamChainDataSource.toCoins(output.get("value").asLong())));
            }
        }
        boolean confirmed = transaction.hasNonNull("block_id") && transaction.get("block_id").asLong() > 0;
        return Optional.of(new ChainTransaction(txid, parseTime(transaction.path("time").asText(null)),
                confirmed, outputs));
    }

    /**
     * Blockchair reports UTC times as {@code yyyy-MM-dd HH:mm:ss}.
     */
    static Instant parseTime(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDateTime.parse(value, BLOCKCHAIR_TIME).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            log.debug("Unparseable Blockchair time '{}'", value);
            return null;
        }
    }
}
