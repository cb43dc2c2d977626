package com.flagship.license_fulfillment.crypto;

import java.util.List;

/**
 * Read-only view of a public blockchain, one implementation per asset.
 */
public interface ChainDataSource {

    CryptoAsset asset();

    /**
     * Recent transactions touching the address, newest first.
     *
     * @throws ChainDataException if the explorer cannot be queried
     */
    List<ChainTransaction> fetchTransactions(String address);
}
