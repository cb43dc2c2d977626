package com.flagship.license_fulfillment.purchase;

import com.flagship.license_fulfillment.payment.CryptoPayment;
import com.flagship.license_fulfillment.purchase.dto.CheckoutResponse;
import com.flagship.license_fulfillment.purchase.dto.CryptoPaymentResponse;
import com.flagship.license_fulfillment.purchase.dto.CryptoPurchaseRequest;
import com.flagship.license_fulfillment.purchase.dto.FiatPurchaseRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Purchase API consumed by the chat layer.
 */
@RestController
@RequestMapping("/api/purchases")
@RequiredArgsConstructor
public class PurchaseController {

    private final PurchaseService purchaseService;

    @PostMapping("/fiat")
    public ResponseEntity<CheckoutResponse> startFiat(@Valid @RequestBody FiatPurchaseRequest request) {
        CheckoutResponse response = purchaseService.startFiatPurchase(
                request.getUserId(), request.getProductType(), request.getUser());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PostMapping("/crypto")
    public ResponseEntity<CryptoPaymentResponse> startCrypto(@Valid @RequestBody CryptoPurchaseRequest request) {
        CryptoPayment payment = purchaseService.startCryptoPurchase(
                request.getUserId(), request.getProductType(), request.getAsset(), request.getUser());
        return ResponseEntity.status(HttpStatus.CREATED).body(CryptoPaymentResponse.from(payment));
    }

    @GetMapping("/crypto/latest")
    public ResponseEntity<CryptoPaymentResponse> latestCrypto(@RequestParam("userId") String userId) {
        return purchaseService.latestCryptoPayment(userId)
                .map(CryptoPaymentResponse::from)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }
}
