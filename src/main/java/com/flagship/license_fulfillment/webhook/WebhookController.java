package com.flagship.license_fulfillment.webhook;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Payment provider callback endpoint.
 *
 * The body is taken as raw bytes so the signature is checked against exactly
 * what the provider signed. Signature failures map to 401 in
 * {@code GlobalExceptionHandler}.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class WebhookController {

    private final WebhookReconciler reconciler;
    private final Clock clock;

    @PostMapping("/webhook")
    public ResponseEntity<Map<String, String>> receive(
            @RequestBody byte[] body,
            @RequestHeader(value = WebhookSignatureVerifier.SIGNATURE_HEADER, required = false) String signature) {
        WebhookOutcome outcome = reconciler.handle(body, signature);
        log.debug("Webhook handled with outcome {}", outcome);
        return ResponseEntity.ok(Map.of("status", "OK", "outcome", outcome.name()));
    }

    @GetMapping("/webhook")
    public Map<String, String> probe() {
        Map<String, String> response = new LinkedHashMap<>();
        response.put("status", "Webhook endpoint is reachable");
        response.put("timestamp", clock.instant().toString());
        return response;
    }
}
