package com.flagship.license_fulfillment.license;

import com.flagship.license_fulfillment.license.dto.ImportKeysRequest;
import com.flagship.license_fulfillment.license.dto.LicenseResponse;
import com.flagship.license_fulfillment.license.dto.ValidationResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequiredArgsConstructor
public class LicenseController {

    private final LicenseRegistry licenseRegistry;
    private final AdminAuthorizer adminAuthorizer;

    /**
     * Unknown and deactivated keys are 404; an expired key is 200 with
     * {@code valid=false}.
     */
    @GetMapping("/validate/{licenseKey}")
    public ResponseEntity<ValidationResponse> validate(@PathVariable String licenseKey) {
        LicenseValidation validation = licenseRegistry.validate(licenseKey);
        return switch (validation.status()) {
            case VALID -> ResponseEntity.ok(ValidationResponse.valid(validation.license()));
            case EXPIRED -> ResponseEntity.ok(ValidationResponse.expired(validation.license()));
            case NOT_FOUND -> ResponseEntity.status(HttpStatus.NOT_FOUND).body(ValidationResponse.notFound());
        };
    }

    @GetMapping("/api/licenses")
    public List<LicenseResponse> licensesForUser(@RequestParam("userId") String userId) {
        return licenseRegistry.findByUser(userId).stream()
                .map(LicenseResponse::from)
                .toList();
    }

    @PostMapping("/api/admin/licenses/import")
    public ResponseEntity<List<LicenseResponse>> importKeys(@Valid @RequestBody ImportKeysRequest request) {
        adminAuthorizer.requireAdmin(request.getAddedBy());
        List<License> imported = licenseRegistry.importKeys(request.getKeys(), request.getProductType(),
                request.getUserId(), request.getAddedBy());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(imported.stream().map(LicenseResponse::from).toList());
    }
}
