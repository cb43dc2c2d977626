package com.flagship.license_fulfillment.guard;

import com.flagship.license_fulfillment.config.FulfillmentProperties;
import com.flagship.license_fulfillment.license.LicenseRegistry;
import com.flagship.license_fulfillment.payment.PaymentLedger;
import com.flagship.license_fulfillment.product.ProductType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Pattern;

/**
 * Rate limiting, purchase cooldowns, suspicious-activity tracking and
 * duplicate-purchase detection.
 *
 * The rate, cooldown and activity state lives in memory only and is lost on
 * restart. All updates go through {@link ConcurrentHashMap#compute} so each
 * key is read and written atomically.
 */
@Component
@Slf4j
public class AntiAbuseGuard {

    static final Duration RATE_WINDOW_RETENTION = Duration.ofHours(1);
    static final Duration COOLDOWN_RETENTION = Duration.ofHours(24);

    private static final Pattern SUSPICIOUS_NAME = Pattern.compile("bot|test|fake|spam", Pattern.CASE_INSENSITIVE);

    private final PaymentLedger ledger;
    private final LicenseRegistry licenseRegistry;
    private final FulfillmentProperties.Guard settings;
    private final Clock clock;

    private final Map<String, RateWindow> rateWindows = new ConcurrentHashMap<>();
    private final Map<String, Instant> cooldowns = new ConcurrentHashMap<>();
    private final Map<String, List<Activity>> suspiciousActivity = new ConcurrentHashMap<>();

    public AntiAbuseGuard(PaymentLedger ledger, LicenseRegistry licenseRegistry,
                          FulfillmentProperties properties, Clock clock) {
        this.ledger = ledger;
        this.licenseRegistry = licenseRegistry;
        this.settings = properties.getGuard();
        this.clock = clock;
    }

    /**
     * Fixed-window rate limit per (user, command).
     *
     * @return true if the request is allowed
     */
    public boolean checkRateLimit(String userId, String command, int maxRequests, Duration window) {
        Instant now = clock.instant();
        AtomicBoolean allowed = new AtomicBoolean(true);
        rateWindows.compute(userId + ":" + command, (key, current) -> {
            if (current == null || now.isAfter(current.resetTime())) {
                return new RateWindow(1, now.plus(window));
            }
            if (current.count() >= maxRequests) {
                allowed.set(false);
                return current;
            }
            return new RateWindow(current.count() + 1, current.resetTime());
        });
        return allowed.get();
    }

    public boolean checkRateLimit(String userId, String command) {
        return checkRateLimit(userId, command, settings.getPurchaseRateLimit(), settings.getRateLimitWindow());
    }

    /**
     * Allows a purchase when the user has no cooldown anchor or the cooldown has
     * elapsed. The anchor only moves on success.
     */
    public boolean checkPurchaseCooldown(String userId, Duration cooldown) {
        Instant now = clock.instant();
        AtomicBoolean allowed = new AtomicBoolean(false);
        cooldowns.compute(userId, (key, anchor) -> {
            if (anchor == null || Duration.between(anchor, now).compareTo(cooldown) > 0) {
                allowed.set(true);
                return now;
            }
            return anchor;
        });
        return allowed.get();
    }

    public boolean checkPurchaseCooldown(String userId) {
        return checkPurchaseCooldown(userId, settings.getPurchaseCooldown());
    }

    /**
     * Records an activity for the user and reports whether their activity over
     * the tracking window has crossed the threshold.
     */
    public boolean trackSuspiciousActivity(String userId, String activity) {
        Instant now = clock.instant();
        Instant cutoff = now.minus(settings.getSuspiciousActivityWindow());
        List<Activity> recent = suspiciousActivity.compute(userId, (key, current) -> {
            List<Activity> kept = new ArrayList<>();
            if (current != null) {
                for (Activity a : current) {
                    if (a.timestamp().isAfter(cutoff)) {
                        kept.add(a);
                    }
                }
            }
            kept.add(new Activity(activity, now));
            return kept;
        });

        if (recent.size() > settings.getSuspiciousActivityThreshold()) {
            log.warn("Suspicious activity detected for user {}: {} actions in the last {} (latest: {})",
                    userId, recent.size(), settings.getSuspiciousActivityWindow(), activity);
            return true;
        }
        return false;
    }

    /**
     * A recent pending intent, an open crypto payment, or an active unexpired
     * license for the same product counts as a duplicate. Lifetime purchases
     * are exempt from the license rule.
     */
    public DuplicateCheck checkDuplicatePurchase(String userId, ProductType productType) {
        if (ledger.hasRecentPendingIntent(userId, productType, settings.getDuplicateWindow())
                || ledger.hasOpenCryptoPayment(userId, productType)) {
            return DuplicateCheck.duplicate(DuplicateCheck.RECENT_PENDING_PAYMENT);
        }
        if (!productType.isLifetime() && licenseRegistry.hasActiveLicense(userId, productType)) {
            return DuplicateCheck.duplicate(DuplicateCheck.ACTIVE_LICENSE_EXISTS);
        }
        return DuplicateCheck.clear();
    }

    public UserValidation validateUser(UserProfile user) {
        Duration age = Duration.between(user.accountCreatedAt(), clock.instant());
        if (age.compareTo(settings.getMinimumAccountAge()) < 0) {
            return UserValidation.rejected("Account too new");
        }
        if (user.hasDefaultAvatar() && SUSPICIOUS_NAME.matcher(user.username()).find()) {
            return UserValidation.rejected("Suspicious account characteristics");
        }
        return UserValidation.accepted();
    }

    /**
     * Drops stale rate windows, old cooldown anchors and emptied activity logs.
     */
    public void pruneExpiredState() {
        Instant now = clock.instant();
        Instant rateCutoff = now.minus(RATE_WINDOW_RETENTION);
        Instant cooldownCutoff = now.minus(COOLDOWN_RETENTION);
        Instant activityCutoff = now.minus(settings.getSuspiciousActivityWindow());

        rateWindows.entrySet().removeIf(e -> e.getValue().resetTime().isBefore(rateCutoff));
        cooldowns.entrySet().removeIf(e -> e.getValue().isBefore(cooldownCutoff));
        for (String userId : suspiciousActivity.keySet()) {
            suspiciousActivity.computeIfPresent(userId, (key, activities) -> {
                List<Activity> kept = activities.stream()
                        .filter(a -> a.timestamp().isAfter(activityCutoff))
                        .toList();
                return kept.isEmpty() ? null : new ArrayList<>(kept);
            });
        }
        log.debug("Pruned abuse state: {}", snapshot());
    }

    public AbuseStateSnapshot snapshot() {
        return new AbuseStateSnapshot(rateWindows.size(), cooldowns.size(), suspiciousActivity.size());
    }

    private record RateWindow(int count, Instant resetTime) {
    }

    private record Activity(String label, Instant timestamp) {
    }
}
