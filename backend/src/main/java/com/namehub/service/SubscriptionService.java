package com.namehub.service;

import com.namehub.config.NamehubProperties;
import com.namehub.model.Subscription;
import com.namehub.model.UserRole;
import com.namehub.repository.SubscriptionRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;

/**
 * Time-boxed entitlements granted with each registered name.
 */
@Service
@RequiredArgsConstructor
public class SubscriptionService {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionService.class);

    private final SubscriptionRepository subscriptionRepository;
    private final PaymentVerificationService paymentVerificationService;
    private final AccessControlService accessControlService;
    private final RegistryMutationExecutor registryMutationExecutor;
    private final NamehubProperties namehubProperties;
    private final Clock clock;

    /**
     * Writes the subscription for a freshly committed name. Runs inside the caller's transaction.
     */
    public Subscription grant(String subscriber, String registeredName, Long paymentId, OffsetDateTime startTime) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        Subscription subscription = new Subscription();
        subscription.setSubscriber(subscriber);
        subscription.setRegisteredName(registeredName);
        subscription.setPaymentId(paymentId);
        subscription.setStartTime(startTime);
        subscription.setEndTime(startTime.plusDays(namehubProperties.getRegistration().getSubscriptionValidityDays()));
        subscription.setActive(true);
        subscription.setCreatedAt(now);
        subscription.setUpdatedAt(now);
        return subscriptionRepository.saveAndFlush(subscription);
    }

    public Optional<Subscription> getSubscription(String subscriber) {
        return subscriptionRepository.findFirstBySubscriberOrderByStartTimeDesc(subscriber);
    }

    public boolean hasActiveSubscription(String subscriber) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        return getSubscription(subscriber)
                .map(subscription -> subscription.isActiveAt(now))
                .orElse(false);
    }

    /**
     * Flags every subscription inactive. Records are kept.
     */
    public int pauseAll(String caller) {
        return registryMutationExecutor.execute(() -> {
            accessControlService.requireRole(caller, UserRole.ADMIN);
            int paused = subscriptionRepository.deactivateAll(OffsetDateTime.now(clock));
            log.info("{} subscriptions paused by {}", paused, caller);
            return paused;
        });
    }

    public SubscriptionStats stats() {
        return new SubscriptionStats(
                subscriptionRepository.count(),
                subscriptionRepository.countActiveAt(OffsetDateTime.now(clock)),
                paymentVerificationService.totalRevenue()
        );
    }

    public record SubscriptionStats(
            long totalSubscriptions,
            long activeSubscriptions,
            long totalRevenue
    ) {
    }
}
