package com.namehub.service;

import com.namehub.config.NamehubProperties;
import com.namehub.ledger.LedgerClient;
import com.namehub.model.AddressType;
import com.namehub.model.ConsumedReference;
import com.namehub.model.NameRecord;
import com.namehub.model.Season;
import com.namehub.model.Subscription;
import com.namehub.model.UserRole;
import com.namehub.model.VerifiedPayment;
import com.namehub.repository.SeasonRepository;
import com.namehub.web.RegistryException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * Paid name registration.
 *
 * <p>Preconditions are checked, the payment is verified against the ledger with no lock or transaction held,
 * and the commit then re-checks every precondition under the registry lock before consuming the ledger
 * reference and writing the payment, name and subscription in one transaction. Two calls racing with the
 * same reference can both pass the first check, but only one can pass the second.
 */
@Service
@RequiredArgsConstructor
public class RegistrationService {

    private static final Logger log = LoggerFactory.getLogger(RegistrationService.class);

    private final AccessControlService accessControlService;
    private final SeasonRepository seasonRepository;
    private final SeasonService seasonService;
    private final NameLedgerService nameLedgerService;
    private final PaymentVerificationService paymentVerificationService;
    private final SubscriptionService subscriptionService;
    private final NameRules nameRules;
    private final RegistryMutationExecutor registryMutationExecutor;
    private final NamehubProperties namehubProperties;
    private final Clock clock;

    public RegistrationReceipt register(String caller, RegistrationCommand command) {
        accessControlService.requireRole(caller, UserRole.USER);
        String name = nameRules.normalize(command.name());
        NameLedgerService.requireAddress(command.address(), command.addressType());
        if (command.blockReference() == null || command.blockReference().isBlank()) {
            throw RegistryException.paymentNotVerified(String.valueOf(command.blockReference()));
        }
        String blockReference = command.blockReference().trim();
        if (blockReference.length() > ConsumedReference.MAX_REFERENCE_LENGTH) {
            throw RegistryException.paymentNotVerified(blockReference);
        }

        Season season = checkPreconditions(caller, name, command.seasonId(), blockReference);

        String recipient = namehubProperties.getPayment().getRecipientAddress();
        LedgerClient.LedgerEntry transfer = paymentVerificationService
                .verifyTransfer(blockReference, season.getPrice(), recipient)
                .orElseThrow(() -> {
                    log.warn("Registration of '{}' by {} rejected: payment {} not verified", name, caller, blockReference);
                    return RegistryException.paymentNotVerified(blockReference);
                });

        return registryMutationExecutor.execute(() -> {
            Season current = checkPreconditions(caller, name, command.seasonId(), blockReference);
            OffsetDateTime now = OffsetDateTime.now(clock);

            paymentVerificationService.consume(blockReference, caller, now);
            VerifiedPayment payment = paymentVerificationService.recordPayment(caller, transfer, name, now);
            NameRecord record = nameLedgerService.commit(nameLedgerService.newRecord(
                    name,
                    command.address(),
                    command.addressType(),
                    caller,
                    current.getId(),
                    now
            ));
            Subscription subscription = subscriptionService.grant(caller, name, payment.getId(), now);

            log.info("Name '{}' registered to {} in season {} with payment {} ({})",
                    name, caller, current.getId(), payment.getId(), blockReference);
            return new RegistrationReceipt(
                    payment.getId(),
                    record.getName(),
                    record.getOwner(),
                    record.getSeasonId(),
                    payment.getAmount(),
                    subscription.getEndTime()
            );
        });
    }

    private Season checkPreconditions(String caller, String name, Long seasonId, String blockReference) {
        accessControlService.requireRole(caller, UserRole.USER);
        if (nameLedgerService.ownerHasName(caller)) {
            throw RegistryException.alreadyRegistered(caller);
        }
        if (paymentVerificationService.isReferenceUsed(blockReference)) {
            throw RegistryException.replayedPayment(blockReference);
        }

        Season season = seasonId == null ? null : seasonRepository.findById(seasonId).orElse(null);
        if (season == null || !season.isOpenAt(OffsetDateTime.now(clock))) {
            throw RegistryException.seasonNotOpen(seasonId);
        }
        if (seasonService.availableNames(season) <= 0) {
            throw RegistryException.seasonFull(seasonId);
        }

        nameRules.requireValidFor(name, season);
        if (nameLedgerService.isNameTaken(name)) {
            throw RegistryException.nameTaken(name);
        }
        return season;
    }

    public record RegistrationCommand(
            String name,
            String address,
            AddressType addressType,
            Long seasonId,
            String blockReference
    ) {
    }

    public record RegistrationReceipt(
            Long paymentId,
            String name,
            String owner,
            Long seasonId,
            Long amountPaid,
            OffsetDateTime subscriptionEndTime
    ) {
    }
}
