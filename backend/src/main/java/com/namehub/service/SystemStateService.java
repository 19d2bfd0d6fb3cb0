package com.namehub.service;

import com.namehub.model.SeasonStatus;
import com.namehub.model.UserRole;
import com.namehub.repository.ConsumedReferenceRepository;
import com.namehub.repository.NameRecordRepository;
import com.namehub.repository.RoleAssignmentRepository;
import com.namehub.repository.SeasonRepository;
import com.namehub.repository.SubscriptionRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Audits stored state against the registry invariants.
 */
@Service
@RequiredArgsConstructor
public class SystemStateService {

    private static final Logger log = LoggerFactory.getLogger(SystemStateService.class);

    private final SeasonRepository seasonRepository;
    private final NameRecordRepository nameRecordRepository;
    private final ConsumedReferenceRepository consumedReferenceRepository;
    private final SubscriptionRepository subscriptionRepository;
    private final RoleAssignmentRepository roleAssignmentRepository;
    private final AccessControlService accessControlService;

    public SystemStateReport validate(String caller) {
        accessControlService.requireRole(caller, UserRole.ADMIN);

        List<String> issues = new ArrayList<>();
        long activeSeasons = seasonRepository.countByStatus(SeasonStatus.ACTIVE);
        if (activeSeasons > 1) {
            issues.add(activeSeasons + " seasons are active at once");
        }
        nameRecordRepository.findOwnersWithMultipleNames()
                .forEach(owner -> issues.add("Owner holds more than one name: " + owner));
        consumedReferenceRepository.findReferencesWithoutPayment()
                .forEach(reference -> issues.add("Consumed reference has no verified payment: " + reference));
        subscriptionRepository.findNamesWithoutSubscription()
                .forEach(name -> issues.add("Name has no subscription: " + name));
        if (roleAssignmentRepository.countByRole(UserRole.ADMIN) == 0) {
            issues.add("No admin is assigned");
        }

        if (!issues.isEmpty()) {
            log.warn("System state validation found {} issue(s)", issues.size());
        }
        return new SystemStateReport(issues.isEmpty(), List.copyOf(issues));
    }

    public record SystemStateReport(
            boolean valid,
            List<String> issues
    ) {
    }
}
