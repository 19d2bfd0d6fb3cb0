package com.namehub.service;

import com.namehub.model.AddressType;
import com.namehub.model.NameRecord;
import com.namehub.model.Season;
import com.namehub.model.UserRole;
import com.namehub.repository.NameRecordRepository;
import com.namehub.web.CallerPrincipal;
import com.namehub.web.RegistryException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Locale;

/**
 * Registered names and their owners. Names are unique system-wide and every owner holds at most one name.
 */
@Service
@RequiredArgsConstructor
public class NameLedgerService {

    private static final Logger log = LoggerFactory.getLogger(NameLedgerService.class);
    private static final String OWNER_CONSTRAINT = "uq_name_record_owner";

    private final NameRecordRepository nameRecordRepository;
    private final SeasonService seasonService;
    private final SubscriptionService subscriptionService;
    private final AccessControlService accessControlService;
    private final NameRules nameRules;
    private final RegistryMutationExecutor registryMutationExecutor;
    private final Clock clock;

    public boolean isNameTaken(String name) {
        return nameRecordRepository.existsById(nameRules.normalize(name));
    }

    public boolean ownerHasName(String owner) {
        return nameRecordRepository.existsByOwner(owner);
    }

    public long registrationCount(Long seasonId) {
        return nameRecordRepository.countBySeasonId(seasonId);
    }

    public NameRecord getNameRecord(String name) {
        String normalized = nameRules.normalize(name);
        return nameRecordRepository.findById(normalized)
                .orElseThrow(() -> RegistryException.nameNotFound(normalized));
    }

    public List<NameRecord> listNameRecords() {
        return nameRecordRepository.findAllByOrderByCreatedAtAsc();
    }

    /**
     * Inserts a record whose uniqueness the caller has already checked inside the same transaction.
     * A key violation from a concurrent writer is reported as the matching domain error.
     */
    public NameRecord commit(NameRecord record) {
        try {
            return nameRecordRepository.saveAndFlush(record);
        } catch (DataIntegrityViolationException ex) {
            String detail = String.valueOf(ex.getMostSpecificCause().getMessage()).toLowerCase(Locale.ROOT);
            if (detail.contains(OWNER_CONSTRAINT)) {
                throw RegistryException.alreadyRegistered(record.getOwner());
            }
            throw RegistryException.nameTaken(record.getName());
        }
    }

    /**
     * Grants a name without payment. The one-name-per-owner and uniqueness rules apply as for paid registrations.
     */
    public NameRecord adminAddName(String caller, String name, String address, AddressType addressType, String owner) {
        String normalized = nameRules.normalize(name);
        nameRules.requireValidSyntax(normalized);
        if (CallerPrincipal.isAnonymous(owner)) {
            throw RegistryException.invalidPrincipal("The anonymous principal cannot own a name");
        }
        requireAddress(address, addressType);

        return registryMutationExecutor.execute(() -> {
            accessControlService.requireRole(caller, UserRole.ADMIN);
            Season season = seasonService.getActiveSeason();
            if (ownerHasName(owner)) {
                throw RegistryException.alreadyRegistered(owner);
            }
            if (nameRecordRepository.existsById(normalized)) {
                throw RegistryException.nameTaken(normalized);
            }

            OffsetDateTime now = OffsetDateTime.now(clock);
            NameRecord saved = commit(newRecord(normalized, address, addressType, owner, season.getId(), now));
            subscriptionService.grant(owner, normalized, null, now);
            log.info("Name '{}' granted to {} by admin {}", normalized, owner, caller);
            return saved;
        });
    }

    /**
     * Bumps updatedAt after associated content changed.
     */
    public NameRecord touch(NameRecord record) {
        record.setUpdatedAt(OffsetDateTime.now(clock));
        return nameRecordRepository.save(record);
    }

    public NameRecord newRecord(
            String normalizedName,
            String address,
            AddressType addressType,
            String owner,
            Long seasonId,
            OffsetDateTime now
    ) {
        NameRecord record = new NameRecord();
        record.setName(normalizedName);
        record.setAddress(address.trim());
        record.setAddressType(addressType);
        record.setOwner(owner);
        record.setSeasonId(seasonId);
        record.setCreatedAt(now);
        record.setUpdatedAt(now);
        return record;
    }

    static void requireAddress(String address, AddressType addressType) {
        if (address == null || address.isBlank()) {
            throw RegistryException.invalidRange("Target address is required");
        }
        if (address.length() > NameRecord.MAX_ADDRESS_LENGTH) {
            throw RegistryException.invalidRange(
                    "Target address may not exceed " + NameRecord.MAX_ADDRESS_LENGTH + " characters"
            );
        }
        if (addressType == null) {
            throw RegistryException.invalidRange("Address type is required");
        }
    }
}
