package com.namehub.service;

import com.namehub.model.NameRecord;
import com.namehub.model.Season;
import com.namehub.model.SeasonStatus;
import com.namehub.model.UserRole;
import com.namehub.repository.NameRecordRepository;
import com.namehub.repository.SeasonRepository;
import com.namehub.web.RegistryException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Season lifecycle: DRAFT to ACTIVE, then ACTIVE to ENDED or CANCELLED.
 * At most one season is ACTIVE at any time.
 */
@Service
@RequiredArgsConstructor
public class SeasonService {

    private static final Logger log = LoggerFactory.getLogger(SeasonService.class);

    private final SeasonRepository seasonRepository;
    private final NameRecordRepository nameRecordRepository;
    private final AccessControlService accessControlService;
    private final RegistryMutationExecutor registryMutationExecutor;
    private final Clock clock;

    public Season create(String caller, SeasonDraft draft) {
        accessControlService.requireRole(caller, UserRole.ADMIN);
        validate(draft);

        return registryMutationExecutor.execute(() -> {
            OffsetDateTime now = OffsetDateTime.now(clock);
            Season season = new Season();
            season.setName(draft.name().trim());
            season.setStartTime(draft.startTime());
            season.setEndTime(draft.endTime());
            season.setMaxNames(draft.maxNames());
            season.setMinNameLength(draft.minNameLength());
            season.setMaxNameLength(draft.maxNameLength());
            season.setPrice(draft.price());
            season.setStatus(SeasonStatus.DRAFT);
            season.setCreatedAt(now);
            season.setUpdatedAt(now);
            Season saved = seasonRepository.save(season);
            log.info("Season {} '{}' created by {}", saved.getId(), saved.getName(), caller);
            return saved;
        });
    }

    public Season activate(String caller, Long seasonId) {
        return registryMutationExecutor.execute(() -> {
            accessControlService.requireRole(caller, UserRole.ADMIN);
            Season season = requireSeason(seasonId);
            seasonRepository.findFirstByStatusOrderByIdAsc(SeasonStatus.ACTIVE)
                    .filter(active -> !active.getId().equals(seasonId))
                    .ifPresent(active -> {
                        throw RegistryException.alreadyActive(active.getId());
                    });
            if (season.getStatus() != SeasonStatus.DRAFT) {
                throw RegistryException.notDraft(seasonId);
            }
            return transition(season, SeasonStatus.ACTIVE, caller);
        });
    }

    public Season end(String caller, Long seasonId) {
        return close(caller, seasonId, SeasonStatus.ENDED);
    }

    public Season cancel(String caller, Long seasonId) {
        return close(caller, seasonId, SeasonStatus.CANCELLED);
    }

    public Season getSeason(Long seasonId) {
        return requireSeason(seasonId);
    }

    public List<Season> listSeasons() {
        return seasonRepository.findAllByOrderByIdAsc();
    }

    public Season getActiveSeason() {
        return seasonRepository.findFirstByStatusOrderByIdAsc(SeasonStatus.ACTIVE)
                .orElseThrow(RegistryException::noActiveSeason);
    }

    public ActiveSeasonInfo activeSeasonInfo() {
        Season season = getActiveSeason();
        return new ActiveSeasonInfo(season, availableNames(season), season.getPrice());
    }

    /**
     * Remaining capacity from the live registration count.
     */
    public long availableNames(Season season) {
        long registered = nameRecordRepository.countBySeasonId(season.getId());
        return Math.max(0L, season.getMaxNames() - registered);
    }

    private Season close(String caller, Long seasonId, SeasonStatus target) {
        return registryMutationExecutor.execute(() -> {
            accessControlService.requireRole(caller, UserRole.ADMIN);
            Season season = requireSeason(seasonId);
            if (season.getStatus() != SeasonStatus.ACTIVE) {
                throw RegistryException.notActive(seasonId);
            }
            return transition(season, target, caller);
        });
    }

    private Season transition(Season season, SeasonStatus target, String caller) {
        SeasonStatus previous = season.getStatus();
        season.setStatus(target);
        season.setUpdatedAt(OffsetDateTime.now(clock));
        Season saved = seasonRepository.save(season);
        log.info("Season {} moved {} -> {} by {}", saved.getId(), previous, target, caller);
        return saved;
    }

    private Season requireSeason(Long seasonId) {
        if (seasonId == null) {
            throw RegistryException.seasonNotFound(null);
        }
        return seasonRepository.findById(seasonId)
                .orElseThrow(() -> RegistryException.seasonNotFound(seasonId));
    }

    private static void validate(SeasonDraft draft) {
        if (draft.name() == null || draft.name().isBlank()) {
            throw RegistryException.invalidRange("Season name is required");
        }
        if (draft.startTime() == null || draft.endTime() == null || !draft.startTime().isBefore(draft.endTime())) {
            throw RegistryException.invalidRange("Season start must be before its end");
        }
        if (draft.minNameLength() == null || draft.maxNameLength() == null
                || draft.minNameLength() < 1 || draft.minNameLength() > draft.maxNameLength()) {
            throw RegistryException.invalidRange("Minimum name length must be positive and at most the maximum");
        }
        if (draft.maxNameLength() > NameRecord.MAX_NAME_LENGTH) {
            throw RegistryException.invalidRange("Maximum name length may not exceed " + NameRecord.MAX_NAME_LENGTH);
        }
        if (draft.maxNames() == null || draft.maxNames() < 1) {
            throw RegistryException.invalidRange("Season must offer at least one name");
        }
        if (draft.price() == null || draft.price() <= 0) {
            throw RegistryException.invalidRange("Season price must be positive");
        }
    }

    public record SeasonDraft(
            String name,
            OffsetDateTime startTime,
            OffsetDateTime endTime,
            Integer maxNames,
            Integer minNameLength,
            Integer maxNameLength,
            Long price
    ) {
    }

    public record ActiveSeasonInfo(
            Season season,
            long availableNames,
            long price
    ) {
    }
}
