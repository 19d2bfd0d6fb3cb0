package com.namehub.controller;

import com.namehub.controller.dto.RegistryRequests;
import com.namehub.controller.dto.RegistryResponses;
import com.namehub.mapper.RegistryResponseMapper;
import com.namehub.service.SeasonService;
import com.namehub.web.CallerPrincipal;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Season administration and queries. Mutations require the admin role.
 */
@RestController
@RequestMapping("/api/seasons")
public class SeasonController {

    private final SeasonService seasonService;
    private final RegistryResponseMapper registryResponseMapper;

    public SeasonController(SeasonService seasonService, RegistryResponseMapper registryResponseMapper) {
        this.seasonService = seasonService;
        this.registryResponseMapper = registryResponseMapper;
    }

    @PostMapping
    public ResponseEntity<RegistryResponses.SeasonDetail> createSeason(
            @RequestHeader(name = CallerPrincipal.HEADER, required = false) String principal,
            @Valid @RequestBody RegistryRequests.CreateSeasonRequest request
    ) {
        SeasonService.SeasonDraft draft = new SeasonService.SeasonDraft(
                request.name(),
                request.startTime(),
                request.endTime(),
                request.maxNames(),
                request.minNameLength(),
                request.maxNameLength(),
                request.price()
        );
        RegistryResponses.SeasonDetail created = registryResponseMapper.toSeasonDetail(
                seasonService.create(CallerPrincipal.resolve(principal), draft)
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping
    public ResponseEntity<List<RegistryResponses.SeasonDetail>> listSeasons() {
        return ResponseEntity.ok(registryResponseMapper.toSeasonDetails(seasonService.listSeasons()));
    }

    @GetMapping("/{seasonId}")
    public ResponseEntity<RegistryResponses.SeasonDetail> getSeason(@PathVariable Long seasonId) {
        return ResponseEntity.ok(registryResponseMapper.toSeasonDetail(seasonService.getSeason(seasonId)));
    }

    @GetMapping("/active")
    public ResponseEntity<RegistryResponses.SeasonDetail> getActiveSeason() {
        return ResponseEntity.ok(registryResponseMapper.toSeasonDetail(seasonService.getActiveSeason()));
    }

    @GetMapping("/active/info")
    public ResponseEntity<RegistryResponses.ActiveSeasonInfo> getActiveSeasonInfo() {
        return ResponseEntity.ok(registryResponseMapper.toActiveSeasonInfo(seasonService.activeSeasonInfo()));
    }

    @PostMapping("/{seasonId}/activate")
    public ResponseEntity<RegistryResponses.SeasonDetail> activateSeason(
            @RequestHeader(name = CallerPrincipal.HEADER, required = false) String principal,
            @PathVariable Long seasonId
    ) {
        return ResponseEntity.ok(registryResponseMapper.toSeasonDetail(
                seasonService.activate(CallerPrincipal.resolve(principal), seasonId)
        ));
    }

    @PostMapping("/{seasonId}/end")
    public ResponseEntity<RegistryResponses.SeasonDetail> endSeason(
            @RequestHeader(name = CallerPrincipal.HEADER, required = false) String principal,
            @PathVariable Long seasonId
    ) {
        return ResponseEntity.ok(registryResponseMapper.toSeasonDetail(
                seasonService.end(CallerPrincipal.resolve(principal), seasonId)
        ));
    }

    @PostMapping("/{seasonId}/cancel")
    public ResponseEntity<RegistryResponses.SeasonDetail> cancelSeason(
            @RequestHeader(name = CallerPrincipal.HEADER, required = false) String principal,
            @PathVariable Long seasonId
    ) {
        return ResponseEntity.ok(registryResponseMapper.toSeasonDetail(
                seasonService.cancel(CallerPrincipal.resolve(principal), seasonId)
        ));
    }
}
