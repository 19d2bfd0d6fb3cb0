package com.namehub.controller;

import com.namehub.controller.dto.RegistryResponses;
import com.namehub.mapper.RegistryResponseMapper;
import com.namehub.service.SystemStateService;
import com.namehub.web.CallerPrincipal;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/system")
public class SystemController {

    private final SystemStateService systemStateService;
    private final RegistryResponseMapper registryResponseMapper;

    public SystemController(SystemStateService systemStateService, RegistryResponseMapper registryResponseMapper) {
        this.systemStateService = systemStateService;
        this.registryResponseMapper = registryResponseMapper;
    }

    @GetMapping("/validate")
    public ResponseEntity<RegistryResponses.SystemStateReport> validateSystemState(
            @RequestHeader(name = CallerPrincipal.HEADER, required = false) String principal
    ) {
        return ResponseEntity.ok(registryResponseMapper.toSystemStateReport(
                systemStateService.validate(CallerPrincipal.resolve(principal))
        ));
    }
}
