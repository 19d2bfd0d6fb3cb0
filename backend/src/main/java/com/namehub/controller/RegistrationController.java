package com.namehub.controller;

import com.namehub.controller.dto.RegistryRequests;
import com.namehub.controller.dto.RegistryResponses;
import com.namehub.mapper.RegistryResponseMapper;
import com.namehub.service.RegistrationService;
import com.namehub.web.CallerPrincipal;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Paid name registration.
 */
@RestController
@RequestMapping("/api/registrations")
@RequiredArgsConstructor
public class RegistrationController {

    private final RegistrationService registrationService;
    private final RegistryResponseMapper registryResponseMapper;

    /**
     * Register a name against a ledger payment.
     *
     * @param principal caller principal header
     * @param request name, target and ledger reference
     * @return receipt carrying the payment id
     */
    @PostMapping
    public ResponseEntity<RegistryResponses.RegistrationReceipt> register(
            @RequestHeader(name = CallerPrincipal.HEADER, required = false) String principal,
            @Valid @RequestBody RegistryRequests.RegisterNameRequest request
    ) {
        RegistrationService.RegistrationReceipt receipt = registrationService.register(
                CallerPrincipal.resolve(principal),
                new RegistrationService.RegistrationCommand(
                        request.name(),
                        request.address(),
                        request.addressType(),
                        request.seasonId(),
                        request.blockReference()
                )
        );
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(registryResponseMapper.toRegistrationReceipt(receipt));
    }
}
