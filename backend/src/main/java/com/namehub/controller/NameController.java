package com.namehub.controller;

import com.namehub.controller.dto.RegistryRequests;
import com.namehub.controller.dto.RegistryResponses;
import com.namehub.mapper.RegistryResponseMapper;
import com.namehub.service.NameLedgerService;
import com.namehub.web.CallerPrincipal;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
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
 * Name lookups and admin grants.
 */
@RestController
@RequestMapping("/api/names")
@RequiredArgsConstructor
public class NameController {

    private final NameLedgerService nameLedgerService;
    private final RegistryResponseMapper registryResponseMapper;

    @GetMapping
    public ResponseEntity<List<RegistryResponses.NameRecordDetail>> listNameRecords() {
        return ResponseEntity.ok(registryResponseMapper.toNameRecordDetails(nameLedgerService.listNameRecords()));
    }

    @GetMapping("/{name}")
    public ResponseEntity<RegistryResponses.NameRecordDetail> getNameRecord(@PathVariable String name) {
        return ResponseEntity.ok(registryResponseMapper.toNameRecordDetail(nameLedgerService.getNameRecord(name)));
    }

    @GetMapping("/{name}/taken")
    public ResponseEntity<RegistryResponses.BooleanResult> isNameTaken(@PathVariable String name) {
        return ResponseEntity.ok(new RegistryResponses.BooleanResult(nameLedgerService.isNameTaken(name)));
    }

    @GetMapping("/owners/{owner}/registered")
    public ResponseEntity<RegistryResponses.BooleanResult> hasRegisteredName(@PathVariable String owner) {
        return ResponseEntity.ok(new RegistryResponses.BooleanResult(nameLedgerService.ownerHasName(owner)));
    }

    @PostMapping("/grants")
    public ResponseEntity<RegistryResponses.NameRecordDetail> adminAddName(
            @RequestHeader(name = CallerPrincipal.HEADER, required = false) String principal,
            @Valid @RequestBody RegistryRequests.AdminAddNameRequest request
    ) {
        RegistryResponses.NameRecordDetail granted = registryResponseMapper.toNameRecordDetail(
                nameLedgerService.adminAddName(
                        CallerPrincipal.resolve(principal),
                        request.name(),
                        request.address(),
                        request.addressType(),
                        request.owner()
                )
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(granted);
    }
}
