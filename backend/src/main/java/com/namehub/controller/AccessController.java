package com.namehub.controller;

import com.namehub.controller.dto.RegistryRequests;
import com.namehub.controller.dto.RegistryResponses;
import com.namehub.service.AccessControlService;
import com.namehub.web.CallerPrincipal;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for caller enrollment and role management.
 */
@RestController
@RequestMapping("/api/access")
public class AccessController {

    private final AccessControlService accessControlService;

    public AccessController(AccessControlService accessControlService) {
        this.accessControlService = accessControlService;
    }

    /**
     * Enroll the caller. The first caller becomes admin.
     */
    @PostMapping("/initialize")
    public ResponseEntity<RegistryResponses.RoleResponse> initialize(
            @RequestHeader(name = CallerPrincipal.HEADER, required = false) String principal
    ) {
        String caller = CallerPrincipal.resolve(principal);
        return ResponseEntity.ok(new RegistryResponses.RoleResponse(caller, accessControlService.initialize(caller)));
    }

    @GetMapping("/role")
    public ResponseEntity<RegistryResponses.RoleResponse> getCallerRole(
            @RequestHeader(name = CallerPrincipal.HEADER, required = false) String principal
    ) {
        String caller = CallerPrincipal.resolve(principal);
        return ResponseEntity.ok(new RegistryResponses.RoleResponse(caller, accessControlService.roleOf(caller)));
    }

    @GetMapping("/admin")
    public ResponseEntity<RegistryResponses.BooleanResult> isCallerAdmin(
            @RequestHeader(name = CallerPrincipal.HEADER, required = false) String principal
    ) {
        return ResponseEntity.ok(new RegistryResponses.BooleanResult(
                accessControlService.isAdmin(CallerPrincipal.resolve(principal))
        ));
    }

    @GetMapping("/admins")
    public ResponseEntity<RegistryResponses.AdminList> listAdmins() {
        return ResponseEntity.ok(new RegistryResponses.AdminList(
                accessControlService.adminCount(),
                accessControlService.listAdmins()
        ));
    }

    @PutMapping("/roles/{target}")
    public ResponseEntity<RegistryResponses.RoleResponse> assignRole(
            @RequestHeader(name = CallerPrincipal.HEADER, required = false) String principal,
            @PathVariable String target,
            @Valid @RequestBody RegistryRequests.AssignRoleRequest request
    ) {
        accessControlService.assignRole(CallerPrincipal.resolve(principal), target, request.role());
        return ResponseEntity.ok(new RegistryResponses.RoleResponse(target, accessControlService.roleOf(target)));
    }
}
