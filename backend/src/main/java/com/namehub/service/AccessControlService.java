package com.namehub.service;

import com.namehub.model.RoleAssignment;
import com.namehub.model.UserRole;
import com.namehub.repository.RoleAssignmentRepository;
import com.namehub.web.CallerPrincipal;
import com.namehub.web.RegistryException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Role lookups and assignment. Unknown and anonymous callers are guests.
 */
@Service
@RequiredArgsConstructor
public class AccessControlService {

    private static final Logger log = LoggerFactory.getLogger(AccessControlService.class);

    private final RoleAssignmentRepository roleAssignmentRepository;
    private final RegistryMutationExecutor registryMutationExecutor;
    private final Clock clock;

    public UserRole roleOf(String principal) {
        if (CallerPrincipal.isAnonymous(principal)) {
            return UserRole.GUEST;
        }
        return roleAssignmentRepository.findById(principal)
                .map(RoleAssignment::getRole)
                .orElse(UserRole.GUEST);
    }

    public boolean hasPermission(String principal, UserRole required) {
        return roleOf(principal).satisfies(required);
    }

    public void requireRole(String principal, UserRole required) {
        if (!hasPermission(principal, required)) {
            throw RegistryException.unauthorized("Caller lacks required role " + required + ": " + principal);
        }
    }

    public boolean isAdmin(String principal) {
        return roleOf(principal) == UserRole.ADMIN;
    }

    /**
     * Enrolls the caller. The first caller ever becomes the admin, later unknown callers become users
     * and known callers keep their role.
     */
    public UserRole initialize(String caller) {
        if (CallerPrincipal.isAnonymous(caller)) {
            throw RegistryException.unauthorized("Anonymous callers cannot be enrolled");
        }
        return registryMutationExecutor.execute(() -> {
            RoleAssignment existing = roleAssignmentRepository.findById(caller).orElse(null);
            if (existing != null) {
                return existing.getRole();
            }
            UserRole role = roleAssignmentRepository.countByRole(UserRole.ADMIN) == 0
                    ? UserRole.ADMIN
                    : UserRole.USER;
            save(caller, role, caller);
            log.info("Enrolled {} as {}", caller, role);
            return role;
        });
    }

    public void assignRole(String caller, String target, UserRole role) {
        if (role == null) {
            throw RegistryException.invalidRange("Role is required");
        }
        if (CallerPrincipal.isAnonymous(target)) {
            throw RegistryException.invalidPrincipal("The anonymous principal cannot hold a role");
        }
        registryMutationExecutor.run(() -> {
            requireRole(caller, UserRole.ADMIN);
            RoleAssignment existing = roleAssignmentRepository.findById(target).orElse(null);
            if (existing != null
                    && existing.getRole() == UserRole.ADMIN
                    && role != UserRole.ADMIN
                    && roleAssignmentRepository.countByRole(UserRole.ADMIN) <= 1) {
                throw RegistryException.lastAdmin(target);
            }
            save(target, role, caller);
            log.info("Role of {} set to {} by {}", target, role, caller);
        });
    }

    public long adminCount() {
        return roleAssignmentRepository.countByRole(UserRole.ADMIN);
    }

    public List<String> listAdmins() {
        return roleAssignmentRepository.findByRoleOrderByCreatedAtAsc(UserRole.ADMIN).stream()
                .map(RoleAssignment::getPrincipal)
                .toList();
    }

    private void save(String principal, UserRole role, String assignedBy) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        RoleAssignment assignment = roleAssignmentRepository.findById(principal).orElseGet(() -> {
            RoleAssignment created = new RoleAssignment();
            created.setPrincipal(principal);
            created.setCreatedAt(now);
            return created;
        });
        assignment.setRole(role);
        assignment.setAssignedBy(assignedBy);
        assignment.setUpdatedAt(now);
        roleAssignmentRepository.save(assignment);
    }
}
