package com.namehub.repository;

import com.namehub.model.RoleAssignment;
import com.namehub.model.UserRole;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface RoleAssignmentRepository extends JpaRepository<RoleAssignment, String> {
    long countByRole(UserRole role);

    List<RoleAssignment> findByRoleOrderByCreatedAtAsc(UserRole role);
}
