package com.namehub.repository;

import com.namehub.model.NameRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface NameRecordRepository extends JpaRepository<NameRecord, String> {
    boolean existsByOwner(String owner);

    Optional<NameRecord> findByOwner(String owner);

    long countBySeasonId(Long seasonId);

    List<NameRecord> findAllByOrderByCreatedAtAsc();

    @Query("SELECT r.owner FROM NameRecord r GROUP BY r.owner HAVING COUNT(r) > 1")
    List<String> findOwnersWithMultipleNames();
}
