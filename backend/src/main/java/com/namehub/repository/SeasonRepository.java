package com.namehub.repository;

import com.namehub.model.Season;
import com.namehub.model.SeasonStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface SeasonRepository extends JpaRepository<Season, Long> {
    List<Season> findAllByOrderByIdAsc();

    List<Season> findByStatus(SeasonStatus status);

    Optional<Season> findFirstByStatusOrderByIdAsc(SeasonStatus status);

    boolean existsByStatusAndIdNot(SeasonStatus status, Long id);

    long countByStatus(SeasonStatus status);
}
