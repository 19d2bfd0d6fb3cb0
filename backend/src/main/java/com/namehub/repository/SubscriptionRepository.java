package com.namehub.repository;

import com.namehub.model.Subscription;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface SubscriptionRepository extends JpaRepository<Subscription, Long> {
    Optional<Subscription> findFirstBySubscriberOrderByStartTimeDesc(String subscriber);

    Optional<Subscription> findByRegisteredName(String registeredName);

    @Query("SELECT COUNT(s) FROM Subscription s WHERE s.active = true AND s.endTime > :now")
    long countActiveAt(@Param("now") OffsetDateTime now);

    @Modifying
    @Query("UPDATE Subscription s SET s.active = false, s.updatedAt = :now WHERE s.active = true")
    int deactivateAll(@Param("now") OffsetDateTime now);

    @Query("SELECT r.name FROM NameRecord r "
            + "WHERE NOT EXISTS (SELECT s FROM Subscription s WHERE s.registeredName = r.name)")
    List<String> findNamesWithoutSubscription();
}
