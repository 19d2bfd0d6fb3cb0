package com.namehub.repository;

import com.namehub.model.ConsumedReference;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ConsumedReferenceRepository extends JpaRepository<ConsumedReference, String> {

    @Query("SELECT c.blockReference FROM ConsumedReference c "
            + "WHERE NOT EXISTS (SELECT p FROM VerifiedPayment p WHERE p.blockReference = c.blockReference)")
    List<String> findReferencesWithoutPayment();
}
