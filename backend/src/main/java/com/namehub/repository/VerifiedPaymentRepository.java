package com.namehub.repository;

import com.namehub.model.VerifiedPayment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface VerifiedPaymentRepository extends JpaRepository<VerifiedPayment, Long> {
    Optional<VerifiedPayment> findByBlockReference(String blockReference);

    List<VerifiedPayment> findByPayerOrderByVerifiedAtDesc(String payer);

    @Query("SELECT COALESCE(SUM(p.amount), 0L) FROM VerifiedPayment p")
    long sumAmount();
}
