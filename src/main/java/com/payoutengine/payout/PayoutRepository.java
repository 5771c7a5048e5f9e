package com.payoutengine.payout;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for payout persistence.
 */
@Repository
public interface PayoutRepository extends JpaRepository<Payout, Long> {

    Optional<Payout> findTopByBeneficiaryIdAndStatusOrderByPeriodEndDesc(String beneficiaryId, PayoutStatus status);

    List<Payout> findByBeneficiaryIdAndStatusIn(String beneficiaryId, List<PayoutStatus> statuses);

    List<Payout> findByBeneficiaryIdOrderByCreatedAtDesc(String beneficiaryId);

    List<Payout> findByStatusOrderByCreatedAtDesc(PayoutStatus status);

    List<Payout> findAllByOrderByCreatedAtDesc();

    Optional<Payout> findByTransferKey(String transferKey);
}
