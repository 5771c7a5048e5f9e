package com.payoutengine.payout;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PayoutLineRepository extends JpaRepository<PayoutLine, Long> {

    List<PayoutLine> findByPayoutIdOrderByMachineIdAsc(Long payoutId);
}
