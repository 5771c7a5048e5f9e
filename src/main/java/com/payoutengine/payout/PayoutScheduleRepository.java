package com.payoutengine.payout;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PayoutScheduleRepository extends JpaRepository<PayoutSchedule, Long> {
}
