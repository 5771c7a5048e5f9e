package com.payoutengine.vending;

import com.payoutengine.beneficiary.BeneficiaryService;
import com.payoutengine.common.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Service for assigning vending machines to beneficiaries.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AssignmentService {

    private static final BigDecimal MAX_PERCENT = BigDecimal.valueOf(100);

    private final MachineAssignmentRepository assignmentRepository;
    private final BeneficiaryService beneficiaryService;
    private final Clock clock;

    /**
     * Assign a machine. An active assignment of the same machine is closed first.
     */
    @Transactional
    public MachineAssignment assign(String machineId, String beneficiaryId, BigDecimal commissionPercent,
                                    String createdBy) {
        if (machineId == null || machineId.isBlank()) {
            throw new ValidationException("machine_id is required");
        }
        validateCommission(commissionPercent);
        beneficiaryService.getBeneficiary(beneficiaryId);

        Instant now = clock.instant();
        Optional<MachineAssignment> current = assignmentRepository.findByMachineIdAndUnassignedAtIsNull(machineId);
        current.ifPresent(active -> {
            active.close(now);
            assignmentRepository.saveAndFlush(active);
            log.info("Closed assignment {} of machine {} (beneficiary {})",
                active.getId(), machineId, active.getBeneficiaryId());
        });

        MachineAssignment assignment = new MachineAssignment(machineId, beneficiaryId,
            commissionPercent.setScale(1, RoundingMode.UNNECESSARY), now, createdBy);
        assignmentRepository.save(assignment);

        log.info("Assigned machine {} to beneficiary {} with commission {}%",
            machineId, beneficiaryId, assignment.getCommissionPercent());
        return assignment;
    }

    @Transactional
    public MachineAssignment unassign(Long assignmentId, String by) {
        MachineAssignment assignment = assignmentRepository.findById(assignmentId)
            .orElseThrow(() -> new AssignmentNotFoundException(assignmentId));
        if (!assignment.isActive()) {
            throw new ValidationException("Assignment " + assignmentId + " is already closed");
        }
        assignment.close(clock.instant());
        assignmentRepository.save(assignment);
        log.info("Unassigned machine {} from beneficiary {} (by {})",
            assignment.getMachineId(), assignment.getBeneficiaryId(), by);
        return assignment;
    }

    @Transactional(readOnly = true)
    public List<MachineAssignment> getActiveAssignments(String beneficiaryId) {
        return assignmentRepository.findByBeneficiaryIdAndUnassignedAtIsNullOrderByMachineIdAsc(beneficiaryId);
    }

    @Transactional(readOnly = true)
    public List<MachineAssignment> getAllActiveAssignments() {
        return assignmentRepository.findByUnassignedAtIsNullOrderByMachineIdAsc();
    }

    @Transactional(readOnly = true)
    public List<MachineAssignment> getHistory(String machineId) {
        return assignmentRepository.findByMachineIdOrderByAssignedAtDesc(machineId);
    }

    @Transactional(readOnly = true)
    public List<String> getBeneficiariesWithMachines() {
        return assignmentRepository.findBeneficiariesWithActiveAssignments();
    }

    private static void validateCommission(BigDecimal percent) {
        if (percent == null) {
            throw new ValidationException("commission_percent is required");
        }
        if (percent.signum() < 0 || percent.compareTo(MAX_PERCENT) > 0) {
            throw new ValidationException("commission_percent must be between 0 and 100, got " + percent.toPlainString());
        }
        if (percent.stripTrailingZeros().scale() > 1) {
            throw new ValidationException("commission_percent allows at most one decimal place, got " + percent.toPlainString());
        }
    }
}
