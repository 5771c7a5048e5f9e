package com.payoutengine.vending;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface MachineAssignmentRepository extends JpaRepository<MachineAssignment, Long> {

    Optional<MachineAssignment> findByMachineIdAndUnassignedAtIsNull(String machineId);

    List<MachineAssignment> findByBeneficiaryIdAndUnassignedAtIsNullOrderByMachineIdAsc(String beneficiaryId);

    List<MachineAssignment> findByUnassignedAtIsNullOrderByMachineIdAsc();

    List<MachineAssignment> findByMachineIdOrderByAssignedAtDesc(String machineId);

    @Query("select distinct a.beneficiaryId from MachineAssignment a where a.unassignedAt is null order by a.beneficiaryId")
    List<String> findBeneficiariesWithActiveAssignments();
}
