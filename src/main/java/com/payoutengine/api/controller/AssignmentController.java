package com.payoutengine.api.controller;

import com.payoutengine.api.dto.AssignMachineRequest;
import com.payoutengine.vending.AssignmentService;
import com.payoutengine.vending.MachineAssignment;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for machine assignments.
 */
@RestController
@RequestMapping("/api/v1/assignments")
@RequiredArgsConstructor
@Tag(name = "Assignments", description = "Vending machine to beneficiary assignments")
public class AssignmentController {

    private final AssignmentService assignmentService;

    @PostMapping
    @Operation(summary = "Assign a machine", description = "Closes the machine's current assignment, if any")
    public ResponseEntity<MachineAssignment> assign(@Valid @RequestBody AssignMachineRequest request) {
        MachineAssignment assignment = assignmentService.assign(
            request.getMachineId(),
            request.getBeneficiaryId(),
            request.getCommissionPercent(),
            request.getCreatedBy()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(assignment);
    }

    @DeleteMapping("/{assignmentId}")
    @Operation(summary = "Unassign a machine")
    public ResponseEntity<MachineAssignment> unassign(@PathVariable Long assignmentId,
                                                      @RequestParam(required = false) String by) {
        return ResponseEntity.ok(assignmentService.unassign(assignmentId, by));
    }

    @GetMapping
    @Operation(summary = "Active assignments, optionally of one beneficiary")
    public ResponseEntity<List<MachineAssignment>> active(@RequestParam(required = false) String beneficiaryId) {
        List<MachineAssignment> assignments = beneficiaryId != null
            ? assignmentService.getActiveAssignments(beneficiaryId)
            : assignmentService.getAllActiveAssignments();
        return ResponseEntity.ok(assignments);
    }

    @GetMapping("/machines/{machineId}/history")
    @Operation(summary = "Assignment history of a machine")
    public ResponseEntity<List<MachineAssignment>> history(@PathVariable String machineId) {
        return ResponseEntity.ok(assignmentService.getHistory(machineId));
    }

    @GetMapping("/beneficiaries")
    @Operation(summary = "Beneficiaries with at least one active assignment")
    public ResponseEntity<List<String>> beneficiariesWithMachines() {
        return ResponseEntity.ok(assignmentService.getBeneficiariesWithMachines());
    }
}
