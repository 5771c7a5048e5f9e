package com.payoutengine.beneficiary;

import com.payoutengine.common.exception.BeneficiaryNotFoundException;
import com.payoutengine.common.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Service for the local beneficiary registry.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BeneficiaryService {

    private final BeneficiaryRepository beneficiaryRepository;
    private final Clock clock;

    /**
     * Create or update a beneficiary. The onboarding date of an existing
     * beneficiary is kept, since completed periods were computed from it.
     */
    @Transactional
    public Beneficiary register(String beneficiaryId, String name, String virtualAccount, LocalDate onboardedOn) {
        if (beneficiaryId == null || beneficiaryId.isBlank()) {
            throw new ValidationException("beneficiary_id is required");
        }
        if (virtualAccount == null || virtualAccount.isBlank()) {
            throw new ValidationException("virtual_account is required");
        }
        Instant now = clock.instant();

        Beneficiary beneficiary = beneficiaryRepository.findById(beneficiaryId)
            .map(existing -> {
                existing.setName(name != null ? name : existing.getName());
                existing.setVirtualAccount(virtualAccount);
                existing.setUpdatedAt(now);
                return existing;
            })
            .orElseGet(() -> new Beneficiary(beneficiaryId, name != null ? name : beneficiaryId, virtualAccount,
                onboardedOn != null ? onboardedOn : LocalDate.now(clock), now));

        beneficiaryRepository.save(beneficiary);
        log.info("Registered beneficiary {} with virtual account {}", beneficiaryId, virtualAccount);
        return beneficiary;
    }

    @Transactional(readOnly = true)
    public Beneficiary getBeneficiary(String beneficiaryId) {
        return beneficiaryRepository.findById(beneficiaryId)
            .orElseThrow(() -> new BeneficiaryNotFoundException(beneficiaryId));
    }

    @Transactional(readOnly = true)
    public List<Beneficiary> getAll() {
        return beneficiaryRepository.findAllByOrderByNameAsc();
    }
}
