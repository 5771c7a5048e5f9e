package com.payoutengine.vending;

import com.payoutengine.common.Money;

import java.time.LocalDate;

/**
 * Source of vending terminal revenue.
 */
public interface TerminalDataService {

    /**
     * Gross sales of one machine over an inclusive date window.
     *
     * @throws TerminalDataException if the terminal service cannot be reached or answers garbage
     */
    Money revenue(String machineId, LocalDate from, LocalDate to);
}
