package com.payoutengine.vending.vendista;

import com.payoutengine.common.Money;
import com.payoutengine.vending.TerminalDataException;
import com.payoutengine.vending.TerminalDataService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Revenue from Vendista sales.
 *
 * Only transactions of the requested machine whose calendar date lies inside
 * the window are summed; Vendista may return neighbours on the boundary days.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VendistaTerminalDataService implements TerminalDataService {

    private final VendistaClient client;

    @Override
    public Money revenue(String machineId, LocalDate from, LocalDate to) {
        List<VendistaDTOs.Transaction> transactions = client.fetchTransactions(machineId, from, to);

        BigDecimal total = BigDecimal.ZERO;
        int counted = 0;
        for (VendistaDTOs.Transaction transaction : transactions) {
            if (!machineId.equals(transaction.getMachineId())) {
                continue;
            }
            LocalDate date = dateOf(transaction);
            if (date.isBefore(from) || date.isAfter(to)) {
                continue;
            }
            if (transaction.getAmount() == null) {
                throw new TerminalDataException("Transaction " + transaction.getId() + " of machine " + machineId
                    + " has no amount");
            }
            total = total.add(transaction.getAmount());
            counted++;
        }

        log.debug("Revenue of machine {} for {}..{}: {} from {} transactions", machineId, from, to, total, counted);
        return Money.rub(total);
    }

    private static LocalDate dateOf(VendistaDTOs.Transaction transaction) {
        String date = transaction.getDate();
        if (date == null || date.length() < 10) {
            throw new TerminalDataException("Transaction " + transaction.getId() + " has no valid date: " + date);
        }
        try {
            return LocalDate.parse(date.substring(0, 10));
        } catch (DateTimeParseException e) {
            throw new TerminalDataException("Transaction " + transaction.getId() + " has no valid date: " + date, e);
        }
    }
}
