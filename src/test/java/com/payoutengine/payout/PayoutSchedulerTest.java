package com.payoutengine.payout;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.payoutengine.beneficiary.BeneficiaryRepository;
import com.payoutengine.beneficiary.BeneficiaryService;
import com.payoutengine.common.Money;
import com.payoutengine.common.exception.BatchAlreadyRunningException;
import com.payoutengine.common.exception.InvalidPayoutStateException;
import com.payoutengine.common.exception.ValidationException;
import com.payoutengine.credentials.CredentialStore;
import com.payoutengine.credentials.Layer;
import com.payoutengine.gateway.ResponseCache;
import com.payoutengine.gateway.RpcReply;
import com.payoutengine.gateway.RpcTimeoutException;
import com.payoutengine.gateway.RpcTransport;
import com.payoutengine.signing.SignedRequest;
import com.payoutengine.signing.SigningException;
import com.payoutengine.support.MutableClock;
import com.payoutengine.support.TestKeys;
import com.payoutengine.vending.AssignmentService;
import com.payoutengine.vending.MachineAssignmentRepository;
import com.payoutengine.vending.TerminalDataException;
import com.payoutengine.vending.TerminalDataService;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Integration tests for payout execution.
 *
 * The platform transport and the terminal data source are mocked; everything
 * else, including signing and persistence, is real. Not transactional: runs
 * commit step by step and concurrent runs must see each other's rows.
 */
@SpringBootTest
@ActiveProfiles("test")
class PayoutSchedulerTest {

    private static final Instant ONBOARDING = Instant.parse("2024-01-01T08:00:00Z");
    private static final Instant RUN_TIME = Instant.parse("2024-02-01T09:00:00Z");
    private static final LocalDate JAN_31 = LocalDate.of(2024, 1, 31);
    private static final LocalDate FEB_29 = LocalDate.of(2024, 2, 29);

    @TestConfiguration
    static class ClockOverride {
        @Bean
        @Primary
        MutableClock testClock() {
            return new MutableClock(ONBOARDING);
        }
    }

    @MockBean
    private RpcTransport transport;

    @MockBean
    private TerminalDataService terminalDataService;

    @Autowired
    private MutableClock clock;

    @Autowired
    private PayoutScheduler scheduler;

    @Autowired
    private PayoutStore payoutStore;

    @Autowired
    private PayoutCalculator calculator;

    @Autowired
    private PayoutScheduleService scheduleService;

    @Autowired
    private BeneficiaryService beneficiaryService;

    @Autowired
    private AssignmentService assignmentService;

    @Autowired
    private CredentialStore credentialStore;

    @Autowired
    private ResponseCache responseCache;

    @Autowired
    private PayoutRepository payoutRepository;

    @Autowired
    private PayoutLineRepository lineRepository;

    @Autowired
    private PayoutScheduleRepository scheduleRepository;

    @Autowired
    private MachineAssignmentRepository assignmentRepository;

    @Autowired
    private BeneficiaryRepository beneficiaryRepository;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @BeforeEach
    void setUp() {
        cleanUp();

        clock.set(ONBOARDING);
        credentialStore.install(Layer.SANDBOX, TestKeys.primary().getPrivateKeyPem(), "test-system", null, "test");

        beneficiaryService.register("ben-a", "Alpha LLC", "va-a", LocalDate.of(2024, 1, 1));
        assignmentService.assign("M-1", "ben-a", new BigDecimal("10"), "test");
        assignmentService.assign("M-2", "ben-a", new BigDecimal("5"), "test");

        clock.set(RUN_TIME);
    }

    @Test
    void testRunOne_Completed() {
        revenue("M-1", "1000");
        revenue("M-2", "500");
        when(transport.send(any())).thenReturn(reply("{\"jsonrpc\":\"2.0\",\"result\":{\"transfer\":{\"id\":\"tr-1\",\"status\":\"success\"}}}"));

        PayoutOutcome outcome = scheduler.runOne("ben-a", JAN_31, "admin");

        assertEquals(PayoutOutcome.Status.COMPLETED, outcome.getStatus());
        Payout payout = payoutStore.getPayout(outcome.getPayoutId());
        assertEquals(PayoutStatus.COMPLETED, payout.getStatus());
        assertEquals("tr-1", payout.getExternalReference());
        assertEquals(new BigDecimal("1500.00"), payout.getTotalSales());
        assertEquals(new BigDecimal("125.00"), payout.getCommissionAmount());
        assertEquals(new BigDecimal("1375.00"), payout.getPayoutAmount());
        assertEquals(LocalDate.of(2024, 1, 1), payout.getPeriodStart());
        assertEquals(2, payoutStore.getLines(payout.getId()).size());

        SignedRequest sent = sentRequest();
        assertEquals("transfer_between_virtual_accounts_v2", sent.getMethod());
        assertTrue(sent.getBody().contains("\"ext_key\":\"" + payout.getTransferKey() + "\""));
        assertTrue(sent.getBody().contains("\"to_virtual_account\":\"va-a\""));
        assertTrue(sent.getBody().contains("\"amount\":1375.00"));
    }

    @Test
    void testRunOne_ZeroAmountSkipped() {
        revenue("M-1", "0");
        revenue("M-2", "0");

        PayoutOutcome outcome = scheduler.runOne("ben-a", JAN_31, "admin");

        assertEquals(PayoutOutcome.Status.SKIPPED, outcome.getStatus());
        assertNull(outcome.getPayoutId());
        assertEquals(0, payoutRepository.count());
        verifyNoInteractions(transport);
    }

    @Test
    void testRunOne_ConsecutivePeriods() {
        revenue("M-1", "100");
        revenue("M-2", "100");
        when(transport.send(any())).thenReturn(reply("{\"result\":{\"transfer\":{\"id\":\"tr-1\"}}}"));

        scheduler.runOne("ben-a", JAN_31, "admin");
        PayoutOutcome second = scheduler.runOne("ben-a", FEB_29, "admin");

        assertEquals(PayoutOutcome.Status.COMPLETED, second.getStatus());
        assertEquals(LocalDate.of(2024, 2, 1), payoutStore.getPayout(second.getPayoutId()).getPeriodStart());
        verify(terminalDataService).revenue("M-1", LocalDate.of(2024, 2, 1), FEB_29);

        PayoutOutcome repeated = scheduler.runOne("ben-a", FEB_29, "admin");
        assertEquals(PayoutOutcome.Status.SKIPPED, repeated.getStatus());
    }

    @Test
    void testRunOne_FailedPeriodIsRetried() {
        revenue("M-1", "100");
        revenue("M-2", "0");
        when(transport.send(any()))
            .thenReturn(reply("{\"error\":{\"code\":4415,\"message\":\"Insufficient funds\"}}"))
            .thenReturn(reply("{\"result\":{\"transfer\":{\"id\":\"tr-2\"}}}"));

        PayoutOutcome failed = scheduler.runOne("ben-a", JAN_31, "admin");
        PayoutOutcome retried = scheduler.runOne("ben-a", JAN_31, "admin");

        assertEquals(PayoutOutcome.Status.FAILED, failed.getStatus());
        assertEquals("Insufficient funds", payoutStore.getPayout(failed.getPayoutId()).getErrorMessage());
        assertEquals(PayoutOutcome.Status.COMPLETED, retried.getStatus());

        Payout first = payoutStore.getPayout(failed.getPayoutId());
        Payout second = payoutStore.getPayout(retried.getPayoutId());
        assertEquals(first.getPeriodStart(), second.getPeriodStart());
        assertNotEquals(first.getTransferKey(), second.getTransferKey());
    }

    @Test
    void testRunOne_TimeoutBlocksUntilReconciled() {
        revenue("M-1", "100");
        revenue("M-2", "0");
        when(transport.send(any())).thenThrow(new RpcTimeoutException("No reply within 8000 ms", null));

        PayoutOutcome timedOut = scheduler.runOne("ben-a", JAN_31, "admin");

        assertEquals(PayoutOutcome.Status.UNCONFIRMED, timedOut.getStatus());
        Payout payout = payoutStore.getPayout(timedOut.getPayoutId());
        assertEquals(PayoutStatus.PROCESSING, payout.getStatus());

        PayoutOutcome blocked = scheduler.runOne("ben-a", FEB_29, "admin");
        assertEquals(PayoutOutcome.Status.BLOCKED, blocked.getStatus());
        assertEquals(payout.getId(), blocked.getPayoutId());
        assertEquals(1, payoutRepository.count());

        reset(transport);
        when(transport.send(any())).thenReturn(
            reply("{\"result\":{\"transfer\":{\"id\":\"tr-9\",\"status\":\"SUCCESS\"}}}"));

        PayoutOutcome reconciled = scheduler.reconcile(payout.getId(), "tr-9");

        assertEquals(PayoutOutcome.Status.COMPLETED, reconciled.getStatus());
        assertEquals("tr-9", payoutStore.getPayout(payout.getId()).getExternalReference());
        SignedRequest lookup = sentRequest();
        assertEquals("get_virtual_accounts_transfer", lookup.getMethod());
        assertTrue(lookup.getBody().contains("\"transfer_id\":\"tr-9\""));
    }

    @Test
    void testReconcile_StillInProcess() {
        revenue("M-1", "100");
        revenue("M-2", "0");
        when(transport.send(any()))
            .thenThrow(new RpcTimeoutException("No reply within 8000 ms", null))
            .thenReturn(reply("{\"result\":{\"transfer\":{\"id\":\"tr-9\",\"status\":\"in_process\"}}}"));
        PayoutOutcome timedOut = scheduler.runOne("ben-a", JAN_31, "admin");

        PayoutOutcome outcome = scheduler.reconcile(timedOut.getPayoutId(), "tr-9");

        assertEquals(PayoutOutcome.Status.UNCONFIRMED, outcome.getStatus());
        assertEquals(PayoutStatus.PROCESSING, payoutStore.getPayout(timedOut.getPayoutId()).getStatus());
    }

    @Test
    void testReconcile_Rejected() {
        revenue("M-1", "100");
        revenue("M-2", "0");
        when(transport.send(any()))
            .thenThrow(new RpcTimeoutException("No reply within 8000 ms", null))
            .thenReturn(reply("{\"result\":{\"transfer\":{\"id\":\"tr-9\",\"status\":\"rejected\"}}}"));
        PayoutOutcome timedOut = scheduler.runOne("ben-a", JAN_31, "admin");

        PayoutOutcome outcome = scheduler.reconcile(timedOut.getPayoutId(), "tr-9");

        assertEquals(PayoutOutcome.Status.FAILED, outcome.getStatus());
        assertEquals(PayoutStatus.FAILED, payoutStore.getPayout(timedOut.getPayoutId()).getStatus());
    }

    @Test
    void testReconcile_RequiresTransferId() {
        revenue("M-1", "100");
        revenue("M-2", "0");
        when(transport.send(any())).thenThrow(new RpcTimeoutException("No reply within 8000 ms", null));
        PayoutOutcome timedOut = scheduler.runOne("ben-a", JAN_31, "admin");

        assertThrows(ValidationException.class, () -> scheduler.reconcile(timedOut.getPayoutId(), null));
        verify(transport, times(1)).send(any());
    }

    @Test
    void testReconcile_OnlyProcessingPayouts() {
        revenue("M-1", "100");
        revenue("M-2", "0");
        when(transport.send(any())).thenReturn(reply("{\"result\":{\"transfer\":{\"id\":\"tr-1\"}}}"));
        PayoutOutcome completed = scheduler.runOne("ben-a", JAN_31, "admin");

        assertThrows(InvalidPayoutStateException.class, () -> scheduler.reconcile(completed.getPayoutId(), "tr-1"));
    }

    @Test
    void testReconcile_PendingPayoutIsFailedWithoutTransfer() {
        revenue("M-1", "100");
        revenue("M-2", "0");
        PayoutComputation computation = calculator.calculate("ben-a", JAN_31);
        Payout stranded = payoutStore.create(computation, Layer.SANDBOX, "stranded-key", "admin");

        PayoutOutcome blocked = scheduler.runOne("ben-a", FEB_29, "admin");
        assertEquals(PayoutOutcome.Status.BLOCKED, blocked.getStatus());
        assertEquals(stranded.getId(), blocked.getPayoutId());

        PayoutOutcome reconciled = scheduler.reconcile(stranded.getId(), null);

        assertEquals(PayoutOutcome.Status.FAILED, reconciled.getStatus());
        Payout failed = payoutStore.getPayout(stranded.getId());
        assertEquals(PayoutStatus.FAILED, failed.getStatus());
        assertEquals("Abandoned before dispatch; no transfer was sent", failed.getErrorMessage());
        verifyNoInteractions(transport);

        when(transport.send(any())).thenReturn(reply("{\"result\":{\"transfer\":{\"id\":\"tr-1\"}}}"));
        PayoutOutcome retried = scheduler.runOne("ben-a", JAN_31, "admin");

        assertEquals(PayoutOutcome.Status.COMPLETED, retried.getStatus());
        Payout completed = payoutStore.getPayout(retried.getPayoutId());
        assertEquals(LocalDate.of(2024, 1, 1), completed.getPeriodStart());
        assertNotEquals("stranded-key", completed.getTransferKey());
    }

    @Test
    void testRunOne_ConcurrentRunBlocked() throws Exception {
        revenue("M-1", "100");
        revenue("M-2", "0");
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(transport.send(any())).thenAnswer(invocation -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return reply("{\"result\":{\"transfer\":{\"id\":\"tr-1\"}}}");
        });

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<PayoutOutcome> first = executor.submit(() -> scheduler.runOne("ben-a", JAN_31, "admin"));
            assertTrue(entered.await(5, TimeUnit.SECONDS));

            PayoutOutcome second = scheduler.runOne("ben-a", JAN_31, "admin");
            release.countDown();

            assertEquals(PayoutOutcome.Status.BLOCKED, second.getStatus());
            assertEquals(PayoutOutcome.Status.COMPLETED, first.get(5, TimeUnit.SECONDS).getStatus());
            assertEquals(1, payoutRepository.count());
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
    }

    @Test
    void testRunScheduled_FailuresDoNotStopBatch() {
        clock.set(ONBOARDING);
        beneficiaryService.register("ben-b", "Beta LLC", "va-b", LocalDate.of(2024, 1, 1));
        beneficiaryService.register("ben-c", "Gamma LLC", "va-c", LocalDate.of(2024, 1, 1));
        assignmentService.assign("M-3", "ben-b", new BigDecimal("10"), "test");
        assignmentService.assign("M-4", "ben-c", new BigDecimal("10"), "test");
        clock.set(RUN_TIME);

        revenue("M-1", "100");
        revenue("M-2", "100");
        revenue("M-3", "100");
        when(terminalDataService.revenue(eq("M-4"), any(), any()))
            .thenThrow(new TerminalDataException("Vendista API unreachable"));
        when(transport.send(any())).thenAnswer(invocation -> {
            SignedRequest request = invocation.getArgument(0);
            if (request.getBody().contains("\"to_virtual_account\":\"va-b\"")) {
                return reply("{\"error\":{\"code\":4415,\"message\":\"Insufficient funds\"}}");
            }
            return reply("{\"result\":{\"transfer\":{\"id\":\"tr-ok\"}}}");
        });

        BatchRunSummary summary = scheduler.runScheduled("scheduler");

        assertEquals(3, summary.getTotal());
        assertEquals(1, summary.getCreated());
        assertEquals(2, summary.getFailed());
        assertEquals(RUN_TIME, scheduleService.getSchedule().getLastRunAt());
        assertFalse(scheduler.isBatchRunning());

        List<PayoutOutcome> outcomes = summary.getOutcomes();
        assertEquals(PayoutOutcome.Status.COMPLETED, outcome(outcomes, "ben-a").getStatus());
        assertEquals(PayoutOutcome.Status.FAILED, outcome(outcomes, "ben-b").getStatus());
        assertEquals(PayoutOutcome.Status.ERROR, outcome(outcomes, "ben-c").getStatus());
        assertEquals("Vendista API unreachable", outcome(outcomes, "ben-c").getMessage());
        verify(terminalDataService).revenue("M-1", LocalDate.of(2024, 1, 1), LocalDate.of(2024, 2, 1));

        List<Payout> failedRows = payoutRepository.findByStatusOrderByCreatedAtDesc(PayoutStatus.FAILED);
        assertEquals(1, failedRows.size());
        assertEquals("ben-b", failedRows.get(0).getBeneficiaryId());
        assertEquals("Insufficient funds", failedRows.get(0).getErrorMessage());
        assertEquals(2, payoutRepository.count());
    }

    @Test
    void testRunOne_UnknownBeneficiaryIsError() {
        PayoutOutcome outcome = scheduler.runOne("ben-x", JAN_31, "admin");

        assertEquals(PayoutOutcome.Status.ERROR, outcome.getStatus());
        assertEquals("ben-x", outcome.getBeneficiaryId());
        assertNull(outcome.getPayoutId());
        assertEquals(0, payoutRepository.count());
        verifyNoInteractions(transport);
    }

    @Test
    void testRunOne_TerminalDataUnavailableIsError() {
        revenue("M-1", "100");
        when(terminalDataService.revenue(eq("M-2"), any(), any()))
            .thenThrow(new TerminalDataException("Transaction 7 of machine M-2 has no amount"));

        PayoutOutcome outcome = scheduler.runOne("ben-a", JAN_31, "admin");

        assertEquals(PayoutOutcome.Status.ERROR, outcome.getStatus());
        assertEquals("Transaction 7 of machine M-2 has no amount", outcome.getMessage());
        assertEquals(0, payoutRepository.count());
        verifyNoInteractions(transport);
    }

    @Test
    void testRunScheduled_NoCredential() {
        credentialStore.remove(Layer.SANDBOX);

        assertThrows(SigningException.class, () -> scheduler.runScheduled("scheduler"));

        assertNull(scheduleService.getSchedule().getLastRunAt());
        assertEquals(0, payoutRepository.count());
        assertFalse(scheduler.isBatchRunning());
        verifyNoInteractions(transport, terminalDataService);
    }

    @Test
    void testRunScheduled_OneBatchAtATime() throws Exception {
        revenue("M-1", "100");
        revenue("M-2", "0");
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(transport.send(any())).thenAnswer(invocation -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return reply("{\"result\":{\"transfer\":{\"id\":\"tr-1\"}}}");
        });

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<BatchRunSummary> first = executor.submit(() -> scheduler.runScheduled("scheduler"));
            assertTrue(entered.await(5, TimeUnit.SECONDS));

            assertTrue(scheduler.isBatchRunning());
            assertThrows(BatchAlreadyRunningException.class, () -> scheduler.runScheduled("admin"));
            release.countDown();

            assertEquals(1, first.get(5, TimeUnit.SECONDS).getCreated());
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
    }

    @AfterEach
    void cleanUp() {
        lineRepository.deleteAll();
        payoutRepository.deleteAll();
        scheduleRepository.deleteAll();
        assignmentRepository.deleteAll();
        beneficiaryRepository.deleteAll();
        responseCache.clear();
    }

    private void revenue(String machineId, String amount) {
        when(terminalDataService.revenue(eq(machineId), any(), any())).thenReturn(Money.rub(new BigDecimal(amount)));
    }

    private SignedRequest sentRequest() {
        ArgumentCaptor<SignedRequest> captor = ArgumentCaptor.forClass(SignedRequest.class);
        verify(transport, atLeastOnce()).send(captor.capture());
        return captor.getValue();
    }

    private RpcReply reply(String json) {
        try {
            return new RpcReply(200, objectMapper.readTree(json), json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }

    private static PayoutOutcome outcome(List<PayoutOutcome> outcomes, String beneficiaryId) {
        return outcomes.stream()
            .filter(o -> beneficiaryId.equals(o.getBeneficiaryId()))
            .findFirst()
            .orElseThrow();
    }
}
