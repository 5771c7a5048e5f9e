package com.payoutengine.gateway;

import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Allow-list of platform methods with their kind, cache TTL and minimum call interval.
 *
 * The table is fixed; a method missing from it is rejected before anything
 * is signed. TTLs and intervals of the rate-limited classes come from
 * {@link GatewayProperties}.
 */
@Component
public class MethodCatalog {

    private static final Set<String> LISTING = Set.of(
        "list_virtual_account",
        "list_virtual_transaction",
        "list_beneficiary",
        "list_payments_v2"
    );

    private static final Set<String> RATE_LIMITED_LOOKUP = Set.of(
        "get_virtual_account",
        "get_beneficiary",
        "get_payment"
    );

    private static final Set<String> LOOKUP = Set.of(
        "get_beneficiary_restrictions",
        "get_virtual_accounts_transfer",
        "get_deal",
        "list_deals",
        "list_payments",
        "list_bank_sbp",
        "get_document",
        "list_documents",
        "echo"
    );

    private static final Set<String> MUTATING = Set.of(
        "create_beneficiary_ul",
        "create_beneficiary_ip",
        "create_beneficiary_fl",
        "update_beneficiary_ul",
        "update_beneficiary_ip",
        "update_beneficiary_fl",
        "activate_beneficiary",
        "deactivate_beneficiary",
        "create_virtual_account",
        "refund_virtual_account",
        "transfer_between_virtual_accounts",
        "transfer_between_virtual_accounts_v2",
        "create_deal",
        "update_deal",
        "execute_deal",
        "rejected_deal",
        "cancel_deal_with_executed_recipients",
        "compliance_check_deal",
        "identification_payment",
        "refund_payment",
        "identification_returned_payment_by_deal",
        "compliance_check_payment",
        "payment_of_taxes",
        "generate_payment_order",
        "generate_sbp_qrcode"
    );

    private static final Map<String, List<String>> INVALIDATES = Map.ofEntries(
        Map.entry("create_virtual_account", List.of("list_virtual_account")),
        Map.entry("refund_virtual_account", List.of("get_virtual_account", "list_virtual_transaction")),
        Map.entry("transfer_between_virtual_accounts", List.of("get_virtual_account", "list_virtual_transaction")),
        Map.entry("transfer_between_virtual_accounts_v2", List.of("get_virtual_account", "list_virtual_transaction")),
        Map.entry("create_beneficiary_ul", List.of("list_beneficiary")),
        Map.entry("create_beneficiary_ip", List.of("list_beneficiary")),
        Map.entry("create_beneficiary_fl", List.of("list_beneficiary")),
        Map.entry("update_beneficiary_ul", List.of("list_beneficiary", "get_beneficiary")),
        Map.entry("update_beneficiary_ip", List.of("list_beneficiary", "get_beneficiary")),
        Map.entry("update_beneficiary_fl", List.of("list_beneficiary", "get_beneficiary")),
        Map.entry("activate_beneficiary", List.of("list_beneficiary", "get_beneficiary")),
        Map.entry("deactivate_beneficiary", List.of("list_beneficiary", "get_beneficiary")),
        Map.entry("identification_payment", List.of("list_payments_v2", "get_payment", "get_virtual_account")),
        Map.entry("refund_payment", List.of("list_payments_v2", "get_payment"))
    );

    private final Map<String, MethodPolicy> policies;

    public MethodCatalog(GatewayProperties properties) {
        Map<String, MethodPolicy> table = new LinkedHashMap<>();
        LISTING.forEach(m -> table.put(m, read(m, properties.getListing())));
        RATE_LIMITED_LOOKUP.forEach(m -> table.put(m, read(m, properties.getLookup())));
        LOOKUP.forEach(m -> table.put(m, new MethodPolicy(m, MethodKind.READ, Duration.ZERO, Duration.ZERO, List.of())));
        MUTATING.forEach(m -> table.put(m, new MethodPolicy(m, MethodKind.MUTATING, Duration.ZERO,
            properties.getMutationMinInterval(), INVALIDATES.getOrDefault(m, List.of()))));
        this.policies = Collections.unmodifiableMap(table);
    }

    public Optional<MethodPolicy> find(String method) {
        return Optional.ofNullable(method).map(policies::get);
    }

    public Set<String> methods() {
        return policies.keySet();
    }

    private static MethodPolicy read(String method, GatewayProperties.RateLimit limit) {
        return new MethodPolicy(method, MethodKind.READ, limit.getTtl(), limit.getMinInterval(), List.of());
    }
}
