package com.niigaki.billing.domain.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BillingStatusTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void fromValue_acceptsWireValueAndEnumName() {
        assertThat(BillingStatus.fromValue("pending_payment")).isEqualTo(BillingStatus.PENDING_PAYMENT);
        assertThat(BillingStatus.fromValue("OVERDUE")).isEqualTo(BillingStatus.OVERDUE);
        assertThat(BillingStatus.fromValue(" trial ")).isEqualTo(BillingStatus.TRIAL);
    }

    @Test
    void fromValue_rejectsUnknownValue() {
        assertThatThrownBy(() -> BillingStatus.fromValue("paused"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("paused");
    }

    @Test
    void isBillingStatus_guardsRawValues() {
        assertThat(BillingStatus.isBillingStatus("suspended")).isTrue();
        assertThat(BillingStatus.isBillingStatus("expired")).isFalse();
        assertThat(BillingStatus.isBillingStatus(null)).isFalse();
    }

    @Test
    void onlyCanceledIsTerminal() {
        for (BillingStatus status : BillingStatus.values()) {
            assertThat(status.isTerminal()).as(status.name()).isEqualTo(status == BillingStatus.CANCELED);
        }
        assertThat(BillingStatus.CANCELED.allowedTargets()).isEmpty();
    }

    @Test
    void serializesAsLowercaseValue() throws Exception {
        assertThat(objectMapper.writeValueAsString(BillingStatus.PENDING_PAYMENT)).isEqualTo("\"pending_payment\"");
        assertThat(objectMapper.readValue("\"active\"", BillingStatus.class)).isEqualTo(BillingStatus.ACTIVE);
    }

    @Test
    void billingCycle_knowsItsApproximateLength() {
        assertThat(BillingCycle.MONTHLY.getApproximateDays()).isEqualTo(30);
        assertThat(BillingCycle.YEARLY.getApproximateDays()).isEqualTo(365);
        assertThat(BillingCycle.isBillingCycle("quarterly")).isTrue();
        assertThat(BillingCycle.isBillingCycle("DAILY")).isFalse();
    }
}
