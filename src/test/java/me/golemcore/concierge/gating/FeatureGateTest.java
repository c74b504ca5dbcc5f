package me.golemcore.concierge.gating;

import me.golemcore.concierge.domain.model.FeatureGateResult;
import me.golemcore.concierge.domain.model.TenantSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FeatureGateTest {

    private FeatureGate gate;

    @BeforeEach
    void setUp() {
        gate = new FeatureGate();
    }

    private static TenantSettings production() {
        return TenantSettings.builder()
                .tenantId("t1")
                .industry("restaurant")
                .sandboxStatus("approved")
                .billingStatus("active")
                .build();
    }

    // ==================== chain ====================

    @Test
    void shouldAllowApprovedTenantWithActiveBilling() {
        FeatureGateResult result = gate.canUse(FeatureGate.TAKEAWAY, production());

        assertTrue(result.isAllowed());
        assertNull(result.getBlockedBy());
    }

    @Test
    void shouldDenyKillSwitchBeforeEveryOtherCheck() {
        // Arrange
        TenantSettings tenant = production();
        tenant.setTakeawayDisabled(true);

        // Act
        FeatureGateResult result = gate.canUse(FeatureGate.TAKEAWAY, tenant);

        // Assert
        assertFalse(result.isAllowed());
        assertEquals(FeatureGateResult.BLOCKED_BY_KILL_SWITCH, result.getBlockedBy());
        assertTrue(result.getRequires().contains("contact_support"));
    }

    @Test
    void shouldApplySmsKillSwitchToWhatsApp() {
        TenantSettings tenant = production();
        tenant.setSmsDisabled(true);

        assertEquals(FeatureGateResult.BLOCKED_BY_KILL_SWITCH,
                gate.canUse(FeatureGate.WHATSAPP, tenant).getBlockedBy());
        assertTrue(gate.canUse(FeatureGate.VOICE, tenant).isAllowed());
    }

    @Test
    void shouldDenyCapabilityDisabledForIndustry() {
        TenantSettings tenant = production();
        tenant.setIndustryModules(Map.of(FeatureGate.BOOKING, false, FeatureGate.TAKEAWAY, true));

        FeatureGateResult booking = gate.canUse(FeatureGate.BOOKING, tenant);

        assertEquals(FeatureGateResult.BLOCKED_BY_INDUSTRY, booking.getBlockedBy());
        assertTrue(booking.getReason().contains("restaurant"));
        assertTrue(gate.canUse(FeatureGate.TAKEAWAY, tenant).isAllowed());
    }

    @ParameterizedTest
    @CsvSource({
            "sandbox_required, sandbox, required",
            "sandbox_in_progress, sandbox, in_progress",
            "ready_for_review, sandbox, pending_review",
            "revoked, sandbox, revoked",
            "something_else, unknown, ''"
    })
    void shouldDenyBySandboxStage(String sandboxStatus, String blockedBy, String subReason) {
        TenantSettings tenant = production();
        tenant.setSandboxStatus(sandboxStatus);

        FeatureGateResult result = gate.canUse(FeatureGate.PAYMENT, tenant);

        assertFalse(result.isAllowed());
        assertEquals(blockedBy, result.getBlockedBy());
        assertEquals(subReason.isEmpty() ? null : subReason, result.getSubReason());
    }

    @ParameterizedTest
    @CsvSource({
            "inactive, billing",
            "incomplete, billing",
            "past_due, billing",
            "canceled, billing",
            "bogus, unknown"
    })
    void shouldDenyByBillingStatusOnceSandboxApproved(String billingStatus, String blockedBy) {
        TenantSettings tenant = production();
        tenant.setBillingStatus(billingStatus);

        FeatureGateResult result = gate.canUse(FeatureGate.VOICE, tenant);

        assertFalse(result.isAllowed());
        assertEquals(blockedBy, result.getBlockedBy());
    }

    @Test
    void shouldAllowBookingInSandboxTestMode() {
        // Arrange
        TenantSettings tenant = production();
        tenant.setSandboxStatus("sandbox_in_progress");
        tenant.setBillingStatus("inactive");
        tenant.setSandboxTestMode(true);

        // Act + Assert
        assertTrue(gate.canUse(FeatureGate.BOOKING, tenant).isAllowed());
        assertFalse(gate.canUse(FeatureGate.TAKEAWAY, tenant).isAllowed());
    }

    @Test
    void shouldAlwaysAllowUnrestrictedCapability() {
        TenantSettings tenant = production();
        tenant.setSandboxStatus("revoked");

        assertTrue(gate.canUse("faq", tenant).isAllowed());
        assertFalse(gate.isRestricted("faq"));
        assertTrue(gate.isRestricted("Booking"));
    }

    // ==================== lifecycle ====================

    @Test
    void shouldRequireEightyPercentOnboardingBeforeReview() {
        // Arrange
        TenantSettings tenant = production();
        tenant.setSandboxStatus("sandbox_in_progress");
        tenant.setOnboardingStepsTotal(10);
        tenant.setOnboardingStepsCompleted(7);

        // Act
        FeatureGateResult tooEarly = gate.canRequestReview(tenant);
        tenant.setOnboardingStepsCompleted(8);
        FeatureGateResult ready = gate.canRequestReview(tenant);

        // Assert
        assertFalse(tooEarly.isAllowed());
        assertTrue(tooEarly.getReason().contains("1 step(s) remaining"));
        assertTrue(ready.isAllowed());
    }

    @Test
    void shouldRejectReviewOutsideSandbox() {
        FeatureGateResult result = gate.canRequestReview(production());

        assertFalse(result.isAllowed());
        assertEquals("approved", result.getSubReason());
    }

    @Test
    void shouldOnlyStartSandboxWhenRequired() {
        TenantSettings tenant = production();
        tenant.setSandboxStatus("sandbox_required");
        assertTrue(gate.canStartSandbox(tenant).isAllowed());

        tenant.setSandboxStatus("sandbox_in_progress");
        assertEquals("in_progress", gate.canStartSandbox(tenant).getSubReason());
    }

    @Test
    void shouldSummarizeEveryRestrictedCapability() {
        TenantSettings tenant = production();
        tenant.setVoiceDisabled(true);

        Map<String, FeatureGateResult> summary = gate.getModuleAccessSummary(tenant);

        assertEquals(FeatureGate.RESTRICTED_CAPABILITIES.size(), summary.size());
        assertFalse(summary.get(FeatureGate.VOICE).isAllowed());
        assertTrue(summary.get(FeatureGate.SMS).isAllowed());
    }
}
