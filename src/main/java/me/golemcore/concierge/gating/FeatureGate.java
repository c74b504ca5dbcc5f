package me.golemcore.concierge.gating;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.concierge.domain.model.BillingStatus;
import me.golemcore.concierge.domain.model.FeatureGateResult;
import me.golemcore.concierge.domain.model.SandboxStatus;
import me.golemcore.concierge.domain.model.TenantSettings;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Entitlement checks for tenant capabilities.
 *
 * <p>
 * Restricted capabilities go through an ordered chain and the first failing
 * step wins:
 * <ol>
 * <li>kill switch</li>
 * <li>industry profile</li>
 * <li>sandbox lifecycle</li>
 * <li>billing</li>
 * </ol>
 * Anything outside {@link #RESTRICTED_CAPABILITIES} is always allowed.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class FeatureGate {

    public static final String VOICE = "voice";
    public static final String SMS = "sms";
    public static final String WHATSAPP = "whatsapp";
    public static final String PAYMENT = "payment";
    public static final String BOOKING = "booking";
    public static final String TAKEAWAY = "takeaway";

    public static final List<String> RESTRICTED_CAPABILITIES = List.of(VOICE, SMS, WHATSAPP, PAYMENT, BOOKING,
            TAKEAWAY);

    public static final double REVIEW_THRESHOLD = 0.8;

    private static final Set<String> RESTRICTED = Set.copyOf(RESTRICTED_CAPABILITIES);

    // WhatsApp shares the SMS kill switch
    private static final Map<String, Predicate<TenantSettings>> KILL_SWITCHES = Map.of(
            SMS, TenantSettings::isSmsDisabled,
            WHATSAPP, TenantSettings::isSmsDisabled,
            VOICE, TenantSettings::isVoiceDisabled,
            BOOKING, TenantSettings::isBookingDisabled,
            TAKEAWAY, TenantSettings::isTakeawayDisabled,
            PAYMENT, TenantSettings::isPaymentDisabled);

    public boolean isRestricted(String capability) {
        return capability != null && RESTRICTED.contains(capability.toLowerCase(Locale.ROOT));
    }

    /**
     * Decide whether the tenant may use the capability.
     */
    public FeatureGateResult canUse(String capability, TenantSettings tenant) {
        if (!isRestricted(capability)) {
            return FeatureGateResult.allow("Capability is not restricted");
        }
        String key = capability.toLowerCase(Locale.ROOT);

        FeatureGateResult result = evaluate(key, tenant);
        if (!result.isAllowed()) {
            log.debug("[Gate] Tenant {} denied '{}': {} ({})", tenant.getTenantId(), key,
                    result.getBlockedBy(), result.getSubReason());
        }
        return result;
    }

    private FeatureGateResult evaluate(String capability, TenantSettings tenant) {
        if (isKillSwitched(capability, tenant)) {
            return FeatureGateResult.deny(FeatureGateResult.BLOCKED_BY_KILL_SWITCH, null,
                    "This capability has been temporarily disabled. Contact support if you believe this is an error.",
                    List.of("contact_support", "wait_for_reactivation"));
        }

        if (!isAllowedByIndustry(capability, tenant)) {
            String industry = tenant.getIndustry() != null ? tenant.getIndustry() : "unknown";
            return FeatureGateResult.deny(FeatureGateResult.BLOCKED_BY_INDUSTRY, null,
                    "This capability is not available for your industry (" + industry + ").",
                    List.of("contact_support", "industry_upgrade"));
        }

        SandboxStatus sandbox = SandboxStatus.fromValue(tenant.getSandboxStatus());
        if (BOOKING.equals(capability) && tenant.isSandboxTestMode()
                && sandbox == SandboxStatus.SANDBOX_IN_PROGRESS) {
            return FeatureGateResult.allow("Booking available in sandbox test mode");
        }

        FeatureGateResult sandboxDenial = checkSandbox(sandbox);
        if (sandboxDenial != null) {
            return sandboxDenial;
        }
        return checkBilling(BillingStatus.fromValue(tenant.getBillingStatus()));
    }

    private FeatureGateResult checkSandbox(SandboxStatus sandbox) {
        return switch (sandbox) {
        case APPROVED -> null;
        case SANDBOX_REQUIRED -> FeatureGateResult.deny(FeatureGateResult.BLOCKED_BY_SANDBOX, "required",
                "Start the sandbox cycle to unlock this capability.",
                List.of("start_sandbox"));
        case SANDBOX_IN_PROGRESS -> FeatureGateResult.deny(FeatureGateResult.BLOCKED_BY_SANDBOX, "in_progress",
                "Complete the onboarding steps and request a review to unlock this capability.",
                List.of("complete_onboarding", "request_review"));
        case READY_FOR_REVIEW -> FeatureGateResult.deny(FeatureGateResult.BLOCKED_BY_SANDBOX, "pending_review",
                "Your review request is being processed.",
                List.of("wait_for_approval"));
        case REVOKED -> FeatureGateResult.deny(FeatureGateResult.BLOCKED_BY_SANDBOX, "revoked",
                "Access has been revoked by an administrator. Contact support to restore it.",
                List.of("contact_support", "admin_reinstatement"));
        default -> FeatureGateResult.deny(FeatureGateResult.BLOCKED_BY_UNKNOWN, null,
                "Unknown sandbox status. Contact support.",
                List.of("contact_support"));
        };
    }

    private FeatureGateResult checkBilling(BillingStatus billing) {
        return switch (billing) {
        case ACTIVE -> FeatureGateResult.allow("Sandbox approved and subscription active");
        case INACTIVE -> FeatureGateResult.deny(FeatureGateResult.BLOCKED_BY_BILLING, "inactive",
                "Activate your subscription to use this capability in production.",
                List.of("activate_subscription"));
        case INCOMPLETE -> FeatureGateResult.deny(FeatureGateResult.BLOCKED_BY_BILLING, "incomplete",
                "Your payment is still being processed. Complete the checkout to continue.",
                List.of("complete_checkout"));
        case PAST_DUE -> FeatureGateResult.deny(FeatureGateResult.BLOCKED_BY_BILLING, "past_due",
                "Your last payment failed. Update your payment details to continue.",
                List.of("update_payment_method"));
        case CANCELED -> FeatureGateResult.deny(FeatureGateResult.BLOCKED_BY_BILLING, "canceled",
                "Your subscription was canceled. Reactivate it to use this capability.",
                List.of("reactivate_subscription"));
        default -> FeatureGateResult.deny(FeatureGateResult.BLOCKED_BY_UNKNOWN, null,
                "Unknown billing status. Contact support.",
                List.of("contact_support"));
        };
    }

    private boolean isKillSwitched(String capability, TenantSettings tenant) {
        Predicate<TenantSettings> killSwitch = KILL_SWITCHES.get(capability);
        return killSwitch != null && killSwitch.test(tenant);
    }

    private boolean isAllowedByIndustry(String capability, TenantSettings tenant) {
        Map<String, Boolean> modules = tenant.getIndustryModules();
        if (modules == null || modules.isEmpty()) {
            return true;
        }
        return !Boolean.FALSE.equals(modules.get(capability));
    }

    /**
     * A tenant may request review only while its sandbox is in progress and at
     * least 80% of onboarding steps are done.
     */
    public FeatureGateResult canRequestReview(TenantSettings tenant) {
        SandboxStatus sandbox = SandboxStatus.fromValue(tenant.getSandboxStatus());
        if (sandbox != SandboxStatus.SANDBOX_IN_PROGRESS) {
            return switch (sandbox) {
            case SANDBOX_REQUIRED -> FeatureGateResult.deny(FeatureGateResult.BLOCKED_BY_SANDBOX, "required",
                    "Start the sandbox first.", List.of("start_sandbox"));
            case READY_FOR_REVIEW -> FeatureGateResult.deny(FeatureGateResult.BLOCKED_BY_SANDBOX, "pending_review",
                    "A review request is already pending.", List.of());
            case APPROVED -> FeatureGateResult.deny(FeatureGateResult.BLOCKED_BY_SANDBOX, "approved",
                    "Your sandbox is already approved.", List.of());
            case REVOKED -> FeatureGateResult.deny(FeatureGateResult.BLOCKED_BY_SANDBOX, "revoked",
                    "Your access has been revoked. Contact support.", List.of("contact_support"));
            default -> FeatureGateResult.deny(FeatureGateResult.BLOCKED_BY_UNKNOWN, null,
                    "Sandbox status does not allow a review request.", List.of());
            };
        }

        int total = Math.max(0, tenant.getOnboardingStepsTotal());
        int done = Math.max(0, tenant.getOnboardingStepsCompleted());
        double progress = total == 0 ? 0.0 : (double) done / total;
        long progressPercent = Math.round(progress * 100);

        if (progress < REVIEW_THRESHOLD) {
            long remaining = (long) Math.ceil(total * REVIEW_THRESHOLD - done);
            return FeatureGateResult.deny(FeatureGateResult.BLOCKED_BY_SANDBOX, "in_progress",
                    String.format(Locale.ROOT,
                            "Complete at least %d%% of onboarding steps. Current progress: %d%%. "
                                    + "%d step(s) remaining.",
                            Math.round(REVIEW_THRESHOLD * 100), progressPercent, remaining),
                    List.of("complete_onboarding_steps"));
        }
        return FeatureGateResult.allow(String.format(Locale.ROOT,
                "%d%% of onboarding steps completed. Review can be requested.", progressPercent));
    }

    public FeatureGateResult canStartSandbox(TenantSettings tenant) {
        SandboxStatus sandbox = SandboxStatus.fromValue(tenant.getSandboxStatus());
        return switch (sandbox) {
        case SANDBOX_REQUIRED -> FeatureGateResult.allow("Sandbox cycle can be started");
        case SANDBOX_IN_PROGRESS -> FeatureGateResult.deny(FeatureGateResult.BLOCKED_BY_SANDBOX, "in_progress",
                "Sandbox is already in progress.", List.of());
        case READY_FOR_REVIEW -> FeatureGateResult.deny(FeatureGateResult.BLOCKED_BY_SANDBOX, "pending_review",
                "Sandbox is awaiting review.", List.of());
        case APPROVED -> FeatureGateResult.deny(FeatureGateResult.BLOCKED_BY_SANDBOX, "approved",
                "Sandbox is already approved.", List.of());
        case REVOKED -> FeatureGateResult.deny(FeatureGateResult.BLOCKED_BY_SANDBOX, "revoked",
                "Access has been revoked. Contact support to reactivate it.", List.of("contact_support"));
        default -> FeatureGateResult.deny(FeatureGateResult.BLOCKED_BY_UNKNOWN, null,
                "Invalid sandbox status.", List.of());
        };
    }

    /**
     * Gate result for every restricted capability, in declaration order.
     */
    public Map<String, FeatureGateResult> getModuleAccessSummary(TenantSettings tenant) {
        Map<String, FeatureGateResult> summary = new LinkedHashMap<>();
        for (String capability : RESTRICTED_CAPABILITIES) {
            summary.put(capability, canUse(capability, tenant));
        }
        return summary;
    }
}
