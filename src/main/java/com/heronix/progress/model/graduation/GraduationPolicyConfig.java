package com.heronix.progress.model.graduation;

import java.math.BigDecimal;
import java.util.EnumSet;
import java.util.Set;

import com.heronix.progress.model.enums.HoldCategory;
import com.heronix.progress.model.honors.LatinHonorsConfig;

import lombok.Builder;

/**
 * Graduation policy of an institution or program.
 *
 * @param graduationBlockingHoldCategories hold categories that block graduation; other holds only warn
 */
@Builder(toBuilder = true)
public record GraduationPolicyConfig(
        BigDecimal minimumGpa,
        BigDecimal minimumCredits,
        BigDecimal minimumInstitutionalCredits,
        BigDecimal maxFinancialBalance,
        boolean requireExitCounseling,
        boolean requireLibraryClearance,
        boolean requireDepartmentClearance,
        Set<HoldCategory> graduationBlockingHoldCategories,
        LatinHonorsConfig latinHonors
) {
    public GraduationPolicyConfig {
        graduationBlockingHoldCategories = graduationBlockingHoldCategories == null
                ? Set.of()
                : Set.copyOf(graduationBlockingHoldCategories);
        latinHonors = latinHonors == null ? LatinHonorsConfig.defaults() : latinHonors;
    }

    public static GraduationPolicyConfig defaults() {
        return new GraduationPolicyConfig(
                new BigDecimal("2.0"),
                BigDecimal.valueOf(120),
                BigDecimal.valueOf(30),
                BigDecimal.ZERO,
                true,
                true,
                true,
                EnumSet.allOf(HoldCategory.class),
                LatinHonorsConfig.defaults());
    }

    public boolean blocksGraduation(BlockingHold hold) {
        return hold.category() != null && graduationBlockingHoldCategories.contains(hold.category());
    }
}
