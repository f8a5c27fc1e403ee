package com.heronix.progress.config;

import java.util.Map;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.heronix.progress.model.gpa.GpaCalculationOptions;
import com.heronix.progress.model.graduation.GraduationPolicyConfig;
import com.heronix.progress.model.honors.LatinHonorsConfig;
import com.heronix.progress.model.sap.GpaRequirement;
import com.heronix.progress.model.sap.SapPolicy;
import com.heronix.progress.model.standing.AcademicStandingPolicy;
import com.heronix.progress.model.standing.CreditThreshold;

/**
 * Turns the configured policy properties into the immutable policy values the calculators take.
 *
 * @author Heronix Development Team
 * @version 1.0.0
 */
@Configuration
public class PolicyConfig {

    @Bean
    public GpaCalculationOptions gpaCalculationOptions(ProgressProperties properties) {
        ProgressProperties.GpaConfig gpa = properties.getGpa();
        return new GpaCalculationOptions(gpa.getDefaultRepeatPolicy(), gpa.getDecimalPlaces(), Map.of());
    }

    @Bean
    public SapPolicy sapPolicy(ProgressProperties properties) {
        ProgressProperties.SapConfig sap = properties.getSap();
        return SapPolicy.builder()
                .minimumGpa(sap.getMinimumGpa())
                .minimumPace(sap.getMinimumPace())
                .maxTimeframePercentage(sap.getMaxTimeframePercentage())
                .evaluationFrequency(sap.getEvaluationFrequency())
                .allowWarningPeriod(sap.isAllowWarningPeriod())
                .allowProbationAfterAppeal(sap.isAllowProbationAfterAppeal())
                .gpaRequirementsByCredits(sap.getGpaTiers().stream()
                        .map(tier -> new GpaRequirement(tier.getMinCredits(), tier.getMaxCredits(), tier.getMinimumGpa()))
                        .toList())
                .build();
    }

    @Bean
    public AcademicStandingPolicy academicStandingPolicy(ProgressProperties properties) {
        ProgressProperties.StandingConfig standing = properties.getStanding();
        return AcademicStandingPolicy.builder()
                .goodStandingMinGpa(standing.getGoodStandingMinGpa())
                .warningMinGpa(standing.getWarningMinGpa())
                .probationMinGpa(standing.getProbationMinGpa())
                .probationMaxTerms(standing.getProbationMaxTerms())
                .suspensionDurationTerms(standing.getSuspensionDurationTerms())
                .maxSuspensions(standing.getMaxSuspensions())
                .thresholdsByCredits(standing.getThresholds().stream()
                        .map(tier -> new CreditThreshold(tier.getMaxCredits(), tier.getGoodStandingMinGpa(),
                                tier.getProbationMinGpa()))
                        .toList())
                .build();
    }

    @Bean
    public LatinHonorsConfig latinHonorsConfig(ProgressProperties properties) {
        ProgressProperties.HonorsConfig honors = properties.getHonors();
        return LatinHonorsConfig.builder()
                .minimumCredits(honors.getMinimumCredits())
                .minimumInstitutionalCredits(honors.getMinimumInstitutionalCredits())
                .summaThreshold(honors.getSummaThreshold())
                .magnaThreshold(honors.getMagnaThreshold())
                .cumThreshold(honors.getCumThreshold())
                .excludeTransferCredits(honors.isExcludeTransferCredits())
                .disqualifyForAcademicIntegrity(honors.isDisqualifyForAcademicIntegrity())
                .build();
    }

    @Bean
    public GraduationPolicyConfig graduationPolicyConfig(ProgressProperties properties,
                                                         LatinHonorsConfig latinHonorsConfig) {
        ProgressProperties.GraduationConfig graduation = properties.getGraduation();
        return GraduationPolicyConfig.builder()
                .minimumGpa(graduation.getMinimumGpa())
                .minimumCredits(graduation.getMinimumCredits())
                .minimumInstitutionalCredits(graduation.getMinimumInstitutionalCredits())
                .maxFinancialBalance(graduation.getMaxFinancialBalance())
                .requireExitCounseling(graduation.isRequireExitCounseling())
                .requireLibraryClearance(graduation.isRequireLibraryClearance())
                .requireDepartmentClearance(graduation.isRequireDepartmentClearance())
                .graduationBlockingHoldCategories(graduation.getBlockingHoldCategories())
                .latinHonors(latinHonorsConfig)
                .build();
    }
}
