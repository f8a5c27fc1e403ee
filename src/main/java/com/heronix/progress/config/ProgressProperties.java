package com.heronix.progress.config;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.heronix.progress.model.enums.EvaluationFrequency;
import com.heronix.progress.model.enums.HoldCategory;
import com.heronix.progress.model.enums.RepeatPolicy;

import lombok.Data;

/**
 * Configuration properties for Heronix Progress.
 */
@Data
@ConfigurationProperties(prefix = "heronix.progress")
public class ProgressProperties {

    /**
     * GPA calculation configuration
     */
    private GpaConfig gpa = new GpaConfig();

    /**
     * SAP policy configuration
     */
    private SapConfig sap = new SapConfig();

    /**
     * Graduation policy configuration
     */
    private GraduationConfig graduation = new GraduationConfig();

    /**
     * Latin honors configuration
     */
    private HonorsConfig honors = new HonorsConfig();

    /**
     * Academic standing policy configuration
     */
    private StandingConfig standing = new StandingConfig();

    /**
     * Batch evaluation configuration
     */
    private BatchConfig batch = new BatchConfig();

    @Data
    public static class GpaConfig {
        /**
         * Repeat policy for course groups that carry none
         */
        private RepeatPolicy defaultRepeatPolicy = RepeatPolicy.REPLACE;

        /**
         * Rounding precision for GPA and quality points
         */
        private int decimalPlaces = 3;
    }

    @Data
    public static class SapConfig {
        /**
         * Minimum cumulative GPA
         */
        private BigDecimal minimumGpa = new BigDecimal("2.0");

        /**
         * Minimum completion rate (0.67 = 67%)
         */
        private BigDecimal minimumPace = new BigDecimal("0.67");

        /**
         * Maximum timeframe as a multiple of program credits (1.5 = 150%)
         */
        private BigDecimal maxTimeframePercentage = new BigDecimal("1.5");

        private EvaluationFrequency evaluationFrequency = EvaluationFrequency.TERM;

        private boolean allowWarningPeriod = true;

        private boolean allowProbationAfterAppeal = true;

        /**
         * Optional GPA minimums by attempted-credit band, checked in order
         */
        private List<GpaTier> gpaTiers = new ArrayList<>();
    }

    @Data
    public static class GpaTier {
        private BigDecimal minCredits = BigDecimal.ZERO;

        /**
         * Inclusive upper bound, unset for no upper bound
         */
        private BigDecimal maxCredits;

        private BigDecimal minimumGpa;
    }

    @Data
    public static class GraduationConfig {
        private BigDecimal minimumGpa = new BigDecimal("2.0");

        private BigDecimal minimumCredits = BigDecimal.valueOf(120);

        /**
         * Residency requirement
         */
        private BigDecimal minimumInstitutionalCredits = BigDecimal.valueOf(30);

        /**
         * Largest balance a student may carry and still graduate
         */
        private BigDecimal maxFinancialBalance = BigDecimal.ZERO;

        private boolean requireExitCounseling = true;

        private boolean requireLibraryClearance = true;

        private boolean requireDepartmentClearance = true;

        /**
         * Hold categories that block graduation; other holds produce warnings
         */
        private Set<HoldCategory> blockingHoldCategories = EnumSet.allOf(HoldCategory.class);
    }

    @Data
    public static class HonorsConfig {
        private BigDecimal minimumCredits = BigDecimal.valueOf(60);

        private BigDecimal minimumInstitutionalCredits = BigDecimal.valueOf(60);

        private BigDecimal summaThreshold = new BigDecimal("3.9");

        private BigDecimal magnaThreshold = new BigDecimal("3.7");

        private BigDecimal cumThreshold = new BigDecimal("3.5");

        /**
         * Use institutional GPA instead of cumulative GPA when available
         */
        private boolean excludeTransferCredits = false;

        private boolean disqualifyForAcademicIntegrity = true;
    }

    @Data
    public static class StandingConfig {
        private BigDecimal goodStandingMinGpa = new BigDecimal("2.0");

        /**
         * Unset for institutions without an academic warning state
         */
        private BigDecimal warningMinGpa;

        private BigDecimal probationMinGpa;

        /**
         * Consecutive probation terms allowed before suspension
         */
        private int probationMaxTerms = 2;

        private int suspensionDurationTerms = 1;

        /**
         * Suspensions allowed before dismissal
         */
        private int maxSuspensions = 2;

        /**
         * Optional sliding scale of good standing minimums by attempted credits
         */
        private List<StandingTier> thresholds = new ArrayList<>();
    }

    @Data
    public static class StandingTier {
        /**
         * Inclusive upper bound of attempted credits
         */
        private BigDecimal maxCredits;

        private BigDecimal goodStandingMinGpa;

        private BigDecimal probationMinGpa;
    }

    @Data
    public static class BatchConfig {
        /**
         * Students per SAP sub-batch
         */
        private int sapBatchSize = 50;

        /**
         * Students per GPA sub-batch
         */
        private int gpaBatchSize = 100;

        /**
         * Maximum errors kept in a batch result
         */
        private int maxErrors = 100;

        /**
         * Number of parallel threads evaluating students
         */
        private int parallelThreads = 4;

        /**
         * Number of batch runs that may execute at once
         */
        private int concurrentRuns = 2;

        /**
         * Program credits assumed when a student has no primary program
         */
        private BigDecimal defaultProgramCredits = BigDecimal.valueOf(120);

        /**
         * Enable the scheduled SAP run
         */
        private boolean scheduledEnabled = false;

        /**
         * Cron expression for the scheduled SAP run (default: daily at 2 AM)
         */
        private String scheduleCron = "0 0 2 * * ?";

        /**
         * Award year evaluated by the scheduled run
         */
        private String scheduledAwardYearId;

        /**
         * Term evaluated by the scheduled run
         */
        private String scheduledTermId;
    }
}
