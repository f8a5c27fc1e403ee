package com.heronix.progress.calculator.graduation;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.heronix.progress.calculator.honors.LatinHonorsCalculator;
import com.heronix.progress.model.enums.ErrorCode;
import com.heronix.progress.model.graduation.AcademicRequirementsStatus;
import com.heronix.progress.model.graduation.AdministrativeClearanceStatus;
import com.heronix.progress.model.graduation.BlockingHold;
import com.heronix.progress.model.graduation.ConferralCheck;
import com.heronix.progress.model.graduation.DataValidationStatus;
import com.heronix.progress.model.graduation.GraduationEligibilityInput;
import com.heronix.progress.model.graduation.GraduationEligibilityInput.Milestones;
import com.heronix.progress.model.graduation.GraduationPolicyConfig;
import com.heronix.progress.model.graduation.GraduationValidationResult;
import com.heronix.progress.model.honors.LatinHonorsInput;
import com.heronix.progress.model.honors.LatinHonorsResult;
import com.heronix.progress.model.result.CalculationResult;
import com.heronix.progress.model.result.DomainError;

/**
 * Graduation eligibility validator.
 *
 * Aggregates three independent checklists into one verdict:
 * <ul>
 *   <li>Academic - degree audit, credits, GPA, residency, grades, milestones</li>
 *   <li>Administrative - holds, balance, clearances, exit counseling, SEVIS</li>
 *   <li>Data - diploma name, mailing address, declarations</li>
 * </ul>
 * Latin honors are computed alongside so a cleared record carries its designation.
 *
 * @author Heronix Development Team
 * @version 1.0.0
 */
@Component
public class GraduationEligibilityValidator {

    private final LatinHonorsCalculator honorsCalculator;
    private final Clock clock;

    @Autowired
    public GraduationEligibilityValidator(LatinHonorsCalculator honorsCalculator) {
        this(honorsCalculator, Clock.systemDefaultZone());
    }

    GraduationEligibilityValidator(LatinHonorsCalculator honorsCalculator, Clock clock) {
        this.honorsCalculator = honorsCalculator;
        this.clock = clock;
    }

    /**
     * Validate graduation eligibility.
     *
     * @param input pre-resolved academic, administrative and record data
     * @param policy graduation policy
     * @return the verdict, or a VALIDATION failure for malformed input
     */
    public CalculationResult<GraduationValidationResult> validate(GraduationEligibilityInput input,
                                                                 GraduationPolicyConfig policy) {
        List<String> problems = validateInput(input, policy);
        if (!problems.isEmpty()) {
            return CalculationResult.failure(DomainError.of(
                    ErrorCode.INVALID_GRADUATION_INPUT, "Invalid graduation eligibility input", problems));
        }

        AcademicRequirementsStatus academic = checkAcademicRequirements(input, policy);
        AdministrativeClearanceStatus administrative = checkAdministrativeClearances(input, policy);
        DataValidationStatus data = checkDataValidation(input);
        CalculationResult<LatinHonorsResult> honors =
                honorsCalculator.calculate(toHonorsInput(input), policy.latinHonors());
        if (honors.isFailure()) {
            return CalculationResult.failure(honors.error());
        }

        List<String> blockers = new ArrayList<>(academic.missingRequirements());
        blockers.addAll(administrativeBlockers(administrative));
        blockers.addAll(data.missingFields());

        boolean eligible = academic.passed() && administrative.passed() && data.passed();

        return CalculationResult.success(new GraduationValidationResult(
                input.studentId(),
                input.studentProgramId(),
                eligible,
                LocalDateTime.now(clock),
                academic,
                administrative,
                data,
                honors.value(),
                blockers,
                warnings(input, administrative)));
    }

    /**
     * Final pre-conferral check: eligibility with record problems phrased as conferral blockers.
     */
    public CalculationResult<ConferralCheck> canConfer(GraduationEligibilityInput input,
                                                      GraduationPolicyConfig policy) {
        return validate(input, policy).map(result -> {
            List<String> blockers = new ArrayList<>(result.academicChecks().missingRequirements());
            blockers.addAll(administrativeBlockers(result.administrativeChecks()));

            DataValidationStatus data = result.dataValidation();
            if (!data.diplomaNameVerified()) {
                blockers.add("Diploma name must be verified before conferral");
            }
            if (!data.mailingAddressConfirmed()) {
                blockers.add("Mailing address must be confirmed before conferral");
            }
            if (!data.programRecordComplete()) {
                blockers.add("Program record must be complete before conferral");
            }
            return new ConferralCheck(blockers.isEmpty(), blockers);
        });
    }

    // ========================================================================
    // CHECKLISTS
    // ========================================================================

    private AcademicRequirementsStatus checkAcademicRequirements(GraduationEligibilityInput input,
                                                                 GraduationPolicyConfig policy) {
        List<String> missing = new ArrayList<>();

        BigDecimal completion = input.degreeAudit().completionPct();
        boolean coursesComplete = completion.compareTo(BigDecimal.valueOf(100)) >= 0
                && input.degreeAudit().allRequirementsComplete();
        if (!coursesComplete) {
            missing.add("Degree audit " + completion.setScale(1, RoundingMode.HALF_UP).toPlainString() + "% complete");
            input.degreeAudit().missingRequirements().forEach(requirement -> missing.add("Missing: " + requirement));
        }

        BigDecimal earned = input.credits().totalEarned();
        boolean creditsEarned = earned.compareTo(policy.minimumCredits()) >= 0;
        if (!creditsEarned) {
            missing.add("Need " + plain(policy.minimumCredits()) + " credits; have " + plain(earned));
        }

        BigDecimal gpa = input.gpa().cumulative();
        boolean gpaMet = gpa != null && gpa.compareTo(policy.minimumGpa()) >= 0;
        if (!gpaMet) {
            missing.add("Need " + policy.minimumGpa().setScale(2, RoundingMode.HALF_UP) + " GPA; have "
                    + (gpa == null ? "none" : gpa.setScale(3, RoundingMode.HALF_UP).toPlainString()));
        }

        BigDecimal institutional = input.credits().institutionalEarned();
        boolean residencyMet = institutional.compareTo(policy.minimumInstitutionalCredits()) >= 0;
        if (!residencyMet) {
            missing.add("Need " + plain(policy.minimumInstitutionalCredits()) + " institutional credits; have "
                    + plain(institutional));
        }

        boolean noIncompletes = !input.grades().hasIncompleteGrades();
        if (!noIncompletes) {
            missing.add(input.grades().incompleteCount() + " incomplete grade(s) must be resolved");
        }

        boolean noPending = !input.grades().hasPendingFinalGrades();
        if (!noPending) {
            missing.add(input.grades().pendingCount() + " pending final grade(s)");
        }

        Milestones milestones = input.milestones();
        List<String> missingMilestones = milestones.required().stream()
                .filter(milestone -> !milestones.completed().contains(milestone))
                .toList();
        missingMilestones.forEach(milestone -> missing.add("Milestone not complete: " + milestone));

        return new AcademicRequirementsStatus(completion, coursesComplete, creditsEarned, gpaMet, residencyMet,
                noIncompletes, noPending, missingMilestones.isEmpty(), missing);
    }

    private AdministrativeClearanceStatus checkAdministrativeClearances(GraduationEligibilityInput input,
                                                                       GraduationPolicyConfig policy) {
        List<BlockingHold> blocking = new ArrayList<>();
        List<BlockingHold> nonBlocking = new ArrayList<>();
        for (BlockingHold hold : input.holds()) {
            if (policy.blocksGraduation(hold)) {
                blocking.add(hold);
            } else {
                nonBlocking.add(hold);
            }
        }

        BigDecimal balance = input.financialBalance() == null ? BigDecimal.ZERO : input.financialBalance();
        boolean financialClearance = balance.compareTo(policy.maxFinancialBalance()) <= 0;
        boolean library = !policy.requireLibraryClearance() || input.libraryClearance();
        boolean department = !policy.requireDepartmentClearance() || input.departmentClearance();
        boolean exitCounseling = !policy.requireExitCounseling()
                || !input.exitCounselingRequired()
                || input.exitCounselingComplete();
        Boolean sevis = input.international() ? Boolean.valueOf(Boolean.TRUE.equals(input.sevisUpdated())) : null;

        return new AdministrativeClearanceStatus(blocking.isEmpty(), financialClearance, library, department,
                exitCounseling, sevis, blocking, nonBlocking, balance.signum() > 0 ? balance : null);
    }

    private DataValidationStatus checkDataValidation(GraduationEligibilityInput input) {
        List<String> missing = new ArrayList<>();

        boolean diplomaName = input.diplomaName() != null && !input.diplomaName().isBlank();
        if (!diplomaName) {
            missing.add("Diploma name not verified");
        }

        boolean mailingAddress = input.mailingAddress() != null && !input.mailingAddress().isBlank();
        if (!mailingAddress) {
            missing.add("Mailing address not confirmed");
        }

        boolean declarations = input.majorDeclared();
        if (!declarations) {
            missing.add("Major/minor declaration incomplete");
        }

        // Program record completeness follows the major declaration
        return new DataValidationStatus(diplomaName, mailingAddress, declarations, declarations, true, missing);
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    private List<String> administrativeBlockers(AdministrativeClearanceStatus administrative) {
        List<String> blockers = new ArrayList<>();
        administrative.blockingHolds().forEach(hold -> blockers.add(
                hold.holdName() + " (" + hold.holdCode() + ") - Contact: " + hold.releaseAuthority()));
        if (!administrative.financialClearance()) {
            blockers.add("Outstanding balance: $" + money(administrative.outstandingBalance()));
        }
        if (!administrative.libraryClearance()) {
            blockers.add("Library clearance required");
        }
        if (!administrative.departmentClearance()) {
            blockers.add("Department clearance required");
        }
        if (!administrative.exitCounselingComplete()) {
            blockers.add("Exit counseling not complete");
        }
        if (Boolean.FALSE.equals(administrative.sevisUpdated())) {
            blockers.add("SEVIS record update required for international students");
        }
        return blockers;
    }

    private List<String> warnings(GraduationEligibilityInput input, AdministrativeClearanceStatus administrative) {
        List<String> warnings = new ArrayList<>();

        Milestones milestones = input.milestones();
        milestones.recommended().stream()
                .filter(milestone -> !milestones.completed().contains(milestone))
                .forEach(milestone -> warnings.add("Recommended milestone not complete: " + milestone));

        BigDecimal inProgress = input.credits().inProgress();
        if (inProgress != null && inProgress.signum() > 0) {
            warnings.add(plain(inProgress) + " credit(s) still in progress");
        }

        administrative.nonBlockingHolds().forEach(hold -> warnings.add(
                hold.holdName() + " (" + hold.holdCode() + ") does not block graduation"));

        if (administrative.financialClearance() && administrative.outstandingBalance() != null) {
            warnings.add("Outstanding balance of $" + money(administrative.outstandingBalance())
                    + " is within the allowed maximum");
        }
        return warnings;
    }

    private LatinHonorsInput toHonorsInput(GraduationEligibilityInput input) {
        return LatinHonorsInput.builder()
                .cumulativeGpa(input.gpa().cumulative())
                .institutionalGpa(input.gpa().institutional())
                .earnedCredits(input.credits().totalEarned())
                .institutionalCredits(input.credits().institutionalEarned())
                .transferCredits(input.credits().transferCredits())
                .hasAcademicIntegrityViolation(input.hasAcademicIntegrityViolation())
                .build();
    }

    private List<String> validateInput(GraduationEligibilityInput input, GraduationPolicyConfig policy) {
        List<String> problems = new ArrayList<>();
        if (policy == null) {
            problems.add("Graduation policy is required");
        }
        if (input == null) {
            problems.add("Graduation eligibility input is required");
            return problems;
        }
        if (input.studentId() == null || input.studentId().isBlank()) {
            problems.add("Student id is required");
        }
        if (input.degreeAudit() == null || input.degreeAudit().completionPct() == null) {
            problems.add("Degree audit summary is required");
        }
        if (input.gpa() == null) {
            problems.add("GPA totals are required");
        }
        if (input.grades() == null) {
            problems.add("Grade status is required");
        } else if (input.grades().incompleteCount() < 0 || input.grades().pendingCount() < 0) {
            problems.add("Grade counts must not be negative");
        }
        if (input.credits() == null) {
            problems.add("Credit totals are required");
        } else {
            requireNonNegative(problems, "Total earned credits", input.credits().totalEarned(), true);
            requireNonNegative(problems, "Institutional earned credits", input.credits().institutionalEarned(), true);
            requireNonNegative(problems, "Transfer credits", input.credits().transferCredits(), false);
            requireNonNegative(problems, "In-progress credits", input.credits().inProgress(), false);
        }
        requireNonNegative(problems, "Financial balance", input.financialBalance(), false);
        return problems;
    }

    private static void requireNonNegative(List<String> problems, String field, BigDecimal value, boolean required) {
        if (value == null) {
            if (required) {
                problems.add(field + " is required");
            }
        } else if (value.signum() < 0) {
            problems.add(field + " must not be negative: " + value);
        }
    }

    private static String money(BigDecimal amount) {
        return (amount == null ? BigDecimal.ZERO : amount).setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    private static String plain(BigDecimal value) {
        return value.stripTrailingZeros().toPlainString();
    }
}
