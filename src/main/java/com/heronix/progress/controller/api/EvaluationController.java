package com.heronix.progress.controller.api;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.heronix.progress.calculator.gpa.GpaCalculator;
import com.heronix.progress.calculator.graduation.ConferralCalculator;
import com.heronix.progress.calculator.graduation.GraduationEligibilityValidator;
import com.heronix.progress.calculator.honors.LatinHonorsCalculator;
import com.heronix.progress.calculator.sap.SapCalculator;
import com.heronix.progress.calculator.standing.AcademicStandingCalculator;
import com.heronix.progress.exception.EvaluationFailedException;
import com.heronix.progress.model.enums.RepeatPolicy;
import com.heronix.progress.model.enums.TermSeason;
import com.heronix.progress.model.gpa.CourseAttempt;
import com.heronix.progress.model.gpa.GpaCalculationOptions;
import com.heronix.progress.model.gpa.GpaResult;
import com.heronix.progress.model.gpa.TermGpaResult;
import com.heronix.progress.model.graduation.BatchConferralStudentInput;
import com.heronix.progress.model.graduation.BatchConferralStudentResult;
import com.heronix.progress.model.graduation.ConferralCheck;
import com.heronix.progress.model.graduation.GraduationEligibilityInput;
import com.heronix.progress.model.graduation.GraduationPolicyConfig;
import com.heronix.progress.model.graduation.GraduationValidationResult;
import com.heronix.progress.model.honors.LatinHonorsConfig;
import com.heronix.progress.model.honors.LatinHonorsInput;
import com.heronix.progress.model.honors.LatinHonorsResult;
import com.heronix.progress.model.result.CalculationResult;
import com.heronix.progress.model.sap.SapInput;
import com.heronix.progress.model.sap.SapPolicy;
import com.heronix.progress.model.sap.SapResult;
import com.heronix.progress.model.standing.AcademicStandingInput;
import com.heronix.progress.model.standing.AcademicStandingPolicy;
import com.heronix.progress.model.standing.AcademicStandingResult;
import com.heronix.progress.model.standing.RequiredTermGpa;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * REST API for single-student evaluations. Every call uses the configured institution
 * policies.
 */
@RestController
@RequestMapping("/api/v1/progress")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Evaluations", description = "GPA, SAP, standing, graduation and honors calculations")
public class EvaluationController {

    private final GpaCalculator gpaCalculator;
    private final SapCalculator sapCalculator;
    private final GraduationEligibilityValidator graduationValidator;
    private final ConferralCalculator conferralCalculator;
    private final LatinHonorsCalculator honorsCalculator;
    private final AcademicStandingCalculator standingCalculator;
    private final GpaCalculationOptions gpaOptions;
    private final SapPolicy sapPolicy;
    private final GraduationPolicyConfig graduationPolicy;
    private final LatinHonorsConfig honorsConfig;
    private final AcademicStandingPolicy standingPolicy;

    // ========================================================================
    // GPA
    // ========================================================================

    @PostMapping("/gpa")
    @Operation(summary = "Calculate GPA", description = "Cumulative GPA over the given attempts")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "GPA calculated"),
        @ApiResponse(responseCode = "422", description = "Malformed attempts")
    })
    public ResponseEntity<GpaResult> calculateGpa(@RequestBody GpaRequest request) {
        return ResponseEntity.ok(unwrap(gpaCalculator.calculateGpa(request.attempts(), options(request.repeatPolicy()))));
    }

    @PostMapping("/gpa/terms")
    @Operation(summary = "Calculate GPA by term", description = "Term GPA for every term present in the attempts")
    public ResponseEntity<Map<String, TermGpaResult>> calculateGpaByTerm(@RequestBody GpaRequest request) {
        return ResponseEntity.ok(unwrap(gpaCalculator.calculateGpaByTerm(request.attempts(),
                options(request.repeatPolicy()))));
    }

    @PostMapping("/gpa/transfer")
    @Operation(summary = "Calculate GPA with transfer work",
            description = "Cumulative GPA including transfer quality points and GPA credits")
    public ResponseEntity<GpaResult> calculateGpaWithTransfer(@RequestBody TransferGpaRequest request) {
        return ResponseEntity.ok(unwrap(gpaCalculator.calculateCumulativeGpaWithTransfer(
                request.attempts(), request.transferQualityPoints(), request.transferGpaCredits(),
                options(request.repeatPolicy()))));
    }

    // ========================================================================
    // SAP
    // ========================================================================

    @PostMapping("/sap")
    @Operation(summary = "Evaluate SAP", description = "Satisfactory Academic Progress for one student")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "SAP evaluated"),
        @ApiResponse(responseCode = "422", description = "Malformed input")
    })
    public ResponseEntity<SapResult> evaluateSap(@RequestBody SapInput input) {
        return ResponseEntity.ok(unwrap(sapCalculator.calculateSap(input, sapPolicy)));
    }

    @PostMapping("/sap/projection")
    @Operation(summary = "Project SAP", description = "SAP status after additional credits at a projected GPA")
    public ResponseEntity<SapResult> projectSap(@RequestBody SapProjectionRequest request) {
        return ResponseEntity.ok(unwrap(sapCalculator.projectSapStatus(request.current(),
                request.additionalAttemptedCredits(), request.additionalEarnedCredits(),
                request.projectedGpa(), sapPolicy)));
    }

    // ========================================================================
    // ACADEMIC STANDING
    // ========================================================================

    @PostMapping("/standing")
    @Operation(summary = "Calculate academic standing",
            description = "Standing at term end from cumulative GPA and probation history")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Standing determined"),
        @ApiResponse(responseCode = "422", description = "Malformed input")
    })
    public ResponseEntity<AcademicStandingResult> calculateStanding(@RequestBody AcademicStandingInput input) {
        return ResponseEntity.ok(unwrap(standingCalculator.calculateAcademicStanding(input, standingPolicy)));
    }

    @GetMapping("/standing/good-standing")
    @Operation(summary = "Check good standing",
            description = "Minimum GPA at the credit level and whether the GPA meets it")
    public ResponseEntity<GoodStandingCheck> checkGoodStanding(@RequestParam BigDecimal gpa,
                                                               @RequestParam BigDecimal creditsCompleted) {
        return ResponseEntity.ok(new GoodStandingCheck(
                standingCalculator.getMinimumGpaForGoodStanding(creditsCompleted, standingPolicy),
                standingCalculator.wouldBeInGoodStanding(gpa, creditsCompleted, standingPolicy)));
    }

    @PostMapping("/standing/required-term-gpa")
    @Operation(summary = "Required term GPA",
            description = "Term GPA needed next term to reach a target cumulative GPA")
    public ResponseEntity<RequiredTermGpa> requiredTermGpa(@RequestBody RequiredTermGpaRequest request) {
        BigDecimal target = request.targetGpa() != null
                ? request.targetGpa()
                : standingPolicy.thresholdsFor(request.currentGpaCredits() == null
                        ? BigDecimal.ZERO : request.currentGpaCredits()).goodStandingMinGpa();
        return ResponseEntity.ok(unwrap(standingCalculator.calculateRequiredTermGpa(request.currentQualityPoints(),
                request.currentGpaCredits(), request.nextTermCredits(), target)));
    }

    // ========================================================================
    // GRADUATION
    // ========================================================================

    @PostMapping("/graduation/validate")
    @Operation(summary = "Validate graduation eligibility",
            description = "Academic, administrative and record checks with Latin honors")
    public ResponseEntity<GraduationValidationResult> validateGraduation(
            @RequestBody GraduationEligibilityInput input) {
        return ResponseEntity.ok(unwrap(graduationValidator.validate(input, graduationPolicy)));
    }

    @PostMapping("/graduation/can-confer")
    @Operation(summary = "Check conferral", description = "Final check before a degree is conferred")
    public ResponseEntity<ConferralCheck> canConfer(@RequestBody GraduationEligibilityInput input) {
        return ResponseEntity.ok(unwrap(graduationValidator.canConfer(input, graduationPolicy)));
    }

    @PostMapping("/graduation/conferral")
    @Operation(summary = "Batch conferral", description = "Confer degrees on cleared students")
    public ResponseEntity<List<BatchConferralStudentResult>> conferBatch(@RequestBody ConferralRequest request) {
        LocalDate conferralDate = request.conferralDate() != null ? request.conferralDate() : LocalDate.now();
        log.info("Conferring {} degrees for {}", request.students().size(), conferralDate);
        return ResponseEntity.ok(conferralCalculator.processBatchConferral(request.students(), conferralDate,
                honorsConfig));
    }

    @GetMapping("/graduation/expected-term")
    @Operation(summary = "Expected graduation term",
            description = "Term in which the remaining credits complete at a steady load")
    public ResponseEntity<Map<String, String>> expectedGraduationTerm(
            @RequestParam BigDecimal currentCredits,
            @RequestParam BigDecimal requiredCredits,
            @RequestParam(required = false) BigDecimal creditsPerTerm,
            @RequestParam TermSeason currentTerm,
            @RequestParam int currentYear) {
        String term = conferralCalculator.expectedGraduationTerm(currentCredits, requiredCredits, creditsPerTerm,
                currentTerm, currentYear);
        return ResponseEntity.ok(Map.of("expectedTerm", term));
    }

    // ========================================================================
    // HONORS
    // ========================================================================

    @PostMapping("/honors")
    @Operation(summary = "Calculate Latin honors")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Honors determined"),
        @ApiResponse(responseCode = "422", description = "Negative credits or GPA")
    })
    public ResponseEntity<LatinHonorsResult> calculateHonors(@RequestBody LatinHonorsInput input) {
        return ResponseEntity.ok(unwrap(honorsCalculator.calculate(input, honorsConfig)));
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    private GpaCalculationOptions options(RepeatPolicy repeatPolicy) {
        if (repeatPolicy == null) {
            return gpaOptions;
        }
        return new GpaCalculationOptions(repeatPolicy, gpaOptions.decimalPlaces(), gpaOptions.gradeScale());
    }

    private static <T> T unwrap(CalculationResult<T> result) {
        if (result.isFailure()) {
            throw new EvaluationFailedException(result.error());
        }
        return result.value();
    }

    // ========================================================================
    // REQUEST/RESPONSE TYPES
    // ========================================================================

    public record GpaRequest(
            List<CourseAttempt> attempts,
            RepeatPolicy repeatPolicy
    ) {}

    public record TransferGpaRequest(
            List<CourseAttempt> attempts,
            BigDecimal transferQualityPoints,
            BigDecimal transferGpaCredits,
            RepeatPolicy repeatPolicy
    ) {}

    public record SapProjectionRequest(
            SapInput current,
            BigDecimal additionalAttemptedCredits,
            BigDecimal additionalEarnedCredits,
            BigDecimal projectedGpa
    ) {}

    /**
     * @param targetGpa defaults to the good standing minimum at the current credit level
     */
    public record RequiredTermGpaRequest(
            BigDecimal currentQualityPoints,
            BigDecimal currentGpaCredits,
            BigDecimal nextTermCredits,
            BigDecimal targetGpa
    ) {}

    public record GoodStandingCheck(
            BigDecimal minimumGpa,
            boolean inGoodStanding
    ) {}

    public record ConferralRequest(
            LocalDate conferralDate,
            List<BatchConferralStudentInput> students
    ) {
        public ConferralRequest {
            students = students == null ? List.of() : students;
        }
    }
}
