package com.heronix.progress.calculator.graduation;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import com.heronix.progress.calculator.honors.LatinHonorsCalculator;
import com.heronix.progress.model.enums.TermSeason;
import com.heronix.progress.model.graduation.BatchConferralStudentInput;
import com.heronix.progress.model.graduation.BatchConferralStudentResult;
import com.heronix.progress.model.honors.LatinHonorsConfig;
import com.heronix.progress.model.honors.LatinHonorsInput;
import com.heronix.progress.model.honors.LatinHonorsResult;
import com.heronix.progress.model.result.CalculationResult;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Degree conferral helpers: batch conferral with honors, projected graduation term and
 * diploma numbering.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConferralCalculator {

    public static final BigDecimal DEFAULT_CREDITS_PER_TERM = BigDecimal.valueOf(15);

    private final LatinHonorsCalculator honorsCalculator;

    /**
     * Confer degrees on students already cleared for graduation.
     *
     * A student whose conferral record is incomplete fails individually; the rest of the
     * batch is unaffected.
     *
     * @return one result per student, in input order
     */
    public List<BatchConferralStudentResult> processBatchConferral(List<BatchConferralStudentInput> students,
                                                                   LocalDate conferralDate,
                                                                   LatinHonorsConfig honorsConfig) {
        List<BatchConferralStudentResult> results = new ArrayList<>(students.size());
        for (BatchConferralStudentInput student : students) {
            String problem = missingConferralData(student);
            if (problem != null) {
                log.warn("Conferral failed for student {}: {}", student.studentId(), problem);
                results.add(BatchConferralStudentResult.failed(student, problem));
                continue;
            }

            CalculationResult<LatinHonorsResult> honors = honorsCalculator.calculate(LatinHonorsInput.builder()
                    .cumulativeGpa(student.cumulativeGpa())
                    .institutionalGpa(student.institutionalGpa())
                    .earnedCredits(student.totalEarnedCredits())
                    .institutionalCredits(student.institutionalEarnedCredits())
                    .transferCredits(student.transferCredits())
                    .hasAcademicIntegrityViolation(student.hasAcademicIntegrityViolation())
                    .build(), honorsConfig);
            if (honors.isFailure()) {
                log.warn("Conferral failed for student {}: {}", student.studentId(), honors.error().details());
                results.add(BatchConferralStudentResult.failed(student,
                        "Honors could not be determined: " + String.join("; ", honors.error().details())));
                continue;
            }

            results.add(BatchConferralStudentResult.conferred(student, conferralDate, honors.value().designation()));
        }

        log.info("Processed conferral batch of {} students for {}", students.size(), conferralDate);
        return results;
    }

    /**
     * Expected graduation term given the credits still needed and a steady load.
     *
     * @return e.g. "Spring 2026"; the current term when nothing remains
     */
    public String expectedGraduationTerm(BigDecimal currentCredits, BigDecimal requiredCredits,
                                         BigDecimal creditsPerTerm, TermSeason currentTerm, int currentYear) {
        BigDecimal perTerm = creditsPerTerm == null || creditsPerTerm.signum() <= 0
                ? DEFAULT_CREDITS_PER_TERM
                : creditsPerTerm;
        BigDecimal remaining = requiredCredits.subtract(currentCredits).max(BigDecimal.ZERO);
        int remainingTerms = remaining.divide(perTerm, 0, RoundingMode.CEILING).intValue();

        TermSeason term = currentTerm;
        int year = currentYear;
        for (int i = 0; i < remainingTerms; i++) {
            term = term.next();
            if (term == TermSeason.FALL) {
                year++;
            }
        }
        return term.getDisplayName() + " " + year;
    }

    /**
     * Diploma number in the form {@code CODE-YEAR-000123}.
     */
    public String diplomaNumber(String institutionCode, int year, int sequence) {
        return String.format("%s-%d-%06d", institutionCode, year, sequence);
    }

    private static String missingConferralData(BatchConferralStudentInput student) {
        if (student.diplomaName() == null || student.diplomaName().isBlank()) {
            return "Diploma name missing";
        }
        if (student.degreeCode() == null || student.programName() == null) {
            return "Degree or program missing";
        }
        if (student.totalEarnedCredits() == null || student.institutionalEarnedCredits() == null) {
            return "Credit totals missing";
        }
        return null;
    }
}
