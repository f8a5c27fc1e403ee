package com.heronix.progress.model.graduation;

import java.time.LocalDate;

import com.heronix.progress.model.enums.ConferralStatus;
import com.heronix.progress.model.enums.LatinHonorsDesignation;

/**
 * Conferral outcome for one student.
 *
 * @param degreeAwarded e.g. "BS in Computer Science", null when conferral failed
 * @param failureReason set only when conferral failed
 */
public record BatchConferralStudentResult(
        String studentId,
        String studentProgramId,
        String graduationApplicationId,
        ConferralStatus status,
        String degreeAwarded,
        LocalDate conferralDate,
        LatinHonorsDesignation honorsDesignation,
        String failureReason
) {
    public static BatchConferralStudentResult conferred(BatchConferralStudentInput student, LocalDate conferralDate,
                                                        LatinHonorsDesignation honors) {
        return new BatchConferralStudentResult(student.studentId(), student.studentProgramId(),
                student.graduationApplicationId(), ConferralStatus.CONFERRED,
                student.degreeCode() + " in " + student.programName(), conferralDate, honors, null);
    }

    public static BatchConferralStudentResult failed(BatchConferralStudentInput student, String reason) {
        return new BatchConferralStudentResult(student.studentId(), student.studentProgramId(),
                student.graduationApplicationId(), ConferralStatus.FAILED, null, null, null, reason);
    }
}
