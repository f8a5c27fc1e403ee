package com.heronix.progress.model.batch;

import java.util.List;

/**
 * Which students a batch run covers: an explicit id list, or every eligible student.
 *
 * @param studentIds explicit ids, null for all eligible students
 */
public record CohortSelector(List<String> studentIds) {

    public CohortSelector {
        studentIds = studentIds == null ? null : List.copyOf(studentIds);
    }

    public static CohortSelector explicit(List<String> studentIds) {
        return new CohortSelector(studentIds == null ? List.of() : studentIds);
    }

    public static CohortSelector allEligible() {
        return new CohortSelector(null);
    }

    public boolean isAllEligible() {
        return studentIds == null;
    }
}
