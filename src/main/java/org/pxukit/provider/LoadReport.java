package org.pxukit.provider;

import java.util.List;
import java.util.Objects;
import org.pxukit.unit.JobUnit;

/**
 * Jobs of a provider sorted by identifier, with every problem met while loading them.
 */
public record LoadReport(List<JobUnit> jobs, List<ContentProblem> problems) {
    public LoadReport {
        jobs = List.copyOf(Objects.requireNonNull(jobs, "jobs"));
        problems = List.copyOf(Objects.requireNonNull(problems, "problems"));
    }

    public boolean hasProblems() {
        return !problems.isEmpty();
    }
}
