package com.salary.equity.allocation;

import com.salary.equity.convergence.PeerGroups;
import com.salary.equity.core.model.Employee;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Population-level equity indicators for one salary snapshot.
 *
 * <p>{@code genderGapPercent} is the median-salary gap between the reference
 * and comparison genders as a fraction of the reference median; empty when
 * either gender is absent.</p>
 */
public record EquityKpis(
        int employeeCount,
        double totalPayroll,
        int belowMedianCount,
        double belowMedianPercent,
        OptionalDouble genderGapPercent
) {
    public EquityKpis {
        genderGapPercent = genderGapPercent != null ? genderGapPercent : OptionalDouble.empty();
    }

    public static EquityKpis compute(List<Employee> population, PeerGroups peerGroups,
                                     String referenceGender, String comparisonGender) {
        double payroll = 0.0;
        int below = 0;
        DescriptiveStatistics reference = new DescriptiveStatistics();
        DescriptiveStatistics comparison = new DescriptiveStatistics();
        for (Employee employee : population) {
            payroll += employee.salary();
            if (employee.salary() < peerGroups.medianFor(employee)) {
                below++;
            }
            if (Objects.equals(employee.gender(), referenceGender)) {
                reference.addValue(employee.salary());
            } else if (Objects.equals(employee.gender(), comparisonGender)) {
                comparison.addValue(employee.salary());
            }
        }

        OptionalDouble genderGap = OptionalDouble.empty();
        if (reference.getN() > 0 && comparison.getN() > 0) {
            double referenceMedian = reference.getPercentile(50);
            genderGap = OptionalDouble.of((referenceMedian - comparison.getPercentile(50)) / referenceMedian);
        }

        int n = population.size();
        return new EquityKpis(n, payroll, below, n > 0 ? (double) below / n : 0.0, genderGap);
    }
}
