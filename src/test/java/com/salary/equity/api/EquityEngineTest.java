package com.salary.equity.api;

import com.salary.equity.allocation.AllocationResult;
import com.salary.equity.allocation.RecommendationState;
import com.salary.equity.convergence.ConvergenceRecord;
import com.salary.equity.convergence.ConvergenceReport;
import com.salary.equity.core.EquityException;
import com.salary.equity.core.ErrorKind;
import com.salary.equity.core.RecordError;
import com.salary.equity.core.model.Employee;
import com.salary.equity.core.model.PerformanceRating;
import com.salary.equity.metrics.MicrometerMetricsService;
import com.salary.equity.population.JsonPopulationReader;
import com.salary.equity.population.PopulationSource;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EquityEngineTest {

    @Mock
    private AnalysisCheckpoint checkpoint;

    private SimpleMeterRegistry registry;
    private EquityEngine engine;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        engine = EquityEngine.builder()
                .options(EquityAnalysisOptions.builder().parallelism(4).build())
                .metricsService(new MicrometerMetricsService(registry))
                .build();
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private static Employee employee(String id, int level, double salary, String gender,
                                     PerformanceRating rating, String managerId) {
        return Employee.builder()
                .id(id)
                .level(level)
                .salary(salary)
                .gender(gender)
                .performanceRating(rating)
                .tenureYears(2)
                .managerId(managerId)
                .build();
    }

    /**
     * Two managers over two levels; F1 and F4 sit well below their medians.
     */
    private static List<Employee> population() {
        List<Employee> population = new ArrayList<>();
        population.add(employee("F1", 1, 42_000, "Female", PerformanceRating.HIGH_PERFORMING, "M1"));
        population.add(employee("F2", 1, 50_000, "Female", PerformanceRating.ACHIEVING, "M1"));
        population.add(employee("M2", 1, 51_000, "Male", PerformanceRating.ACHIEVING, "M1"));
        population.add(employee("M3", 1, 53_000, "Male", PerformanceRating.EXCEEDING, "M1"));
        population.add(employee("F3", 2, 70_000, "Female", PerformanceRating.ACHIEVING, "M2"));
        population.add(employee("F4", 2, 58_000, "Female", PerformanceRating.PARTIALLY_MET, "M2"));
        population.add(employee("M4", 2, 71_000, "Male", PerformanceRating.ACHIEVING, "M2"));
        population.add(employee("M5", 2, 75_000, "Male", PerformanceRating.HIGH_PERFORMING, null));
        return population;
    }

    @Nested
    @DisplayName("Full run")
    class FullRun {

        @Test
        @DisplayName("Should project, classify, cost strategies and allocate")
        void runsEveryPhase() {
            EquityAnalysisResult result = engine.analyze(population());

            assertNotNull(result.runId());
            assertEquals(8, result.projections().size());
            assertTrue(result.projectionFor("F1").isPresent());

            ConvergenceReport report = result.convergence();
            assertEquals(8, report.totalEmployees());
            assertEquals(2, report.peerGroups().size());
            assertTrue(report.belowMedianCount() >= 2);
            ConvergenceRecord f1 = report.records().stream()
                    .filter(r -> r.employeeId().equals("F1")).findFirst().orElseThrow();
            assertEquals(result.projectionFor("F1").orElseThrow().optimisticRate(), f1.acceleratedGrowthRate());
            assertEquals(result.projectionFor("F1").orElseThrow().realisticRate(), f1.employeeGrowthRate());

            assertEquals(report.belowMedianCount(), result.strategies().eligibleCount());
            assertNotNull(result.strategies().selected());

            assertTrue(result.isAllocated());
            AllocationResult allocation = result.allocation().orElseThrow();
            assertEquals(2, allocation.managers().size());
            assertEquals(7, allocation.recommendations().size());
            assertTrue(allocation.withinOverallBudget());
            assertTrue(allocation.recommendations().stream().allMatch(r -> r.getState().isTerminal()));
            assertTrue(result.failures().isEmpty());
        }

        @Test
        @DisplayName("Should record metrics for every phase")
        void recordsMetrics() {
            EquityAnalysisResult result = engine.analyze(population());

            for (String phase : List.of(EquityEngine.PHASE_VALIDATION, EquityEngine.PHASE_PROJECTION,
                    EquityEngine.PHASE_CONVERGENCE, EquityEngine.PHASE_STRATEGY, EquityEngine.PHASE_ALLOCATION)) {
                assertNotNull(registry.find("equity.phase.duration").tag("phase", phase).timer(), phase);
            }
            assertEquals(1, registry.find("equity.population.size").summary().count());
            assertEquals(1.0, registry.find("equity.strategy.selected")
                    .tag("strategy", result.strategies().selected().name()).counter().count());
            double recommendations = registry.find("equity.recommendations").counters().stream()
                    .mapToDouble(c -> c.count()).sum();
            assertEquals(7.0, recommendations);
        }

        @Test
        @DisplayName("Results should be identical across runs")
        void deterministic() {
            EquityAnalysisResult first = engine.analyze(population());
            EquityAnalysisResult second = engine.analyze(population());

            assertNotEquals(first.runId(), second.runId());
            assertEquals(first.convergence().classifications(), second.convergence().classifications());
            assertEquals(first.strategies().selected(), second.strategies().selected());
            assertEquals(first.allocation().orElseThrow().totalAllocated(),
                    second.allocation().orElseThrow().totalAllocated(), 1e-9);
        }
    }

    @Nested
    @DisplayName("Record failures")
    class Failures {

        @Test
        @DisplayName("Should report invalid records and analyse the rest")
        void invalidRecordsReported() {
            List<Employee> population = population();
            population.add(employee("BAD1", 1, 0, "Male", PerformanceRating.ACHIEVING, "M1"));
            population.add(employee("BAD2", 9, 60_000, "Male", PerformanceRating.ACHIEVING, "M1"));

            EquityAnalysisResult result = engine.analyze(population);

            assertEquals(2, result.failedCount());
            assertEquals(8, result.convergence().totalEmployees());
            assertEquals(2, result.convergence().failedCount());
            assertEquals(1.0, registry.find("equity.records.failed")
                    .tag("kind", "NON_POSITIVE_SALARY").counter().count());
            assertEquals(1.0, registry.find("equity.records.failed")
                    .tag("kind", "INVALID_LEVEL").counter().count());
        }

        @Test
        @DisplayName("Should report a null entry and analyse the rest")
        void nullEntryReported() {
            List<Employee> population = population();
            population.add(null);

            EquityAnalysisResult result = engine.analyze(population);

            assertEquals(8, result.convergence().totalEmployees());
            assertEquals(List.of(ErrorKind.MALFORMED_RECORD),
                    result.failures().stream().map(RecordError::kind).toList());
        }

        @Test
        @DisplayName("Should fail when no record is valid")
        void insufficientPopulation() {
            List<Employee> population = List.of(
                    employee("BAD1", 1, -5, "Male", PerformanceRating.ACHIEVING, "M1"));

            EquityException e = assertThrows(EquityException.class, () -> engine.analyze(population));
            assertEquals(ErrorKind.INSUFFICIENT_POPULATION, e.getKind());
        }

        @Test
        @DisplayName("Should carry load errors from a JSON source")
        void loadErrorsFromSource() {
            String json = """
                    [
                      {"employee_id": "A", "level": 1, "salary": 40000, "performance_rating": "Achieving", "manager_id": "M1"},
                      {"employee_id": "B", "level": 1, "salary": 50000, "performance_rating": "Achieving", "manager_id": "M1"},
                      {"employee_id": "C", "level": 1, "salary": 60000, "performance_rating": "Achieving", "manager_id": "M1"},
                      {"employee_id": "D", "level": 1, "performance_rating": "Achieving"},
                      "not a record"
                    ]
                    """;
            PopulationSource source = new JsonPopulationReader().source(new StringReader(json));

            EquityAnalysisResult result = engine.analyze(source);

            assertEquals(3, result.convergence().totalEmployees());
            assertEquals(List.of(ErrorKind.MISSING_FIELD, ErrorKind.MALFORMED_RECORD),
                    result.failures().stream().map(RecordError::kind).toList());
        }
    }

    @Nested
    @DisplayName("Checkpoint")
    class Checkpoint {

        @Test
        @DisplayName("Declining the checkpoint should skip allocation")
        void checkpointStopsAllocation() {
            when(checkpoint.proceed(any(ConvergenceReport.class))).thenReturn(false);
            try (EquityEngine gated = EquityEngine.builder()
                    .options(EquityAnalysisOptions.builder().parallelism(2).build())
                    .metricsService(new MicrometerMetricsService(registry))
                    .checkpoint(checkpoint)
                    .build()) {

                EquityAnalysisResult result = gated.analyze(population());

                assertFalse(result.isAllocated());
                assertNotNull(result.strategies().selected());
                verify(checkpoint, times(1)).proceed(any(ConvergenceReport.class));
                assertNull(registry.find("equity.phase.duration")
                        .tag("phase", EquityEngine.PHASE_ALLOCATION).timer());
            }
        }

        @Test
        @DisplayName("Checkpoint should see the convergence report")
        void checkpointReceivesReport() {
            when(checkpoint.proceed(any(ConvergenceReport.class)))
                    .thenAnswer(invocation -> invocation.<ConvergenceReport>getArgument(0).belowMedianCount() > 0);
            try (EquityEngine gated = EquityEngine.builder().checkpoint(checkpoint).build()) {
                EquityAnalysisResult result = gated.analyze(population());

                assertTrue(result.isAllocated());
                assertTrue(result.allocation().orElseThrow().recommendations().stream()
                        .anyMatch(r -> r.getState() != RecommendationState.PENDING));
            }
        }
    }

    @Test
    @DisplayName("Should leave a caller-supplied executor running on close")
    void externalExecutorNotClosed() {
        ExecutorService external = Executors.newFixedThreadPool(2);
        try {
            EquityEngine shared = EquityEngine.builder().executor(external).build();
            shared.analyze(population());
            shared.close();

            assertFalse(external.isShutdown());
        } finally {
            external.shutdownNow();
        }
    }
}
