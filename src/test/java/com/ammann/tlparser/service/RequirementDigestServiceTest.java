package com.ammann.tlparser.service;

import com.ammann.tlparser.enumeration.LogicType;
import com.ammann.tlparser.enumeration.RecordStatus;
import com.ammann.tlparser.enumeration.TranslationStatus;
import com.ammann.tlparser.exception.FormulaSyntaxException;
import com.ammann.tlparser.exception.UnsupportedOperatorException;
import com.ammann.tlparser.exception.ValidationException;
import com.ammann.tlparser.model.DatasetRow;
import com.ammann.tlparser.model.RequirementEntry;
import com.ammann.tlparser.model.RowError;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static com.ammann.tlparser.support.TestDataFactory.REFERENCE_FORMULA;
import static com.ammann.tlparser.support.TestDataFactory.document;
import static com.ammann.tlparser.support.TestDataFactory.entry;
import static com.ammann.tlparser.support.TestDataFactory.formalization;
import static com.ammann.tlparser.support.TestDataFactory.statisticsService;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link RequirementDigestService}.
 *
 * <p>The managed executor is mocked and backed by a plain thread pool, so tasks really run
 * concurrently while the test stays outside the container.
 */
class RequirementDigestServiceTest
{

    private ExecutorService pool;
    private ManagedExecutor executor;
    private SimpleMeterRegistry registry;
    private RequirementDigestService service;

    @BeforeEach
    void setUp()
    {
        pool = Executors.newFixedThreadPool(4);
        executor = mock(ManagedExecutor.class);
        when(executor.supplyAsync(any())).thenAnswer(
                inv -> CompletableFuture.supplyAsync(inv.<Supplier<?>>getArgument(0), pool));
        registry = new SimpleMeterRegistry();
        service = newService(statisticsService());
    }

    @AfterEach
    void tearDown()
    {
        pool.shutdownNow();
    }

    private RequirementDigestService newService(FormulaStatisticsService statisticsService)
    {
        RequirementDigestService digest = new RequirementDigestService(statisticsService, executor);
        digest.onlyWithStatus = List.of("OK");
        digest.logicOrder = List.of("INV", "LTL", "MTLb", "MITL", "TPTL", "CTLS", "STL");
        digest.timeout = Duration.ofSeconds(10);
        digest.meterRegistry = registry;
        return digest;
    }

    @Test
    void preservesInputOrder()
    {
        List<RequirementEntry> entries = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            String formula = i % 2 == 0 ? REFERENCE_FORMULA : "G(p" + i + " --> F q" + i + ")";
            entries.add(entry("R" + i, LogicType.LTL, formula));
        }

        List<DatasetRow> rows = service.digest(entries);

        assertThat(rows).extracting(DatasetRow::id)
                .containsExactlyElementsOf(entries.stream().map(RequirementEntry::id).toList());
        assertThat(rows).allMatch(r -> r.status() == RecordStatus.OK);
        assertThat(rows.get(1).stats().ap()).containsExactly("p1", "q1");
    }

    @Test
    void failingFormulaDoesNotAffectSiblings()
    {
        List<DatasetRow> rows = service.digest(List.of(
                entry("R1", LogicType.LTL, REFERENCE_FORMULA),
                entry("R2", LogicType.LTL, "G((p)"),
                entry("R3", LogicType.LTL, "A G p"),
                entry("R4", LogicType.CTLS, "A G p")));

        assertThat(rows).extracting(DatasetRow::status)
                .containsExactly(RecordStatus.OK, RecordStatus.FAILED, RecordStatus.FAILED, RecordStatus.OK);
        assertThat(rows.get(0).stats().entropy().lopsTops()).isEqualTo(2.585);
        assertThat(rows.get(1).stats()).isNull();
        assertThat(rows.get(1).error().kind()).isEqualTo(FormulaSyntaxException.KIND);
        assertThat(rows.get(1).error().position()).isEqualTo(5);
        assertThat(rows.get(2).error().kind()).isEqualTo(UnsupportedOperatorException.KIND);
        assertThat(rows.get(2).error().position()).isNull();

        assertThat(registry.get("tlparser_formulas_processed_total").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("tlparser_formulas_failed_total").tag("kind", "SYNTAX_ERROR").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void unexpectedFailureBecomesInternalErrorRow()
    {
        FormulaStatisticsService broken = mock(FormulaStatisticsService.class);
        when(broken.compute(anyString(), any(), any())).thenThrow(new IllegalStateException("boom"));
        RequirementDigestService digest = newService(broken);

        List<DatasetRow> rows = digest.digest(List.of(entry("R1", LogicType.LTL, "p")));

        assertThat(rows).singleElement().satisfies(row -> {
            assertThat(row.failed()).isTrue();
            assertThat(row.error().kind()).isEqualTo(RowError.INTERNAL);
            assertThat(row.error().message()).contains("IllegalStateException", "boom");
        });
    }

    @Test
    void unfinishedTasksAreCancelledAtTheDeadline()
    {
        doAnswer(inv -> new CompletableFuture<DatasetRow>()).when(executor).supplyAsync(any());
        service.timeout = Duration.ofMillis(50);

        List<DatasetRow> rows = service.digest(List.of(
                entry("R1", LogicType.LTL, "p"),
                entry("R2", LogicType.LTL, "q")));

        assertThat(rows).extracting(DatasetRow::id).containsExactly("R1", "R2");
        assertThat(rows).allSatisfy(row -> {
            assertThat(row.status()).isEqualTo(RecordStatus.FAILED);
            assertThat(row.error().kind()).isEqualTo(RowError.CANCELLED);
        });
        assertThat(registry.get("tlparser_formulas_failed_total").tag("kind", "CANCELLED").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.find("tlparser_formulas_processed_total").counter()).isNull();
    }

    @Test
    void onlyUnfinishedRowsAreCancelled()
    {
        AtomicInteger calls = new AtomicInteger();
        doAnswer(inv -> calls.getAndIncrement() % 2 == 0
                ? CompletableFuture.completedFuture(inv.<Supplier<?>>getArgument(0).get())
                : new CompletableFuture<DatasetRow>())
                .when(executor).supplyAsync(any());
        service.timeout = Duration.ofMillis(50);

        List<DatasetRow> rows = service.digest(List.of(
                entry("R1", LogicType.LTL, REFERENCE_FORMULA),
                entry("R2", LogicType.LTL, "G q"),
                entry("R3", LogicType.LTL, "G(p --> F r)"),
                entry("R4", LogicType.LTL, "F s")));

        assertThat(rows).extracting(DatasetRow::status).containsExactly(
                RecordStatus.OK, RecordStatus.FAILED, RecordStatus.OK, RecordStatus.FAILED);
        assertThat(rows.get(0).stats().entropy().lopsTops()).isEqualTo(2.585);
        assertThat(rows.get(2).stats().asth()).isEqualTo(3);
        assertThat(rows.get(1).error().kind()).isEqualTo(RowError.CANCELLED);
        assertThat(rows.get(3).error().kind()).isEqualTo(RowError.CANCELLED);
        assertThat(rows.get(3).stats()).isNull();
    }

    @Test
    void taskFinishingAtTheDeadlineKeepsItsResult()
    {
        doAnswer(inv -> new FinishesOnTimeout(inv.<Supplier<DatasetRow>>getArgument(0)))
                .when(executor).supplyAsync(any());

        List<DatasetRow> rows = service.digest(List.of(entry("R1", LogicType.LTL, REFERENCE_FORMULA)));

        assertThat(rows).singleElement().satisfies(row -> {
            assertThat(row.status()).isEqualTo(RecordStatus.OK);
            assertThat(row.stats().asth()).isEqualTo(5);
        });
        assertThat(registry.get("tlparser_formulas_processed_total").counter().count()).isEqualTo(1.0);
        assertThat(registry.find("tlparser_formulas_failed_total").counter()).isNull();
    }

    @Test
    void cancelledTaskThatCompletesLaterIsCountedOnce() throws Exception
    {
        FormulaStatisticsService real = statisticsService();
        FormulaStatisticsService slow = mock(FormulaStatisticsService.class);
        when(slow.compute(anyString(), any(), any())).thenAnswer(inv -> {
            String formula = inv.getArgument(0);
            if (formula.equals("G(slow)")) {
                Thread.sleep(300);
            }
            return real.compute(formula, inv.getArgument(1), inv.getArgument(2));
        });
        RequirementDigestService digest = newService(slow);
        digest.timeout = Duration.ofMillis(100);

        List<DatasetRow> rows = digest.digest(List.of(
                entry("R1", LogicType.LTL, "G(q)"),
                entry("R2", LogicType.LTL, "G(slow)")));
        pool.shutdown();
        assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

        assertThat(rows).extracting(DatasetRow::status).containsExactly(RecordStatus.OK, RecordStatus.FAILED);
        assertThat(registry.get("tlparser_formulas_processed_total").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("tlparser_formulas_failed_total").tag("kind", "CANCELLED").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void saturatedExecutorRunsOnCallingThread()
    {
        doThrow(new RejectedExecutionException("queue full")).when(executor).supplyAsync(any());

        List<DatasetRow> rows = service.digest(List.of(entry("R1", LogicType.LTL, REFERENCE_FORMULA)));

        assertThat(rows).singleElement().extracting(DatasetRow::status).isEqualTo(RecordStatus.OK);
    }

    @Test
    void emptyBatchYieldsNoRows()
    {
        assertThat(service.digest(List.of())).isEmpty();
    }

    @Test
    void derivesTranslationClassInLogicOrder()
    {
        List<DatasetRow> rows = service.digest(List.of(
                entry("R1", LogicType.CTLS, TranslationStatus.NO, "A G p"),
                entry("R1", LogicType.INV, TranslationStatus.SELF, "p"),
                entry("R2", LogicType.LTL, TranslationStatus.UNKNOWN, "G q"),
                entry("R1", LogicType.LTL, TranslationStatus.YES, "G p")));

        assertThat(rows).extracting(DatasetRow::translationclass).containsExactly("syn", "syn", "u", "syn");
    }

    @Test
    void keepsPrecomputedTranslationClass()
    {
        RequirementEntry precomputed = new RequirementEntry(
                "R1", null, LogicType.LTL, null, TranslationStatus.YES, "given", "G p");

        List<DatasetRow> rows = service.digest(List.of(precomputed));

        assertThat(rows.get(0).translationclass()).isEqualTo("given");
    }

    @Test
    void digestsDocumentsWithAcceptedStatusOnly()
    {
        List<DatasetRow> rows = service.digestDocuments(List.of(
                document("R1", "OK",
                        formalization(LogicType.INV, TranslationStatus.SELF, "x >= 1"),
                        formalization(LogicType.LTL, TranslationStatus.YES, "G(x >= 1)")),
                document("R2", "DRAFT",
                        formalization(LogicType.LTL, TranslationStatus.YES, "G p")),
                document("R3", "OK",
                        formalization(LogicType.LTL, TranslationStatus.NO, "G(p"))));

        assertThat(rows).extracting(DatasetRow::id).containsExactly("R1", "R1", "R3");
        assertThat(rows).extracting(DatasetRow::type).containsExactly(LogicType.INV, LogicType.LTL, LogicType.LTL);
        assertThat(rows.get(1).stats().reqSentenceCount()).isEqualTo(1);
        assertThat(rows.get(1).translationclass()).isEqualTo("sy");
        assertThat(rows.get(2).failed()).isTrue();
    }

    @Test
    void rejectsDuplicateDocumentIds()
    {
        assertThatThrownBy(() -> service.digestDocuments(List.of(
                document("R1", "OK"), document("R2", "OK"), document("R1", "DRAFT"))))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("R1")
                .hasMessageNotContaining("R2");
    }

    /**
     * Future that completes only when its timed wait expires, so the wait still reports a
     * timeout while a later cancellation finds the result already there.
     */
    private static final class FinishesOnTimeout extends CompletableFuture<DatasetRow>
    {
        private final Supplier<DatasetRow> supplier;

        FinishesOnTimeout(Supplier<DatasetRow> supplier)
        {
            this.supplier = supplier;
        }

        @Override
        public DatasetRow get(long timeout, TimeUnit unit) throws TimeoutException
        {
            complete(supplier.get());
            throw new TimeoutException();
        }
    }
}
