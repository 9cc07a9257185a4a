/* (C)2026 */
package com.ammann.tlparser.service;

import com.ammann.tlparser.config.ExecutorProducer;
import com.ammann.tlparser.enumeration.LogicType;
import com.ammann.tlparser.exception.FormulaException;
import com.ammann.tlparser.exception.ValidationException;
import com.ammann.tlparser.model.DatasetRow;
import com.ammann.tlparser.model.RequirementDocument;
import com.ammann.tlparser.model.RequirementEntry;
import com.ammann.tlparser.model.RowError;
import com.ammann.tlparser.model.StatsRecord;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.jboss.logging.Logger;

/**
 * Service turning a batch of formalized requirements into dataset rows.
 *
 * <p>Each requirement's pipeline runs as an independent task on the
 * {@value ExecutorProducer#DIGEST_EXECUTOR}; rows are joined back in input order. A formula
 * that fails, or a task that does not finish within the batch timeout, produces a FAILED
 * row and never affects its siblings.
 */
@ApplicationScoped
public class RequirementDigestService {

    private static final Logger LOG = Logger.getLogger(RequirementDigestService.class);

    private final FormulaStatisticsService statisticsService;
    private final ManagedExecutor executor;

    @ConfigProperty(name = "tlparser.digest.only-with-status", defaultValue = "OK")
    List<String> onlyWithStatus;

    @ConfigProperty(name = "tlparser.digest.logic-order", defaultValue = "INV,LTL,MTLb,MITL,TPTL,CTLS,STL")
    List<String> logicOrder;

    @ConfigProperty(name = "tlparser.digest.timeout", defaultValue = "60s")
    Duration timeout;

    @Inject MeterRegistry meterRegistry;

    @Inject
    public RequirementDigestService(
            FormulaStatisticsService statisticsService,
            @Named(ExecutorProducer.DIGEST_EXECUTOR) ManagedExecutor executor) {
        this.statisticsService = statisticsService;
        this.executor = executor;
    }

    /**
     * Computes one row per entry, preserving input order.
     *
     * @param entries formalized requirements
     * @return rows, OK or FAILED, in input order
     */
    public List<DatasetRow> digest(List<RequirementEntry> entries) {
        long start = System.nanoTime();
        long deadline = start + timeout.toNanos();

        List<CompletableFuture<DatasetRow>> tasks = new ArrayList<>(entries.size());
        for (RequirementEntry entry : entries) {
            tasks.add(submit(entry));
        }

        List<DatasetRow> rows = new ArrayList<>(entries.size());
        boolean interrupted = false;
        for (int i = 0; i < tasks.size(); i++) {
            CompletableFuture<DatasetRow> task = tasks.get(i);
            RequirementEntry entry = entries.get(i);
            if (interrupted) {
                rows.add(cancel(task, entry, "Batch interrupted"));
                continue;
            }
            try {
                rows.add(task.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS));
            } catch (TimeoutException e) {
                rows.add(cancel(task, entry, "Batch timeout of " + timeout + " exceeded"));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                interrupted = true;
                rows.add(cancel(task, entry, "Batch interrupted"));
            } catch (ExecutionException e) {
                LOG.errorf(e.getCause(), "Unexpected failure for requirement %s", entry.id());
                rows.add(DatasetRow.failure(entry, RowError.internal(e.getCause())));
            }
        }

        List<DatasetRow> result = applyTranslationClasses(rows);
        result.forEach(this::recordOutcome);
        long failed = result.stream().filter(DatasetRow::failed).count();
        LOG.infof("Digested %d formulas in %.2fms (%d failed)",
                result.size(), (System.nanoTime() - start) / 1_000_000.0, failed);
        return result;
    }

    /**
     * Digests requirement catalogue entries: rejects duplicate ids, keeps only entries with
     * a configured status and expands each into one row per formalization.
     *
     * @throws ValidationException if an id occurs more than once
     */
    public List<DatasetRow> digestDocuments(List<RequirementDocument> documents) {
        Set<String> seen = new LinkedHashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (RequirementDocument document : documents) {
            if (!seen.add(document.id())) {
                duplicates.add(document.id());
            }
        }
        if (!duplicates.isEmpty()) {
            throw ValidationException.duplicateIds(duplicates);
        }

        List<RequirementEntry> entries = documents.stream()
                .filter(d -> onlyWithStatus.contains(d.status()))
                .flatMap(d -> d.toEntries().stream())
                .toList();
        LOG.debugf("Expanded %d of %d requirements into %d formalizations",
                documents.stream().filter(d -> onlyWithStatus.contains(d.status())).count(),
                documents.size(), entries.size());
        return digest(entries);
    }

    private CompletableFuture<DatasetRow> submit(RequirementEntry entry) {
        try {
            return executor.supplyAsync(() -> process(entry));
        } catch (RejectedExecutionException e) {
            LOG.debugf("Executor saturated, digesting requirement %s on the calling thread", entry.id());
            return CompletableFuture.completedFuture(process(entry));
        }
    }

    private DatasetRow process(RequirementEntry entry) {
        try {
            StatsRecord stats = statisticsService.compute(entry.formulaRaw(), entry.text(), entry.type());
            return DatasetRow.success(entry, stats);
        } catch (FormulaException e) {
            LOG.warnf("Requirement %s (%s) rejected: %s", entry.id(), entry.type(), e.getMessage());
            return DatasetRow.failure(entry, RowError.of(e));
        } catch (RuntimeException e) {
            LOG.errorf(e, "Unexpected failure for requirement %s", entry.id());
            return DatasetRow.failure(entry, RowError.internal(e));
        }
    }

    private DatasetRow cancel(CompletableFuture<DatasetRow> task, RequirementEntry entry, String reason) {
        if (!task.cancel(true) && task.isDone() && !task.isCompletedExceptionally()) {
            return task.join();
        }
        return DatasetRow.failure(entry, RowError.cancelled(reason));
    }

    /**
     * Fills missing translation classes: per requirement id, the initials of the
     * translation values ordered by logic.
     */
    List<DatasetRow> applyTranslationClasses(List<DatasetRow> rows) {
        Map<String, List<DatasetRow>> byId = rows.stream()
                .collect(Collectors.groupingBy(r -> Objects.toString(r.id(), ""), LinkedHashMap::new, Collectors.toList()));

        Map<String, String> classes = new LinkedHashMap<>();
        byId.forEach((id, group) -> classes.put(id, group.stream()
                .filter(r -> r.translation() != null)
                .sorted(Comparator.comparingInt(r -> logicRank(r.type())))
                .map(r -> String.valueOf(r.translation().initial()))
                .collect(Collectors.joining())));

        return rows.stream()
                .map(r -> r.translationclass() != null ? r : r.withTranslationClass(classes.get(Objects.toString(r.id(), ""))))
                .toList();
    }

    private int logicRank(LogicType type) {
        int rank = type == null ? -1 : logicOrder.indexOf(type.label());
        return rank < 0 ? Integer.MAX_VALUE : rank;
    }

    // Counted from the returned rows only: a cancelled task may still run to completion
    private void recordOutcome(DatasetRow row) {
        if (meterRegistry == null) {
            return;
        }
        if (!row.failed()) {
            Counter.builder("tlparser_formulas_processed_total")
                    .description("Total number of formulas with computed statistics")
                    .register(meterRegistry)
                    .increment();
            return;
        }
        String kind = row.error() == null ? null : row.error().kind();
        Counter.builder("tlparser_formulas_failed_total")
                .description("Total number of formulas rejected by error kind")
                .tag("kind", Objects.requireNonNullElse(kind, "other"))
                .register(meterRegistry)
                .increment();
    }
}
