/* (C)2026 */
package com.ammann.tlparser.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.eclipse.microprofile.context.ThreadContext;

/**
 * CDI producer for creating named ManagedExecutor instances.
 *
 * <p>Provides the "formula-digest-executor" bean used by RequirementDigestService to
 * compute the statistics of a batch of requirements in parallel.
 */
@ApplicationScoped
public class ExecutorProducer {

    public static final String DIGEST_EXECUTOR = "formula-digest-executor";

    @ConfigProperty(name = "tlparser.digest.executor.max-async", defaultValue = "4")
    int maxAsync;

    @ConfigProperty(name = "tlparser.digest.executor.max-queued", defaultValue = "-1")
    int maxQueued;

    /**
     * Produces a named ManagedExecutor for batch digests.
     *
     * <p>Configuration properties:
     * <ul>
     *   <li>tlparser.digest.executor.max-async</li>
     *   <li>tlparser.digest.executor.max-queued (-1 for unbounded)</li>
     * </ul>
     *
     * @return Configured ManagedExecutor instance
     */
    @Produces
    @Named(DIGEST_EXECUTOR)
    @ApplicationScoped
    public ManagedExecutor createDigestExecutor() {
        return ManagedExecutor.builder()
                .maxAsync(maxAsync)
                .maxQueued(maxQueued)
                .propagated(ThreadContext.NONE)
                .cleared(ThreadContext.ALL_REMAINING)
                .build();
    }
}
