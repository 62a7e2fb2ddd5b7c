/**
 * Metrics adapter bridging the RULESYNC {@code MetricsPort} to OpenTelemetry.
 * <p><strong>Concurrency:</strong> Instruments are cached in concurrent maps; download workers update them
 * concurrently.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code fetch.*}, {@code merge.*}, {@code filter.*} and
 * {@code ruleset.*} namespaces.</p>
 * <p><strong>Security:</strong> Only counts and sizes are exported; URLs and rule values never are.</p>
 */
package ca.gc.cra.rulesync.infrastructure.metrics;
