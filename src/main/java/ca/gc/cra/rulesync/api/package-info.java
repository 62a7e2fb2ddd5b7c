/**
 * Command-line entry points for the {@code sync} and {@code cache} commands.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses arguments, merges configuration, configures
 * logging and telemetry, and invokes the sync use case.</p>
 * <p><strong>Output:</strong> Reports go to stdout through {@link ca.gc.cra.rulesync.api.CliPrinter}; diagnostics
 * go through SLF4J.</p>
 */
package ca.gc.cra.rulesync.api;
