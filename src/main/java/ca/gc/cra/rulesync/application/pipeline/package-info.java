/**
 * Per-ruleset sync flow and the run summary.
 */
package ca.gc.cra.rulesync.application.pipeline;
