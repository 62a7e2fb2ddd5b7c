/** Canonical JSON ruleset writer. */
package ca.gc.cra.rulesync.infrastructure.output;
