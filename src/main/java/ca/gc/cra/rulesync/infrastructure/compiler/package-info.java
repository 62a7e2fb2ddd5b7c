/** Runs the external ruleset compiler as a child process. */
package ca.gc.cra.rulesync.infrastructure.compiler;
