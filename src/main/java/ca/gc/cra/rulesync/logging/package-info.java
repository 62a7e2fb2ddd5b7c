/**
 * Logback level control and log-safe formatting helpers.
 */
package ca.gc.cra.rulesync.logging;
