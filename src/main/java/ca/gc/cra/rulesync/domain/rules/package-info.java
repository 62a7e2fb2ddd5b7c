/**
 * Canonical rule vocabulary and the merged ruleset document.
 * <p>All types are immutable.</p>
 */
package ca.gc.cra.rulesync.domain.rules;
