/** Fetch policy, outcomes and batch statistics. */
package ca.gc.cra.rulesync.domain.fetch;
