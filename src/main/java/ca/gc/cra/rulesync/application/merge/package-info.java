/**
 * The merge engine: classification, fragment and line-list parsing, accumulation, denylist filtering.
 * <p>Parsers write into a {@link ca.gc.cra.rulesync.application.merge.RuleAccumulator} owned by a single merge
 * invocation.</p>
 */
package ca.gc.cra.rulesync.application.merge;
