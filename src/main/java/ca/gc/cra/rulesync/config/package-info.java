/**
 * Configuration records, YAML loading, precedence merging and adapter wiring.
 * <p><strong>Precedence:</strong> CLI values override YAML, which overrides mode defaults.</p>
 */
package ca.gc.cra.rulesync.config;
