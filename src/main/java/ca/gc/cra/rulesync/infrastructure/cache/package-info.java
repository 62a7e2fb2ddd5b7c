/**
 * File-system cache keyed by the MD5 of the source URL.
 * <p><strong>Concurrency:</strong> Writes go through a temp file and an atomic rename.</p>
 */
package ca.gc.cra.rulesync.infrastructure.cache;
