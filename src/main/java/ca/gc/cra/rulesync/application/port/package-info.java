/**
 * Ports between the use cases and their adapters.
 * <p><strong>Role:</strong> Interfaces only, plus the response carrier returned by the transport.</p>
 */
package ca.gc.cra.rulesync.application.port;
