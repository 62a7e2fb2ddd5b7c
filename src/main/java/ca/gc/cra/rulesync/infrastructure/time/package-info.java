/** Wall-clock adapter. */
package ca.gc.cra.rulesync.infrastructure.time;
