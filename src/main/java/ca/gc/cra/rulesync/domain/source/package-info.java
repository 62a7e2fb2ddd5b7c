/** Source URLs tagged with their payload family. */
package ca.gc.cra.rulesync.domain.source;
