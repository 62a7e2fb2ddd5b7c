/** Named thread factories and bounded pools. */
package ca.gc.cra.rulesync.infrastructure.exec;
