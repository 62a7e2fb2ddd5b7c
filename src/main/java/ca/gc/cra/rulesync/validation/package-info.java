/** Argument checks shared by the configuration records. */
package ca.gc.cra.rulesync.validation;
