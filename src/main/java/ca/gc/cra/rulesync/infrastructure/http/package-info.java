/**
 * {@code SourceTransport} backed by the JDK {@link java.net.http.HttpClient}.
 */
package ca.gc.cra.rulesync.infrastructure.http;
