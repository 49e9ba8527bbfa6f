/**
 * HTTP API of the standalone service, built on the JDK {@code com.sun.net.httpserver} server.
 */
package fr.lapetina.factcheck.api;
