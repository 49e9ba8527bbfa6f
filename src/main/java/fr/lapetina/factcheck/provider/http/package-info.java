/**
 * HTTP adapters for OpenAI, Anthropic and Brave, built on {@code java.net.http.HttpClient}
 * and Jackson.
 */
package fr.lapetina.factcheck.provider.http;
