/**
 * JSON request and response bodies of the HTTP API.
 */
package fr.lapetina.factcheck.api.dto;
