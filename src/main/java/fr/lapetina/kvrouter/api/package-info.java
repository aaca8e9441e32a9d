/**
 * HTTP surface of the router on top of the JDK {@code com.sun.net.httpserver} server.
 *
 * <p>{@code POST /v1/route} answers with the chosen server only; forwarding the request to
 * it is up to the caller.
 */
package fr.lapetina.kvrouter.api;
