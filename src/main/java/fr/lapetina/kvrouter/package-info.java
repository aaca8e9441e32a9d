/**
 * KV-cache-aware request router for LLM inference servers.
 *
 * <p>Given a request and the servers that can serve its model, the router picks the server
 * most likely to hold the prompt's KV cache:
 * <ul>
 *   <li>{@code kvaware} asks an external cache-index controller which instance holds the
 *       longest cached prefix;</li>
 *   <li>{@code prefixmatch} keeps a local trie of hashed prompt chunks per server.</li>
 * </ul>
 *
 * <p>{@link fr.lapetina.kvrouter.RouterFactory} wires the components from YAML;
 * {@link fr.lapetina.kvrouter.KvRouterApplication} adds the HTTP surface.
 */
package fr.lapetina.kvrouter;
