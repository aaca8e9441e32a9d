/**
 * YAML configuration loading.
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code server} - HTTP server settings (port, backlog, threads)</li>
 *   <li>{@code servers} - static pool of inference servers (name, url, address, models)</li>
 *   <li>{@code picker} - active picker and its kvAware / prefix tuning</li>
 *   <li>{@code disruptor} - ring buffer and wait strategy settings</li>
 *   <li>{@code validation} - prompt length and model whitelist</li>
 *   <li>{@code metrics} - Prometheus metric name prefix</li>
 * </ul>
 *
 * <p>Reloads are explicit ({@code POST /admin/reload}); listeners registered on the
 * {@link fr.lapetina.kvrouter.infrastructure.config.ConfigLoader} receive old and new configuration.
 */
package fr.lapetina.kvrouter.infrastructure.config;
