/**
 * Pickers: the routing decision for one request among scored candidate servers.
 *
 * <h2>Available Pickers</h2>
 * <table border="1">
 *   <tr><th>Picker</th><th>Decision</th><th>Fallback</th></tr>
 *   <tr><td>{@code kvaware}</td><td>Server the cache-index controller reports as holding the prompt's prefix</td><td>Round-robin over sorted candidates</td></tr>
 *   <tr><td>{@code prefixmatch}</td><td>Server recorded in the local chunk-hash trie for the longest matching prefix</td><td>Uniform random</td></tr>
 *   <tr><td>{@code roundrobin}</td><td>Round-robin over sorted candidates</td><td>-</td></tr>
 *   <tr><td>{@code random}</td><td>Uniform random</td><td>-</td></tr>
 * </table>
 *
 * <p>Every picker returns a server whenever the candidate list is non-empty, and reports its
 * decision path to a {@link fr.lapetina.kvrouter.domain.picker.PickObserver}.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * Picker picker = new PrefixMatchPicker();
 * Optional<CandidateServer> target = picker.pick(RoutingRequest.ofPrompt("llama3", prompt), candidates);
 * }</pre>
 *
 * @see fr.lapetina.kvrouter.domain.picker.Picker
 * @see fr.lapetina.kvrouter.domain.picker.PickerFactory
 */
package fr.lapetina.kvrouter.domain.picker;
