package fr.lapetina.kvrouter.domain.model;

/**
 * Routing health of an inference server.
 *
 * UP: eligible as a candidate
 * DOWN: failed its health probes, out of rotation until one succeeds
 */
public enum ServerHealth {
    UP,
    DOWN
}
