package io.github.jbellis.lazyjira.model;

/**
 * An edge of the server-owned workflow graph, as offered for one issue at request time.
 *
 * @param toStatus name of the destination status
 */
public record Transition(String id, String name, String toStatus) {}
