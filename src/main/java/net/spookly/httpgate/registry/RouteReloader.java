package net.spookly.httpgate.registry;

/**
 * Rebuilds and publishes the static route table, returning the new table version.
 */
@FunctionalInterface
public interface RouteReloader {
    long reload();
}
