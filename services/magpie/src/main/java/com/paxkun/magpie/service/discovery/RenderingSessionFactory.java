package com.paxkun.magpie.service.discovery;

/**
 * Opens a fresh rendering session; each run owns exactly one.
 */
@FunctionalInterface
public interface RenderingSessionFactory {

    RenderingSession open();
}
