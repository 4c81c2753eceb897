package io.kairos.cli;

@FunctionalInterface
public interface ServeRunner {
    /**
     * Runs the scheduler and its HTTP API until the process is asked to stop.
     *
     * @param host bind host, or {@code null} for the configured one
     * @param port bind port, or {@code null} for the configured one
     */
    int run(String host, Integer port) throws Exception;
}
