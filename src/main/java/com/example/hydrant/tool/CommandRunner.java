package com.example.hydrant.tool;

import java.time.Duration;
import java.util.List;

public interface CommandRunner {

    /**
     * Runs the command and waits for it, capturing stdout and stderr.
     *
     * @return the result, including non-zero exits
     * @throws ExternalToolException when the binary cannot be started or the timeout elapses
     */
    CommandResult run(List<String> command, Duration timeout);
}
