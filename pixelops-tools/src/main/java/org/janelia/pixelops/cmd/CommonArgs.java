package org.janelia.pixelops.cmd;

import java.io.Serializable;

import com.beust.jcommander.Parameter;

class CommonArgs implements Serializable {
    @Parameter(names = "--config", description = "Config file that overrides the default processing settings")
    String configFileName;

    @Parameter(names = "--task-concurrency", description = "Number of worker threads. If not set, the number of available processors minus one is used")
    int taskConcurrency = 0;

    @Parameter(names = {"-h", "--help"}, description = "Display the help message", help = true, arity = 0)
    boolean displayHelpMessage = false;
}
