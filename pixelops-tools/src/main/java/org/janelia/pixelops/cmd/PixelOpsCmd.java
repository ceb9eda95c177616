package org.janelia.pixelops.cmd;

import java.util.Arrays;
import java.util.List;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;

import org.apache.commons.lang3.StringUtils;
import org.janelia.pixelops.errors.ImageProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point.
 */
public class PixelOpsCmd {

    private static final Logger LOG = LoggerFactory.getLogger(PixelOpsCmd.class);

    public static void main(String[] argv) {
        System.exit(run(argv));
    }

    static int run(String[] argv) {
        CommonArgs commonArgs = new CommonArgs();
        List<AbstractCmd> cmds = Arrays.asList(
                new ProcessImageCmd("process", commonArgs),
                new BatchProcessCmd("batch", commonArgs),
                new VariantsCmd("variants", commonArgs),
                new HistogramCmd("histogram", commonArgs)
        );
        JCommander.Builder cmdlineBuilder = JCommander.newBuilder()
                .programName("pixelops")
                .addObject(commonArgs);
        cmds.forEach(cmd -> cmdlineBuilder.addCommand(cmd.getCommandName(), cmd.getArgs()));
        JCommander cmdline = cmdlineBuilder.build();

        try {
            cmdline.parse(argv);
        } catch (ParameterException e) {
            StringBuilder sb = new StringBuilder(e.getMessage()).append('\n');
            if (e.getJCommander() != null) {
                e.getJCommander().getUsageFormatter().usage(sb);
            } else {
                cmdline.getUsageFormatter().usage(sb);
            }
            cmdline.getConsole().println(sb.toString());
            return 1;
        }
        String parsedCommand = cmdline.getParsedCommand();
        if (commonArgs.displayHelpMessage || StringUtils.isBlank(parsedCommand)) {
            if (StringUtils.isBlank(parsedCommand)) {
                cmdline.usage();
            } else {
                cmdline.getUsageFormatter().usage(parsedCommand);
            }
            return commonArgs.displayHelpMessage ? 0 : 1;
        }
        AbstractCmd cmd = cmds.stream()
                .filter(c -> c.matches(parsedCommand))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No command found for " + parsedCommand));
        List<String> validationErrors = cmd.getArgs().validate();
        if (!validationErrors.isEmpty()) {
            validationErrors.forEach(err -> LOG.error("Invalid {} argument: {}", parsedCommand, err));
            return 1;
        }
        try {
            cmd.execute();
            return 0;
        } catch (ImageProcessingException e) {
            LOG.error("{} failed for {}: {}", parsedCommand, e.getOperation(), e.getMessage());
            return 2;
        }
    }
}
