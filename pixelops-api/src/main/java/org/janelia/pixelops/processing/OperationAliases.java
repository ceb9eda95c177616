package org.janelia.pixelops.processing;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableMap;

import org.apache.commons.lang3.StringUtils;
import org.janelia.pixelops.params.ParamsReader;
import org.janelia.pixelops.params.ProcessingParams;

/**
 * Flat operation names that resolve to a catalogue operation with pinned parameters. A pinned value
 * replaces whatever the caller passed for the same parameter.
 */
public class OperationAliases {

    static class OperationAlias {
        final ProcessingOperation operation;
        final Function<ProcessingParams, ProcessingParams> paramsMapper;

        OperationAlias(ProcessingOperation operation, Function<ProcessingParams, ProcessingParams> paramsMapper) {
            this.operation = operation;
            this.paramsMapper = paramsMapper;
        }

        static OperationAlias withPinned(ProcessingOperation operation, ProcessingParams pinned) {
            return new OperationAlias(operation, params -> params.withPinned(pinned));
        }
    }

    private static final Map<String, OperationAlias> ALIASES = ImmutableMap.<String, OperationAlias>builder()
            .put("log_contrast", OperationAlias.withPinned(ProcessingOperation.CONTRAST,
                    new ProcessingParams().setParam("mode", "logarithmic")))
            .put("exp_contrast", new OperationAlias(ProcessingOperation.CONTRAST,
                    params -> params.renameParam("k", "gamma")
                            .withPinned(new ProcessingParams().setParam("mode", "exponential"))))
            .put("invert", OperationAlias.withPinned(ProcessingOperation.NEGATIVE, new ProcessingParams()))
            .put("grayscale_average", OperationAlias.withPinned(ProcessingOperation.GRAYSCALE,
                    new ProcessingParams().setParam("method", "average")))
            .put("grayscale_luminosity", OperationAlias.withPinned(ProcessingOperation.GRAYSCALE,
                    new ProcessingParams().setParam("method", "luminosity")))
            .put("grayscale_midgray", OperationAlias.withPinned(ProcessingOperation.GRAYSCALE,
                    new ProcessingParams().setParam("method", "lightness")))
            .put("merge_images", new OperationAlias(ProcessingOperation.MERGE, OperationAliases::transparencyToAlpha))
            .put("channel_red", rgbChannelAlias("channel_red", "red"))
            .put("channel_green", rgbChannelAlias("channel_green", "green"))
            .put("channel_blue", rgbChannelAlias("channel_blue", "blue"))
            .put("channel_cyan", cmyExtractAlias("cyan"))
            .put("channel_magenta", cmyExtractAlias("magenta"))
            .put("channel_yellow", cmyExtractAlias("yellow"))
            .put("reduce_resolution", OperationAlias.withPinned(ProcessingOperation.REDUCE_RESOLUTION, new ProcessingParams()))
            .put("enlarge_region", OperationAlias.withPinned(ProcessingOperation.ENLARGE_REGION, new ProcessingParams()))
            .build();

    public static Set<String> getAliasNames() {
        return Collections.unmodifiableSet(ALIASES.keySet());
    }

    @Nullable
    static OperationAlias lookup(String name) {
        return ALIASES.get(StringUtils.lowerCase(StringUtils.trim(name)));
    }

    /**
     * The merge transparency is the weight of the other image.
     */
    private static ProcessingParams transparencyToAlpha(ProcessingParams params) {
        if (!params.hasParam("transparency")) {
            return params;
        }
        double transparency = new ParamsReader("merge_images", params).getDoubleInRange("transparency", null, 0, 1);
        return params.withoutParam("transparency")
                .withPinned(new ProcessingParams().setParam("alpha", 1 - transparency));
    }

    /**
     * Keep only the given channel or, if enabled is false, zero it and keep the others.
     */
    private static OperationAlias rgbChannelAlias(String aliasName, String channelName) {
        return new OperationAlias(ProcessingOperation.CHANNEL, params -> {
            boolean enabled = new ParamsReader(aliasName, params).getBoolean("enabled", true);
            List<String> keep;
            if (enabled) {
                keep = Collections.singletonList(channelName);
            } else {
                keep = new ArrayList<>(Arrays.asList("red", "green", "blue"));
                keep.remove(channelName);
            }
            return params.withoutParam("enabled")
                    .withPinned(new ProcessingParams()
                            .setParam("model", "rgb")
                            .setParam("keep", keep));
        });
    }

    private static OperationAlias cmyExtractAlias(String channelName) {
        return OperationAlias.withPinned(ProcessingOperation.CHANNEL, new ProcessingParams()
                .setParam("model", "cmy")
                .setParam("keep", Collections.singletonList(channelName))
                .setParam("extract", true));
    }
}
