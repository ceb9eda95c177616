package org.janelia.pixelops.params;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public class ChannelParams implements OperationParams {
    private final ColorModel model;
    private final boolean[] keptChannels;
    private final int[] order;
    private final ColorModel outputModel;
    private final boolean extract;

    /**
     * @param model color model in which the channels are selected and permuted
     * @param keptChannels flags for the model channels that are kept; the others are zeroed
     * @param order output channel i takes the model channel order[i]
     * @param outputModel color model of the result
     * @param extract if true the result is the single kept channel as a gray image
     */
    public ChannelParams(ColorModel model, boolean[] keptChannels, int[] order, ColorModel outputModel, boolean extract) {
        this.model = model;
        this.keptChannels = keptChannels.clone();
        this.order = order.clone();
        this.outputModel = outputModel;
        this.extract = extract;
    }

    public ColorModel getModel() {
        return model;
    }

    public boolean isKept(int channel) {
        return keptChannels[channel];
    }

    public int getSourceChannel(int targetChannel) {
        return order[targetChannel];
    }

    public ColorModel getOutputModel() {
        return outputModel;
    }

    public boolean isExtract() {
        return extract;
    }

    /**
     * @return the first kept channel of the model
     */
    public int getFirstKeptChannel() {
        for (int c = 0; c < keptChannels.length; c++) {
            if (keptChannels[c]) {
                return c;
            }
        }
        return -1;
    }

    @Override
    public Map<String, Object> asResolvedMap() {
        List<String> channelNames = model.getChannelNames();
        Map<String, Object> resolved = new LinkedHashMap<>();
        resolved.put("model", model.name().toLowerCase());
        resolved.put("keep", channelNames.stream()
                .filter(n -> keptChannels[channelNames.indexOf(n)])
                .collect(Collectors.toList()));
        resolved.put("order", Arrays.stream(order).mapToObj(channelNames::get).collect(Collectors.toList()));
        resolved.put("output_model", outputModel.name().toLowerCase());
        resolved.put("extract", extract);
        return resolved;
    }
}
