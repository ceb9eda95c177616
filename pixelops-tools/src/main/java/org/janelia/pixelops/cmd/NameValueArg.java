package org.janelia.pixelops.cmd;

import com.beust.jcommander.IStringConverter;
import com.beust.jcommander.ParameterException;

import org.apache.commons.lang3.StringUtils;

/**
 * Operation parameter given on the command line as name=value.
 */
class NameValueArg {

    static class NameValueArgConverter implements IStringConverter<NameValueArg> {
        @Override
        public NameValueArg convert(String value) {
            int separatorIndex = StringUtils.indexOf(value, '=');
            if (separatorIndex <= 0) {
                throw new ParameterException("Invalid parameter " + value + " - expected name=value");
            }
            return new NameValueArg(
                    StringUtils.trim(value.substring(0, separatorIndex)),
                    parseValue(StringUtils.trim(value.substring(separatorIndex + 1))));
        }

        private Object parseValue(String value) {
            if (StringUtils.equalsAnyIgnoreCase(value, "true", "false")) {
                return Boolean.valueOf(value);
            }
            try {
                return Double.valueOf(value);
            } catch (NumberFormatException e) {
                return value;
            }
        }
    }

    final String name;
    final Object value;

    NameValueArg(String name, Object value) {
        this.name = name;
        this.value = value;
    }

    @Override
    public String toString() {
        return name + "=" + value;
    }
}
