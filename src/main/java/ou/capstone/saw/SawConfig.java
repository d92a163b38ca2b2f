package ou.capstone.saw;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration for a SAW ranking run.
 * Holds the name of the field the final score is written to and the number
 * of decimal places normalized values are rounded to.
 */
public final class SawConfig {
    private static final Logger logger = LoggerFactory.getLogger(SawConfig.class);

    public static final String DEFAULT_OUTPUT_FIELD = "final_result";
    public static final int DEFAULT_SCALE = 3;

    static final String RESOURCE_NAME = "saw.properties";
    static final String KEY_OUTPUT_FIELD = "saw.output-field";
    static final String KEY_SCALE = "saw.scale";

    private final String outputField;
    private final int scale;

    /**
     * Creates a SawConfig with default settings.
     * Default: output field "final_result", 3 decimal places.
     */
    public SawConfig() {
        this(DEFAULT_OUTPUT_FIELD, DEFAULT_SCALE);
    }

    /**
     * Creates a SawConfig with specified settings.
     *
     * @param outputField field name the score is stored under (blank falls back to the default)
     * @param scale decimal places for normalized values (negative falls back to the default)
     */
    public SawConfig(final String outputField, final int scale) {
        this.outputField = StringUtils.isBlank(outputField) ? DEFAULT_OUTPUT_FIELD : outputField.trim();
        this.scale = scale >= 0 ? scale : DEFAULT_SCALE;
    }

    public String getOutputField() {
        return outputField;
    }

    public int getScale() {
        return scale;
    }

    /**
     * Reads settings from properties.
     * Expected keys:
     *   saw.output-field : name of the score field (default: final_result)
     *   saw.scale : decimal places for normalization (default: 3)
     *
     * @param props properties to read, may be null
     * @return SawConfig based on the properties
     */
    public static SawConfig fromProperties(final Properties props) {
        if (props == null) {
            return new SawConfig();
        }
        final String field = props.getProperty(KEY_OUTPUT_FIELD, DEFAULT_OUTPUT_FIELD);
        int scale = DEFAULT_SCALE;
        final String rawScale = props.getProperty(KEY_SCALE);
        if (StringUtils.isNotBlank(rawScale)) {
            try {
                scale = Integer.parseInt(rawScale.trim());
            } catch (final NumberFormatException e) {
                logger.warn("Invalid {} '{}', using {}", KEY_SCALE, rawScale, DEFAULT_SCALE);
            }
        }
        return new SawConfig(field, scale);
    }

    /**
     * Loads {@code saw.properties} from the classpath, or the defaults when the
     * resource is absent.
     *
     * @throws IllegalStateException if the resource exists but cannot be read
     */
    public static SawConfig load() {
        try (InputStream in = SawConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in == null) {
                logger.debug("No {} on classpath, using defaults", RESOURCE_NAME);
                return new SawConfig();
            }
            final Properties props = new Properties();
            props.load(in);
            return fromProperties(props);
        } catch (final IOException e) {
            throw new IllegalStateException("Failed to read " + RESOURCE_NAME, e);
        }
    }

    @Override
    public String toString() {
        return "SawConfig{outputField='" + outputField + "', scale=" + scale + "}";
    }
}
