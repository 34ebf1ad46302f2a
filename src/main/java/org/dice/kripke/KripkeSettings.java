package org.dice.kripke;

import org.apache.commons.lang.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Limits applied while parsing and evaluating formulas. Missing or invalid values
 * fall back to the defaults.
 */
public final class KripkeSettings {

    private static final Logger log = LoggerFactory.getLogger( KripkeSettings.class );

    public static final int DEFAULT_MAX_PARSE_DEPTH = 256;
    public static final int DEFAULT_MAX_EVALUATION_DEPTH = 256;

    private static final KripkeSettings DEFAULTS =
            new KripkeSettings(DEFAULT_MAX_PARSE_DEPTH, DEFAULT_MAX_EVALUATION_DEPTH);

    private final int maxParseDepth;
    private final int maxEvaluationDepth;

    public KripkeSettings(int maxParseDepth, int maxEvaluationDepth) {
        if(maxParseDepth < 1 || maxEvaluationDepth < 1){
            throw new IllegalArgumentException(String.format(
                    "Depth limits must be positive, got %d and %d", maxParseDepth, maxEvaluationDepth));
        }
        this.maxParseDepth = maxParseDepth;
        this.maxEvaluationDepth = maxEvaluationDepth;
    }

    public static KripkeSettings defaults() {
        return DEFAULTS;
    }

    /**
     * The settings from {@value KripkeParams#RESOURCE}, read on first use. Parsers and
     * evaluators built without explicit settings use these.
     */
    public static KripkeSettings configured() {
        return Configured.INSTANCE;
    }

    private static final class Configured {
        private static final KripkeSettings INSTANCE = load();
    }

    /**
     * Reads {@value KripkeParams#RESOURCE} from the classpath, or returns the defaults
     * when it is absent or unreadable.
     */
    public static KripkeSettings load() {
        InputStream stream = KripkeSettings.class.getClassLoader().getResourceAsStream(KripkeParams.RESOURCE);
        if(stream == null){
            log.debug("No {} on the classpath, using defaults", KripkeParams.RESOURCE);
            return DEFAULTS;
        }
        Properties properties = new Properties();
        try {
            properties.load(stream);
        } catch (IOException e) {
            log.warn(String.format("Failed to read %s, using defaults", KripkeParams.RESOURCE), e);
            return DEFAULTS;
        } finally {
            try {
                stream.close();
            } catch (IOException e) {
                log.warn("Failed to close {}", KripkeParams.RESOURCE, e);
            }
        }
        return fromProperties(properties);
    }

    public static KripkeSettings fromProperties(Properties properties) {
        return new KripkeSettings(
                readDepth(properties, KripkeParams.MAX_PARSE_DEPTH, DEFAULT_MAX_PARSE_DEPTH),
                readDepth(properties, KripkeParams.MAX_EVALUATION_DEPTH, DEFAULT_MAX_EVALUATION_DEPTH));
    }

    private static int readDepth(Properties properties, String key, int defaultValue) {
        String value = properties.getProperty(key);
        if(StringUtils.isBlank(value)){
            return defaultValue;
        }
        int depth;
        try {
            depth = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.error(String.format("Invalid value for %s: %s. Defaulting to %d", key, value, defaultValue));
            return defaultValue;
        }
        if(depth < 1){
            log.error(String.format("%s must be positive, got %d. Defaulting to %d", key, depth, defaultValue));
            return defaultValue;
        }
        return depth;
    }

    public int getMaxParseDepth() {
        return maxParseDepth;
    }

    public int getMaxEvaluationDepth() {
        return maxEvaluationDepth;
    }

    @Override
    public String toString() {
        return String.format("KripkeSettings(maxParseDepth=%d, maxEvaluationDepth=%d)", maxParseDepth, maxEvaluationDepth);
    }
}
