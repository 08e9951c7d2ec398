package dev.transput.engine;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.Properties;

/**
 * Conversion constants of the transput engine.
 *
 * <p>{@link #fromProperties(Properties)} reads overrides under the {@code transput.} prefix, e.g.
 * {@code transput.error-char=#} or {@code transput.real-width=17}; keys that are absent keep their default.</p>
 */
public record TransputSettings(
        char errorChar,
        char flipChar,
        char flopChar,
        int intWidth,
        int longIntWidth,
        int realWidth,
        int longRealWidth,
        int expWidth,
        int longExpWidth,
        int bitsWidth,
        int longBitsWidth) {
    public static final String PREFIX = "transput.";

    public TransputSettings {
        requirePositive(intWidth, "intWidth");
        requirePositive(longIntWidth, "longIntWidth");
        requirePositive(realWidth, "realWidth");
        requirePositive(longRealWidth, "longRealWidth");
        requirePositive(expWidth, "expWidth");
        requirePositive(longExpWidth, "longExpWidth");
        requirePositive(bitsWidth, "bitsWidth");
        requirePositive(longBitsWidth, "longBitsWidth");
        if (flipChar == flopChar) {
            throw new IllegalArgumentException("flip and flop characters must differ");
        }
    }

    public static TransputSettings defaults() {
        return new TransputSettings('*', 'T', 'F', 19, 39, 15, 32, 3, 4, 64, 128);
    }

    public static TransputSettings fromProperties(Properties props) {
        Objects.requireNonNull(props, "props");
        TransputSettings d = defaults();
        return new TransputSettings(
                charProp(props, "error-char", d.errorChar),
                charProp(props, "flip-char", d.flipChar),
                charProp(props, "flop-char", d.flopChar),
                intProp(props, "int-width", d.intWidth),
                intProp(props, "long-int-width", d.longIntWidth),
                intProp(props, "real-width", d.realWidth),
                intProp(props, "long-real-width", d.longRealWidth),
                intProp(props, "exp-width", d.expWidth),
                intProp(props, "long-exp-width", d.longExpWidth),
                intProp(props, "bits-width", d.bitsWidth),
                intProp(props, "long-bits-width", d.longBitsWidth));
    }

    /** Loads a properties file from the classpath. */
    public static TransputSettings load(String resource) throws IOException {
        Objects.requireNonNull(resource, "resource");
        ClassLoader loader = TransputSettings.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IOException("settings resource not found: " + resource);
            }
            Properties props = new Properties();
            props.load(in);
            return fromProperties(props);
        }
    }

    int realWidth(boolean isLong) {
        return isLong ? longRealWidth : realWidth;
    }

    int expWidth(boolean isLong) {
        return isLong ? longExpWidth : expWidth;
    }

    int intWidth(boolean isLong) {
        return isLong ? longIntWidth : intWidth;
    }

    int bitsWidth(boolean isLong) {
        return isLong ? longBitsWidth : bitsWidth;
    }

    private static char charProp(Properties props, String key, char fallback) {
        String raw = props.getProperty(PREFIX + key);
        if (raw == null) {
            return fallback;
        }
        if (raw.length() != 1) {
            throw new IllegalArgumentException(PREFIX + key + " must be a single character, got `" + raw + "`");
        }
        return raw.charAt(0);
    }

    private static int intProp(Properties props, String key, int fallback) {
        String raw = props.getProperty(PREFIX + key);
        if (raw == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(PREFIX + key + " is not an integer: `" + raw + "`", e);
        }
    }

    private static void requirePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
    }
}
