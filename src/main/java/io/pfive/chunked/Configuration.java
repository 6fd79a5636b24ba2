// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked;

import java.io.FileReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import static com.google.common.base.Preconditions.checkArgument;

/// Global configuration, loaded once when the class is initialized.
/// Configuration options are readily available everywhere. A conf/conf.properties file in the
/// working directory takes precedence, otherwise the defaults bundled on the classpath are used
/// (which is what happens in tests).
public abstract class Configuration {
    public static Properties properties = new Properties();
    public static final int WORKER_THREADS;
    public static final int MAX_DELIVERIES;
    public static final String STORE_PATH;
    public static final String TEMP_PATH;
    public static final String RESULTS_PATH;
    public static final double FRAME_DURATION_SEC;
    public static final int FRAME_FILL_RGB;

    private static final Path LOCAL_FILE = Path.of("conf/conf.properties");
    private static final String CLASSPATH_RESOURCE = "/conf.properties";

    static {
        try {
            load();
            WORKER_THREADS = intVal("worker-threads");
            MAX_DELIVERIES = intVal("max-deliveries");
            STORE_PATH = stringVal("store-path");
            TEMP_PATH = stringVal("temp-path");
            RESULTS_PATH = stringVal("results-path");
            FRAME_DURATION_SEC = doubleVal("frame-duration-sec");
            FRAME_FILL_RGB = rgbVal("frame-fill-color");
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
    }

    private static void load () throws IOException {
        if (Files.exists(LOCAL_FILE)) {
            try (Reader reader = new FileReader(LOCAL_FILE.toFile())) {
                properties.load(reader);
            }
            return;
        }
        try (InputStream in = Configuration.class.getResourceAsStream(CLASSPATH_RESOURCE)) {
            if (in == null) throw new IOException("No configuration file or classpath resource found.");
            properties.load(in);
        }
    }

    /// Product names are built from a per-platform prefix and the area identifier.
    public static String productPrefix (String platform) {
        return stringVal("product-prefix." + platform);
    }

    public static boolean hasProductPrefix (String platform) {
        return properties.getProperty("product-prefix." + platform) != null;
    }

    private static String stringVal(String key) {
        String val = properties.getProperty(key);
        if (val == null) throw new RuntimeException("Missing configuration key: " + key);
        return val.trim();
    }

    /// A hexadecimal RGB color such as C0C0C0, with or without a leading #.
    private static int rgbVal(String key) {
        String val = stringVal(key);
        String hex = val.startsWith("#") ? val.substring(1) : val;
        try {
            checkArgument(hex.length() == 6);
            return Integer.parseInt(hex, 16);
        } catch (IllegalArgumentException e) {
            var message = String.format("Cannot parse value '%s' for configuration key '%s' as RGB color.", val, key);
            throw new RuntimeException(message, e);
        }
    }

    private static int intVal(String key) {
        String val = stringVal(key);
        try {
            return Integer.parseInt(val);
        } catch (NumberFormatException e) {
            var message = String.format("Cannot parse value '%s' for configuration key '%s' as integer.", val, key);
            throw new RuntimeException(message, e);
        }
    }

    private static double doubleVal(String key) {
        String val = stringVal(key);
        try {
            return Double.parseDouble(val);
        } catch (NumberFormatException e) {
            var message = String.format("Cannot parse value '%s' for configuration key '%s' as a number.", val, key);
            throw new RuntimeException(message, e);
        }
    }

}
