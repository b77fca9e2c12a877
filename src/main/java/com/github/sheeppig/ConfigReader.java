package com.github.sheeppig;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;

public class ConfigReader {

    public static final String CONFIG_FILE = "sheeppig.cfg";

    public static Config readConfig() {
        return readConfig(Path.of(CONFIG_FILE));
    }

    /**
     * Reads the given properties file. A missing file gives the defaults.
     */
    public static Config readConfig(Path file) {
        try (var in = new FileInputStream(file.toFile())) {
            return readConfig(in);
        } catch (FileNotFoundException e) {
            return new Config();
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read " + file, e);
        }
    }

    public static Config readConfig(InputStream in) throws IOException {
        var config = new Config();
        Properties properties = new Properties();
        properties.load(in);

        var lookupPath = properties.getProperty("lookupPath");
        if (lookupPath != null && !lookupPath.isBlank()) {
            config.lookupPath.clear();
            Arrays.stream(lookupPath.split(","))
                .map(String::trim)
                .filter(entry -> !entry.isEmpty())
                .forEach(config.lookupPath::add);
        }
        config.sourceExtension = properties.getProperty("sourceExtension", config.sourceExtension).trim();
        return config;
    }

    public static class Config {
        List<String> lookupPath = new ArrayList<>(List.of("."));
        String sourceExtension = LookupPathResolver.DEFAULT_EXTENSION;

        public List<String> lookupPath() {
            return List.copyOf(lookupPath);
        }

        public String sourceExtension() {
            return sourceExtension;
        }

        public void applyConfig(ConfigTarget ct) {
            ct.setLookupPath(lookupPath());
            ct.setSourceExtension(sourceExtension);
        }
    }

    public interface ConfigTarget {
        void setLookupPath(List<String> lookupPath);

        void setSourceExtension(String sourceExtension);
    }

}
