package com.scanvision.app;

import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.util.List;
import java.util.Map;


public record Config(DecodeConf decode, ScanConf scan) {
    public record DecodeConf(boolean autoRotate, boolean tryInverted, boolean tryHarder, boolean pureBarcode,
                             String characterSet, List<String> possibleFormats, String binarizer) {}
    public record ScanConf(List<String> patterns, boolean multiple) {}

    public static Config load() {
        return load("/application.yaml");
    }

    @SuppressWarnings("unchecked")
    public static Config load(String resource) {
        try(InputStream in = Config.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException(resource + " not found on classpath");
            }
            Yaml yaml = new Yaml();
            Map<String, Object> root = yaml.load(in);
            if (root == null) root = Map.of();

            Map<String, Object> dec  = (Map<String, Object>) root.getOrDefault("decode", Map.of());
            Map<String, Object> scan = (Map<String, Object>) root.getOrDefault("scan", Map.of());

            // -Dsv.decode.<key> приоритетнее YAML
            boolean autoRotate  = flag(dec, "autoRotate", true);
            boolean tryInverted = flag(dec, "tryInverted", false);
            boolean tryHarder   = flag(dec, "tryHarder", false);
            boolean pureBarcode = flag(dec, "pureBarcode", false);
            String charset   = System.getProperty("sv.decode.characterSet", (String) dec.get("characterSet"));
            String binarizer = System.getProperty("sv.decode.binarizer", (String) dec.getOrDefault("binarizer", "hybrid"));

            List<String> formats;
            String formatsProp = System.getProperty("sv.decode.possibleFormats");
            if (formatsProp != null && !formatsProp.isBlank()) {
                formats = List.of(formatsProp.split("\\s*,\\s*"));
            } else {
                formats = dec.get("possibleFormats") != null ? List.copyOf((List<String>) dec.get("possibleFormats")) : List.of();
            }

            List<String> patterns = scan.get("patterns") != null ? List.copyOf((List<String>) scan.get("patterns")) : List.of();
            boolean multiple = scan.get("multiple") != null && (Boolean) scan.get("multiple");

            return new Config(
                    new DecodeConf(autoRotate, tryInverted, tryHarder, pureBarcode, charset, formats, binarizer),
                    new ScanConf(patterns, multiple)
            );
        } catch (Exception e) {
            throw new RuntimeException("Failed to load " + resource, e);
        }
    }

    private static boolean flag(Map<String, Object> section, String key, boolean def) {
        String override = System.getProperty("sv.decode." + key);
        if (override != null && !override.isBlank()) {
            return Boolean.parseBoolean(override.trim());
        }
        Object v = section.get(key);
        return v != null ? (Boolean) v : def;
    }
}
