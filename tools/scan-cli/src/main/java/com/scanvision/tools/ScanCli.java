package com.scanvision.tools;

import com.google.zxing.Result;
import com.scanvision.app.Config;
import com.scanvision.core.decode.BarcodeReader;
import com.scanvision.core.decode.DecodingOptions;
import com.scanvision.core.decode.OrientationMetadata;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Пакетное чтение штрихкодов из файлов.
 *
 * <pre>
 *   --image=path | --dir=path   [--multi=true] [--formats=QR_CODE,CODE_128]
 *   [--autoRotate=true] [--tryInverted=true] [--tryHarder=true]
 * </pre>
 * Остальное берётся из application.yaml.
 */
public final class ScanCli {

    record Summary(int found, int missed, int failed) {}

    public static void main(String[] args) {
        int code;
        try {
            code = run(args, System.out, System.err);
        } catch (IllegalArgumentException e) {
            System.err.println("usage error: " + e.getMessage());
            code = 2;
        }
        System.exit(code);
    }

    /** @return код выхода: 0 — что-то нашли, 1 — ничего */
    static int run(String[] args, PrintStream out, PrintStream err) {
        Map<String, String> a = parseArgs(args);
        Config cfg = Config.load();

        List<Path> files = collect(a, cfg.scan().patterns());
        boolean multi = Boolean.parseBoolean(a.getOrDefault("multi", String.valueOf(cfg.scan().multiple())));
        BarcodeReader reader = buildReader(cfg.decode(), a);

        Summary s = scan(reader, files, multi, out, err);
        out.printf("Done. found=%d missed=%d failed=%d%n", s.found(), s.missed(), s.failed());
        return s.found() > 0 ? 0 : 1;
    }

    static BarcodeReader buildReader(Config.DecodeConf conf, Map<String, String> a) {
        BarcodeReader reader = BarcodeReader.fromConfig(conf);
        if (a.containsKey("autoRotate")) reader.setAutoRotate(flag(a, "autoRotate"));
        if (a.containsKey("tryInverted")) reader.setTryInverted(flag(a, "tryInverted"));
        if (a.containsKey("tryHarder")) reader.options().setTryHarder(flag(a, "tryHarder"));
        if (a.containsKey("formats")) {
            reader.options().setPossibleFormats(DecodingOptions.parseFormats(List.of(a.get("formats").split(","))));
        }
        return reader;
    }

    static Summary scan(BarcodeReader reader, List<Path> files, boolean multi, PrintStream out, PrintStream err) {
        int found = 0, missed = 0, failed = 0;
        for (Path f : files) {
            try {
                BufferedImage img = ImageIO.read(f.toFile());
                if (img == null) {
                    throw new IOException("unsupported image format");
                }
                List<Result> results = multi
                        ? reader.decodeMultiple(img)
                        : reader.decode(img).map(r -> List.of(r)).orElse(List.of());
                if (results.isEmpty()) {
                    out.println("MISS " + f);
                    missed++;
                    continue;
                }
                for (Result r : results) {
                    out.println(formatResult(f, r));
                }
                found++;
            } catch (IOException e) {
                err.println("ERR " + f + " :: " + e.getMessage());
                failed++;
            }
        }
        return new Summary(found, missed, failed);
    }

    static String formatResult(Path file, Result r) {
        return "OK  " + file
                + " :: " + r.getBarcodeFormat()
                + " orientation=" + OrientationMetadata.of(r)
                + " text=" + r.getText();
    }

    static List<Path> collect(Map<String, String> a, List<String> patterns) {
        if (a.containsKey("image")) {
            return List.of(Path.of(req(a, "image")));
        }
        Path root = Path.of(req(a, "dir"));
        var pats = (patterns == null || patterns.isEmpty()) ? List.of("**/*.png", "**/*.jpg") : patterns;
        List<PathMatcher> matchers = new ArrayList<>();
        for (String p : pats) {
            matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + p));
        }
        try (Stream<Path> walk = Files.walk(root)) {
            return walk.filter(Files::isRegularFile)
                    .filter(p -> matchesAny(matchers, p))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new IllegalArgumentException("cannot walk --dir " + root + ": " + e.getMessage(), e);
        }
    }

    private static boolean matchesAny(List<PathMatcher> matchers, Path path) {
        var name = path.getFileName();
        for (var m : matchers) {
            if (m.matches(path) || (name != null && m.matches(name))) {
                return true;
            }
        }
        return false;
    }

    static Map<String, String> parseArgs(String[] args) {
        Map<String, String> m = new HashMap<>();
        for (String s : args) {
            String k = s.replaceFirst("^--", "");
            int i = k.indexOf('=');
            if (i > 0) m.put(k.substring(0, i), k.substring(i + 1));
            else if (!k.isBlank()) m.put(k, "true"); // голый флаг: --tryHarder
        }
        return m;
    }

    static String req(Map<String, String> a, String k) {
        String v = a.get(k);
        if (v == null || v.isBlank()) throw new IllegalArgumentException("missing --" + k);
        return v;
    }

    private static boolean flag(Map<String, String> a, String k) {
        return Boolean.parseBoolean(a.get(k));
    }
}
