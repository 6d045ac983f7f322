package com.scanvision.core.image;

import com.google.zxing.Binarizer;
import com.google.zxing.LuminanceSource;
import com.google.zxing.common.GlobalHistogramBinarizer;
import com.google.zxing.common.HybridBinarizer;

import java.util.Locale;
import java.util.function.Function;

/** Выбор бинаризатора из конфигурации: hybrid (по умолчанию) или global. */
public enum BinarizerKind implements Function<LuminanceSource, Binarizer> {
    HYBRID {
        @Override
        public Binarizer apply(LuminanceSource source) {
            return new HybridBinarizer(source);
        }
    },
    GLOBAL {
        @Override
        public Binarizer apply(LuminanceSource source) {
            return new GlobalHistogramBinarizer(source);
        }
    };

    public static BinarizerKind parse(String name) {
        if (name == null || name.isBlank()) return HYBRID;
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "hybrid" -> HYBRID;
            case "global", "global-histogram" -> GLOBAL;
            default -> throw new IllegalArgumentException("binarizer must be hybrid|global: " + name);
        };
    }
}
