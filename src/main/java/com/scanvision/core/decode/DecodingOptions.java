package com.scanvision.core.decode;

import com.google.zxing.BarcodeFormat;
import com.google.zxing.DecodeHintType;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Набор опций декодирования поверх карты хинтов ZXing.
 *
 * Каждый публичный сеттер завершается явным шагом {@link #changed()}: подписчики изменений
 * вызываются синхронно, даже если значение не поменялось. {@link BarcodeReader} подписывается,
 * чтобы сбрасывать кэшированное состояние движка.
 *
 * Не потокобезопасен, как и сам ридер.
 */
public final class DecodingOptions {

    /**
     * Значение хинта {@link DecodeHintType#OTHER}: поворотами занимается вызывающая сторона,
     * движку не нужно искать повёрнутый символ самому. Штатные ридеры ZXing его игнорируют.
     */
    public static final Object SUPPRESS_ROTATION_SEARCH = new Object() {
        @Override
        public String toString() {
            return "SUPPRESS_ROTATION_SEARCH";
        }
    };

    private final Map<DecodeHintType, Object> hints = new EnumMap<>(DecodeHintType.class);
    private final Map<DecodeHintType, Object> hintsView = Collections.unmodifiableMap(hints);
    private final List<Runnable> changeListeners = new CopyOnWriteArrayList<>();

    /** Хинты в том виде, в каком их получает движок. Только для чтения. */
    public Map<DecodeHintType, Object> hints() {
        return hintsView;
    }

    public boolean isTryHarder() {
        return hints.containsKey(DecodeHintType.TRY_HARDER);
    }

    public void setTryHarder(boolean tryHarder) {
        flag(DecodeHintType.TRY_HARDER, tryHarder);
        changed();
    }

    public boolean isPureBarcode() {
        return hints.containsKey(DecodeHintType.PURE_BARCODE);
    }

    public void setPureBarcode(boolean pureBarcode) {
        flag(DecodeHintType.PURE_BARCODE, pureBarcode);
        changed();
    }

    public String getCharacterSet() {
        return (String) hints.get(DecodeHintType.CHARACTER_SET);
    }

    /** null или пустая строка снимают хинт. */
    public void setCharacterSet(String characterSet) {
        if (characterSet == null || characterSet.isBlank()) {
            hints.remove(DecodeHintType.CHARACTER_SET);
        } else {
            hints.put(DecodeHintType.CHARACTER_SET, characterSet.trim());
        }
        changed();
    }

    /** Пустой набор означает «все форматы». */
    @SuppressWarnings("unchecked")
    public Set<BarcodeFormat> getPossibleFormats() {
        Object v = hints.get(DecodeHintType.POSSIBLE_FORMATS);
        return v == null ? Set.of() : Collections.unmodifiableSet((Set<BarcodeFormat>) v);
    }

    /** null или пустая коллекция снимают ограничение. */
    public void setPossibleFormats(Collection<BarcodeFormat> formats) {
        if (formats == null || formats.isEmpty()) {
            hints.remove(DecodeHintType.POSSIBLE_FORMATS);
        } else {
            hints.put(DecodeHintType.POSSIBLE_FORMATS, EnumSet.copyOf(formats));
        }
        changed();
    }

    public void setPossibleFormats(BarcodeFormat... formats) {
        setPossibleFormats(formats == null ? null : List.of(formats));
    }

    public boolean isAssumeGs1() {
        return hints.containsKey(DecodeHintType.ASSUME_GS1);
    }

    public void setAssumeGs1(boolean assumeGs1) {
        flag(DecodeHintType.ASSUME_GS1, assumeGs1);
        changed();
    }

    public boolean isReturnCodabarStartEnd() {
        return hints.containsKey(DecodeHintType.RETURN_CODABAR_START_END);
    }

    public void setReturnCodabarStartEnd(boolean returnStartEnd) {
        flag(DecodeHintType.RETURN_CODABAR_START_END, returnStartEnd);
        changed();
    }

    public boolean isAssumeCode39CheckDigit() {
        return hints.containsKey(DecodeHintType.ASSUME_CODE_39_CHECK_DIGIT);
    }

    public void setAssumeCode39CheckDigit(boolean assumeCheckDigit) {
        flag(DecodeHintType.ASSUME_CODE_39_CHECK_DIGIT, assumeCheckDigit);
        changed();
    }

    /** Имена форматов из конфигурации/CLI ("qr_code", "CODE_128") → набор; пустые имена пропускаются. */
    public static Set<BarcodeFormat> parseFormats(Collection<String> names) {
        Set<BarcodeFormat> out = EnumSet.noneOf(BarcodeFormat.class);
        if (names == null) return out;
        for (String name : names) {
            if (name == null || name.isBlank()) continue;
            try {
                out.add(BarcodeFormat.valueOf(name.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("unknown barcode format: " + name, e);
            }
        }
        return out;
    }

    public void addChangeListener(Runnable listener) {
        changeListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeChangeListener(Runnable listener) {
        changeListeners.remove(listener);
    }

    // ---- служебные хинты ридера ----

    /** Ставит хинт; подписчики уведомляются только при реальном изменении карты. */
    boolean putHint(DecodeHintType type, Object value) {
        Objects.requireNonNull(value, "value");
        Object prev = hints.put(type, value);
        if (prev == value) {
            return false;
        }
        changed();
        return true;
    }

    /** Снимает хинт; подписчики уведомляются только если хинт был. */
    boolean removeHint(DecodeHintType type) {
        if (!hints.containsKey(type)) {
            return false;
        }
        hints.remove(type);
        changed();
        return true;
    }

    private void flag(DecodeHintType type, boolean on) {
        if (on) {
            hints.put(type, Boolean.TRUE);
        } else {
            hints.remove(type);
        }
    }

    /** Шаг инвалидации: синхронно оповещает всех подписчиков. */
    private void changed() {
        for (Runnable l : changeListeners) {
            l.run();
        }
    }
}
