package com.scanvision.core.decode;

import com.google.zxing.Binarizer;
import com.google.zxing.BinaryBitmap;
import com.google.zxing.DecodeHintType;
import com.google.zxing.LuminanceSource;
import com.google.zxing.MultiFormatReader;
import com.google.zxing.NotFoundException;
import com.google.zxing.Reader;
import com.google.zxing.ReaderException;
import com.google.zxing.Result;
import com.google.zxing.ResultPoint;
import com.google.zxing.ResultPointCallback;
import com.google.zxing.multi.MultipleBarcodeReader;
import com.scanvision.app.Config;
import com.scanvision.core.image.BinarizerKind;
import com.scanvision.core.image.InversionSupport;
import com.scanvision.core.image.LuminanceSources;
import com.scanvision.core.image.PixelFormat;
import com.scanvision.core.image.RawLuminanceFactory;
import com.scanvision.core.image.RotationLockedLuminanceSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Оркестратор декодирования: гоняет движок ZXing по картинке с поворотами на 90° и инверсией,
 * пока не найдёт символ или не исчерпает варианты; затем правит ORIENTATION и оповещает подписчиков.
 *
 * Порядок попыток на один поворот: обычная бинаризация → (если не нашли и разрешено) инверсия.
 * Поворотов максимум 4 при autoRotate, иначе один проход.
 *
 * Если движок — {@link StatefulReader}, после успешного декодирования «с хинтами» следующие вызовы
 * идут через {@link StatefulReader#decodeWithState}. Любое изменение настроек сбрасывает это состояние.
 *
 * Синхронный, без блокировок; один экземпляр не предназначен для вызова из нескольких потоков.
 */
public final class BarcodeReader {
    private static final Logger log = LoggerFactory.getLogger(BarcodeReader.class);

    /** Найден результат (после правки ориентации). */
    @FunctionalInterface
    public interface ResultListener {
        void onResult(Result result);
    }

    /** Движок нашёл значимую точку (угол finder pattern и т.п.) во время сканирования. */
    @FunctionalInterface
    public interface ResultPointListener {
        void onResultPoint(ResultPoint point);
    }

    /** Хэндл подписки на точки. */
    public record Subscription(long id) {}

    private static final AtomicLong SEQ = new AtomicLong(1);

    private final Reader reader;
    private final Function<BufferedImage, LuminanceSource> luminanceFactory;
    private final RawLuminanceFactory rawLuminanceFactory;
    private final Function<LuminanceSource, Binarizer> binarizerFactory;
    private final MultiReaderFactory multiReaderFactory;
    private final DecodingOptions options;

    private boolean autoRotate;
    private boolean tryInverted;
    // можно ли звать decodeWithState вместо decode с хинтами
    private boolean usePreviousState;

    private final CopyOnWriteArrayList<ResultListener> resultListeners = new CopyOnWriteArrayList<>();
    private final Map<Subscription, ResultPointListener> resultPointListeners = new LinkedHashMap<>();
    private final ResultPointCallback resultPointCallback = this::onResultPointFound;

    public BarcodeReader() {
        this(null, LuminanceSources::fromImage, null);
    }

    /**
     * @param reader           движок; null → {@link MultiFormatStatefulReader}, голый {@link MultiFormatReader}
     *                         оборачивается, чтобы работал decodeWithState
     * @param luminanceFactory BufferedImage → источник яркости; null допустим, но тогда
     *                         {@link #decode(BufferedImage)} бросает IllegalStateException
     * @param binarizerFactory null → HybridBinarizer
     */
    public BarcodeReader(Reader reader,
                         Function<BufferedImage, LuminanceSource> luminanceFactory,
                         Function<LuminanceSource, Binarizer> binarizerFactory) {
        this(reader, luminanceFactory, binarizerFactory, MultiReaderFactory.DEFAULT, new DecodingOptions());
    }

    public BarcodeReader(Reader reader,
                         Function<BufferedImage, LuminanceSource> luminanceFactory,
                         Function<LuminanceSource, Binarizer> binarizerFactory,
                         MultiReaderFactory multiReaderFactory,
                         DecodingOptions options) {
        this(reader, luminanceFactory, RawLuminanceFactory.DEFAULT, binarizerFactory, multiReaderFactory, options);
    }

    /**
     * @param rawLuminanceFactory сырой буфер → источник яркости; null допустим, но тогда
     *                            {@link #decode(byte[], int, int, PixelFormat)} бросает IllegalStateException
     */
    public BarcodeReader(Reader reader,
                         Function<BufferedImage, LuminanceSource> luminanceFactory,
                         RawLuminanceFactory rawLuminanceFactory,
                         Function<LuminanceSource, Binarizer> binarizerFactory,
                         MultiReaderFactory multiReaderFactory,
                         DecodingOptions options) {
        this.reader = engine(reader);
        this.luminanceFactory = luminanceFactory;
        this.rawLuminanceFactory = rawLuminanceFactory;
        this.binarizerFactory = binarizerFactory != null ? binarizerFactory : BinarizerKind.HYBRID;
        this.multiReaderFactory = Objects.requireNonNull(multiReaderFactory, "multiReaderFactory");
        this.options = Objects.requireNonNull(options, "options");
        this.options.addChangeListener(this::invalidateState);
        this.usePreviousState = false;
    }

    /** Удобный конструктор: параметры из секции decode в application.yaml. */
    public static BarcodeReader fromConfig(Config.DecodeConf conf) {
        Objects.requireNonNull(conf, "conf");
        BinarizerKind binarizer = BinarizerKind.parse(conf.binarizer());
        BarcodeReader r = new BarcodeReader(new MultiFormatStatefulReader(), LuminanceSources::fromImage, binarizer);
        r.setAutoRotate(conf.autoRotate());
        r.setTryInverted(conf.tryInverted());
        DecodingOptions o = r.options();
        o.setTryHarder(conf.tryHarder());
        o.setPureBarcode(conf.pureBarcode());
        o.setCharacterSet(conf.characterSet());
        o.setPossibleFormats(DecodingOptions.parseFormats(conf.possibleFormats()));
        log.info("Reader: autoRotate={} tryInverted={} tryHarder={} formats={} charset={} binarizer={}",
                r.isAutoRotate(), r.isTryInverted(), o.isTryHarder(), o.getPossibleFormats(),
                o.getCharacterSet(), binarizer);
        return r;
    }

    public DecodingOptions options() {
        return options;
    }

    public boolean isAutoRotate() {
        return autoRotate;
    }

    /** Пробовать повороты на 90/180/270°. Сбрасывает состояние движка. */
    public void setAutoRotate(boolean autoRotate) {
        this.autoRotate = autoRotate;
        invalidateState();
    }

    public boolean isTryInverted() {
        return tryInverted;
    }

    /** Пробовать инвертированную картинку, если обычная не дала результата. Замедляет поиск. */
    public void setTryInverted(boolean tryInverted) {
        this.tryInverted = tryInverted;
        invalidateState();
    }

    // ---- одиночный символ ----

    public Optional<Result> decode(BufferedImage image) {
        return decode(luminance(image));
    }

    public Optional<Result> decode(int[] argb, int width, int height) {
        return decode(LuminanceSources.fromArgb(argb, width, height));
    }

    public Optional<Result> decode(byte[] raw, int width, int height, PixelFormat format) {
        return decode(luminance(raw, width, height, format));
    }

    /**
     * Основной метод. Источник можно подготовить заранее (в т.ч. в фоновом потоке),
     * чтобы не держать исходную картинку во время долгого декодирования.
     */
    public Optional<Result> decode(LuminanceSource source) {
        Objects.requireNonNull(source, "source");
        Outcome<Result> out = rotateAndInvert(source, this::decodeOnce);
        Result result = out.value();
        if (result == null) {
            log.trace("decode: nothing found");
            return Optional.empty();
        }
        int orientation = OrientationMetadata.apply(result, out.rotationCount());
        log.debug("decode: {} found, rotations={} orientation={}",
                result.getBarcodeFormat(), out.rotationCount(), orientation);
        fireResultFound(result);
        return Optional.of(result);
    }

    // ---- несколько символов ----

    public List<Result> decodeMultiple(BufferedImage image) {
        return decodeMultiple(luminance(image));
    }

    public List<Result> decodeMultiple(int[] argb, int width, int height) {
        return decodeMultiple(LuminanceSources.fromArgb(argb, width, height));
    }

    public List<Result> decodeMultiple(byte[] raw, int width, int height, PixelFormat format) {
        return decodeMultiple(luminance(raw, width, height, format));
    }

    /** Пустой список, если ничего не нашли. Порядок — как вернул движок. */
    public List<Result> decodeMultiple(LuminanceSource source) {
        Objects.requireNonNull(source, "source");
        MultiReaderChoice choice = MultiReaderChoice.select(options.getPossibleFormats());
        MultipleBarcodeReader multiReader = multiReaderFactory.create(choice, reader);
        if (choice == MultiReaderChoice.GENERIC) {
            // обёртка зовёт тот же одиночный ридер с хинтами, его состояние больше не наше
            usePreviousState = false;
        }

        Outcome<Result[]> out = rotateAndInvert(source, bitmap -> decodeMultipleOnce(multiReader, bitmap));
        if (out.value() == null) {
            log.trace("decodeMultiple: nothing found ({})", choice);
            return List.of();
        }
        List<Result> results = List.of(out.value());
        for (Result r : results) {
            OrientationMetadata.apply(r, out.rotationCount());
        }
        log.debug("decodeMultiple: {} result(s) via {}, rotations={}", results.size(), choice, out.rotationCount());
        for (Result r : results) {
            fireResultFound(r);
        }
        return results;
    }

    // ---- подписки ----

    public void addResultListener(ResultListener listener) {
        resultListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeResultListener(ResultListener listener) {
        resultListeners.remove(listener);
    }

    /**
     * Первая подписка вешает колбэк NEED_RESULT_POINT_CALLBACK в хинты;
     * отписка последнего слушателя его снимает.
     */
    public Subscription addResultPointListener(ResultPointListener listener) {
        Objects.requireNonNull(listener, "listener");
        Subscription s = new Subscription(SEQ.getAndIncrement());
        resultPointListeners.put(s, listener);
        options.putHint(DecodeHintType.NEED_RESULT_POINT_CALLBACK, resultPointCallback);
        invalidateState();
        return s;
    }

    /** @return false, если такой подписки не было */
    public boolean removeResultPointListener(Subscription subscription) {
        boolean removed = subscription != null && resultPointListeners.remove(subscription) != null;
        if (resultPointListeners.isEmpty()) {
            options.removeHint(DecodeHintType.NEED_RESULT_POINT_CALLBACK);
        }
        invalidateState();
        return removed;
    }

    public boolean hasResultPointListeners() {
        return !resultPointListeners.isEmpty();
    }

    // ---- цикл поворотов/инверсии ----

    /** Одна попытка на готовой бинарной картинке; null = не нашли. */
    @FunctionalInterface
    private interface Attempt<T> {
        T run(BinaryBitmap bitmap);
    }

    private record Outcome<T>(T value, int rotationCount) {}

    private <T> Outcome<T> rotateAndInvert(LuminanceSource source, Attempt<T> attempt) {
        int rotationMaxCount = prepareRotationHint();
        LuminanceSource current = source;
        T found = null;
        int rotationCount = 0;

        for (; rotationCount < rotationMaxCount; rotationCount++) {
            found = attempt.run(binarize(current));

            if (found == null && tryInverted && InversionSupport.isInversionSupported(current)) {
                found = attempt.run(binarize(current.invert()));
                if (found != null) {
                    log.trace("found on inverted image, rotation={}", rotationCount);
                }
            }

            if (found != null || !current.isRotateSupported() || !autoRotate) {
                break;
            }
            // поворот накопительный: 90 → 180 → 270
            current = current.rotateCounterClockwise();
        }
        return new Outcome<>(found, rotationCount);
    }

    /** Повороты делает ридер, движку собственный поиск по углам не нужен. */
    private int prepareRotationHint() {
        if (autoRotate) {
            options.putHint(DecodeHintType.OTHER, DecodingOptions.SUPPRESS_ROTATION_SEARCH);
            return OrientationMetadata.MAX_ROTATIONS;
        }
        if (options.hints().get(DecodeHintType.OTHER) == DecodingOptions.SUPPRESS_ROTATION_SEARCH) {
            options.removeHint(DecodeHintType.OTHER);
        }
        return 1;
    }

    /** При подавленном поиске поворотов движок получает источник без поддержки поворота. */
    private BinaryBitmap binarize(LuminanceSource source) {
        if (options.hints().get(DecodeHintType.OTHER) == DecodingOptions.SUPPRESS_ROTATION_SEARCH) {
            source = new RotationLockedLuminanceSource(source);
        }
        return new BinaryBitmap(binarizerFactory.apply(source));
    }

    private Result decodeOnce(BinaryBitmap bitmap) {
        try {
            if (usePreviousState && reader instanceof StatefulReader stateful) {
                return stateful.decodeWithState(bitmap);
            }
            usePreviousState = false;
            Result result = reader.decode(bitmap, options.hints());
            // состояние движка теперь соответствует текущим хинтам
            usePreviousState = result != null;
            return result;
        } catch (ReaderException e) {
            log.trace("attempt missed: {}", e.getClass().getSimpleName());
            return null;
        }
    }

    private Result[] decodeMultipleOnce(MultipleBarcodeReader multiReader, BinaryBitmap bitmap) {
        try {
            Result[] results = multiReader.decodeMultiple(bitmap, options.hints());
            return (results == null || results.length == 0) ? null : results;
        } catch (NotFoundException e) {
            log.trace("multi attempt missed");
            return null;
        }
    }

    private LuminanceSource luminance(BufferedImage image) {
        if (luminanceFactory == null) {
            throw new IllegalStateException("Luminance source factory is not configured");
        }
        Objects.requireNonNull(image, "image");
        return luminanceFactory.apply(image);
    }

    private LuminanceSource luminance(byte[] raw, int width, int height, PixelFormat format) {
        if (rawLuminanceFactory == null) {
            throw new IllegalStateException("Raw luminance source factory is not configured");
        }
        return rawLuminanceFactory.create(raw, width, height, format);
    }

    private static Reader engine(Reader reader) {
        if (reader == null) {
            return new MultiFormatStatefulReader();
        }
        if (reader instanceof MultiFormatReader m) {
            return new MultiFormatStatefulReader(m);
        }
        return reader;
    }

    /** Движок, которым реально декодируем (после обёртки). */
    Reader engine() {
        return reader;
    }

    private void invalidateState() {
        usePreviousState = false;
    }

    // ---- оповещения ----

    private void fireResultFound(Result result) {
        for (ResultListener l : resultListeners) {
            try {
                l.onResult(result);
            } catch (RuntimeException e) {
                log.warn("result listener failed: {}", e.toString());
            }
        }
    }

    private void onResultPointFound(ResultPoint point) {
        for (ResultPointListener l : new ArrayList<>(resultPointListeners.values())) {
            try {
                l.onResultPoint(point);
            } catch (RuntimeException e) {
                log.warn("result point listener failed: {}", e.toString());
            }
        }
    }
}
