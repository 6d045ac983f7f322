package com.scanvision.core.decode;

import com.google.zxing.BinaryBitmap;
import com.google.zxing.DecodeHintType;
import com.google.zxing.MultiFormatReader;
import com.google.zxing.NotFoundException;
import com.google.zxing.Result;

import java.util.Map;
import java.util.Objects;

/** {@link MultiFormatReader} (final в ZXing) за интерфейсом {@link StatefulReader}. */
public final class MultiFormatStatefulReader implements StatefulReader {

    private final MultiFormatReader delegate;

    public MultiFormatStatefulReader() {
        this(new MultiFormatReader());
    }

    public MultiFormatStatefulReader(MultiFormatReader delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public Result decode(BinaryBitmap image) throws NotFoundException {
        return delegate.decode(image);
    }

    @Override
    public Result decode(BinaryBitmap image, Map<DecodeHintType, ?> hints) throws NotFoundException {
        return delegate.decode(image, hints);
    }

    @Override
    public Result decodeWithState(BinaryBitmap image) throws NotFoundException {
        return delegate.decodeWithState(image);
    }

    @Override
    public void reset() {
        delegate.reset();
    }
}
