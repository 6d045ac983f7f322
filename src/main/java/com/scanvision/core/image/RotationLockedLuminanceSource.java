package com.scanvision.core.image;

import com.google.zxing.LuminanceSource;

import java.util.Objects;

/**
 * Тот же источник, но без поворота: движок не должен крутить картинку сам,
 * когда поворотами занимается {@link com.scanvision.core.decode.BarcodeReader}.
 * 1D-ридеры ZXing при TRY_HARDER смотрят на {@link #isRotateSupported()}.
 */
public final class RotationLockedLuminanceSource extends LuminanceSource implements InversionSupport {

    private final LuminanceSource delegate;

    public RotationLockedLuminanceSource(LuminanceSource delegate) {
        super(Objects.requireNonNull(delegate, "delegate").getWidth(), delegate.getHeight());
        this.delegate = delegate;
    }

    public LuminanceSource delegate() {
        return delegate;
    }

    @Override
    public byte[] getRow(int y, byte[] row) {
        return delegate.getRow(y, row);
    }

    @Override
    public byte[] getMatrix() {
        return delegate.getMatrix();
    }

    @Override
    public boolean isCropSupported() {
        return delegate.isCropSupported();
    }

    @Override
    public LuminanceSource crop(int left, int top, int width, int height) {
        return new RotationLockedLuminanceSource(delegate.crop(left, top, width, height));
    }

    @Override
    public boolean isRotateSupported() {
        return false;
    }

    @Override
    public LuminanceSource invert() {
        return new RotationLockedLuminanceSource(delegate.invert());
    }

    @Override
    public boolean isInversionSupported() {
        return InversionSupport.isInversionSupported(delegate);
    }
}
