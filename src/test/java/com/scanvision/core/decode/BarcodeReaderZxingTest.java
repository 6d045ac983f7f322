package com.scanvision.core.decode;

import com.google.zxing.BarcodeFormat;
import com.google.zxing.MultiFormatReader;
import com.google.zxing.Result;
import com.google.zxing.ResultPoint;
import com.scanvision.app.Config;
import com.scanvision.core.image.LuminanceSources;
import com.scanvision.core.image.PixelFormat;
import com.scanvision.core.image.TestImages;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/** Сквозные проверки на настоящем движке ZXing и синтетических картинках. */
class BarcodeReaderZxingTest {

    @Test
    void uprightQrIsDecodedWithoutRotation() {
        BarcodeReader reader = new BarcodeReader();

        Optional<Result> r = reader.decode(TestImages.qr("hello scan", 200));

        assertTrue(r.isPresent());
        assertEquals("hello scan", r.get().getText());
        assertEquals(BarcodeFormat.QR_CODE, r.get().getBarcodeFormat());
        assertEquals(0, OrientationMetadata.of(r.get()));
    }

    @Test
    void rotatedCode128NeedsAutoRotate() {
        BufferedImage img = TestImages.rotateClockwise(TestImages.code128("SCAN-128", 300, 80));
        BarcodeReader reader = new BarcodeReader();
        reader.options().setPossibleFormats(BarcodeFormat.CODE_128);

        assertTrue(reader.decode(img).isEmpty());

        reader.setAutoRotate(true);
        Optional<Result> r = reader.decode(img);
        assertTrue(r.isPresent());
        assertEquals("SCAN-128", r.get().getText());
        assertEquals(90, OrientationMetadata.of(r.get()));
    }

    @Test
    void engineOwnRotationIsKeptWithoutAutoRotate() {
        BufferedImage img = TestImages.rotateClockwise(TestImages.code128("SCAN-128", 300, 80));
        BarcodeReader reader = new BarcodeReader();
        reader.options().setPossibleFormats(BarcodeFormat.CODE_128);
        reader.options().setTryHarder(true);

        Optional<Result> r = reader.decode(img);

        assertTrue(r.isPresent());
        // 1D-ридер сам повернул картинку против часовой
        assertEquals(270, OrientationMetadata.of(r.get()));
    }

    @Test
    void autoRotateKeepsEngineFromRotatingOnItsOwn() {
        BufferedImage img = TestImages.rotateClockwise(TestImages.code128("SCAN-128", 300, 80));
        BarcodeReader reader = new BarcodeReader();
        reader.options().setPossibleFormats(BarcodeFormat.CODE_128);
        reader.setAutoRotate(true);
        reader.options().setTryHarder(true);

        Optional<Result> r = reader.decode(img);

        assertTrue(r.isPresent());
        assertEquals("SCAN-128", r.get().getText());
        // та же ориентация, что и без TRY_HARDER: поворачивал только ридер
        assertEquals(90, OrientationMetadata.of(r.get()));
    }

    @Test
    void plainZxingReaderDecodesRepeatedly() {
        BarcodeReader reader = new BarcodeReader(new MultiFormatReader(), LuminanceSources::fromImage, null);
        BufferedImage img = TestImages.qr("plain", 200);

        for (int i = 0; i < 2; i++) {
            assertEquals("plain", reader.decode(img).map(Result::getText).orElse(null));
        }
    }

    @Test
    void invertedQrNeedsTryInverted() {
        BufferedImage img = TestImages.invert(TestImages.qr("negative", 200));
        BarcodeReader reader = new BarcodeReader();
        reader.options().setPossibleFormats(BarcodeFormat.QR_CODE);

        assertTrue(reader.decode(img).isEmpty());

        reader.setTryInverted(true);
        Optional<Result> r = reader.decode(img);
        assertTrue(r.isPresent());
        assertEquals("negative", r.get().getText());
    }

    @Test
    void twoQrCodesAreFoundTogether() {
        BufferedImage img = TestImages.sideBySide(40,
                TestImages.qr("left", 200), TestImages.qr("right", 200));
        BarcodeReader reader = new BarcodeReader();
        reader.options().setPossibleFormats(BarcodeFormat.QR_CODE);
        List<String> notified = new ArrayList<>();
        reader.addResultListener(r -> notified.add(r.getText()));

        List<Result> results = reader.decodeMultiple(img);

        Set<String> texts = results.stream().map(Result::getText).collect(Collectors.toSet());
        assertEquals(Set.of("left", "right"), texts);
        assertEquals(results.size(), notified.size());
    }

    @Test
    void resultPointsArriveDuringQrDecode() {
        BarcodeReader reader = new BarcodeReader();
        List<ResultPoint> points = new ArrayList<>();
        reader.addResultPointListener(points::add);

        assertTrue(reader.decode(TestImages.qr("points", 200)).isPresent());
        assertFalse(points.isEmpty());
    }

    @Test
    void pixelArrayInputsAreDecoded() {
        BufferedImage img = TestImages.qr("pixels", 160);
        BarcodeReader reader = new BarcodeReader();

        Optional<Result> fromInts = reader.decode(TestImages.argbPixels(img), img.getWidth(), img.getHeight());
        assertEquals("pixels", fromInts.map(Result::getText).orElse(null));

        int[] argb = TestImages.argbPixels(img);
        byte[] bgr = new byte[argb.length * 3];
        for (int i = 0; i < argb.length; i++) {
            bgr[i * 3] = (byte) argb[i];
            bgr[i * 3 + 1] = (byte) (argb[i] >> 8);
            bgr[i * 3 + 2] = (byte) (argb[i] >> 16);
        }
        Optional<Result> fromBytes = reader.decode(bgr, img.getWidth(), img.getHeight(), PixelFormat.BGR24);
        assertEquals("pixels", fromBytes.map(Result::getText).orElse(null));
    }

    @Test
    void repeatedDecodesReuseStateAndStillWork() {
        BarcodeReader reader = new BarcodeReader();
        reader.setAutoRotate(true);
        BufferedImage img = TestImages.qr("again", 200);

        for (int i = 0; i < 3; i++) {
            assertEquals("again", reader.decode(img).map(Result::getText).orElse(null));
        }
    }

    @Test
    void fromConfigAppliesDecodeSection() {
        Config cfg = Config.load("/application-test.yaml");
        BarcodeReader reader = BarcodeReader.fromConfig(cfg.decode());

        assertFalse(reader.isAutoRotate());
        assertTrue(reader.isTryInverted());
        assertTrue(reader.options().isTryHarder());
        assertEquals("ISO-8859-1", reader.options().getCharacterSet());
        assertEquals(Set.of(BarcodeFormat.QR_CODE, BarcodeFormat.CODE_128), reader.options().getPossibleFormats());

        assertEquals("cfg", reader.decode(TestImages.qr("cfg", 200)).map(Result::getText).orElse(null));
    }
}
