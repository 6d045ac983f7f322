package com.scanvision.core.decode;

import com.google.zxing.Result;
import com.google.zxing.ResultMetadataType;

import java.util.Map;
import java.util.Objects;

/**
 * Согласование ORIENTATION в метаданных результата с числом поворотов, сделанных ридером.
 *
 * Если движок уже записал ориентацию (сам повернул картинку, например при TRY_HARDER),
 * поворот ридера прибавляется к ней, а не затирает её. Итог всегда в [0, 360).
 */
public final class OrientationMetadata {

    public static final int MAX_ROTATIONS = 4;

    private OrientationMetadata() {
        // no-op
    }

    /**
     * @param result        результат движка, дополняется на месте
     * @param rotationCount сколько раз картинку повернули на 90° против часовой, 0..3
     * @return итоговая ориентация в градусах
     */
    public static int apply(Result result, int rotationCount) {
        Objects.requireNonNull(result, "result");
        if (rotationCount < 0 || rotationCount >= MAX_ROTATIONS) {
            throw new IllegalArgumentException("rotationCount must be in [0, 4): " + rotationCount);
        }
        int applied = rotationCount * 90;
        Map<ResultMetadataType, Object> metadata = result.getResultMetadata();
        Object existing = metadata == null ? null : metadata.get(ResultMetadataType.ORIENTATION);

        int orientation = existing instanceof Number n
                ? Math.floorMod(n.intValue() + applied, 360)
                : applied;
        result.putMetadata(ResultMetadataType.ORIENTATION, orientation);
        return orientation;
    }

    /** Ориентация из метаданных или 0, если её нет. */
    public static int of(Result result) {
        Map<ResultMetadataType, Object> metadata = result.getResultMetadata();
        if (metadata != null && metadata.get(ResultMetadataType.ORIENTATION) instanceof Number n) {
            return n.intValue();
        }
        return 0;
    }
}
