package com.prediction.worthhub.worth_hub.engine;

import com.prediction.worthhub.worth_hub.entity.FixedPoint;

/**
 * Submission-timing weight {@code T_f(n) = PRECISION / ln(n + e)}, evaluated
 * from a precomputed table so every observer gets identical integers.
 */
public final class TimeDecay {

    /**
     * round(ln(n + e) * 1e6) for n = 0..63.
     */
    private static final long[] LN_TABLE = {
            1_000_000, 1_313_262, 1_551_445, 1_743_668,
            1_904_832, 2_043_592, 2_165_422, 2_274_009,
            2_371_951, 2_461_150, 2_543_040, 2_618_729,
            2_689_090, 2_754_824, 2_816_503, 2_874_597,
            2_929_501, 2_981_546, 3_031_016, 3_078_154,
            3_123_170, 3_166_246, 3_207_543, 3_247_202,
            3_285_348, 3_322_092, 3_357_534, 3_391_762,
            3_424_858, 3_456_893, 3_487_934, 3_518_040,
            3_547_266, 3_575_663, 3_603_275, 3_630_145,
            3_656_312, 3_681_812, 3_706_677, 3_730_939,
            3_754_627, 3_777_766, 3_800_382, 3_822_498,
            3_844_136, 3_865_315, 3_886_054, 3_906_373,
            3_926_286, 3_945_811, 3_964_962, 3_983_753,
            4_002_198, 4_020_308, 4_038_097, 4_055_574,
            4_072_751, 4_089_638, 4_106_245, 4_122_580,
            4_138_653, 4_154_472, 4_170_044, 4_185_377,
    };

    public static final int TABLE_SIZE = LN_TABLE.length;

    private TimeDecay() {
    }

    /**
     * ln(order + e) at scale 1e6. Orders past the table share its last entry.
     */
    public static long lnScaled(int submitOrder) {
        if (submitOrder < 0) {
            throw new IllegalArgumentException("Submit order cannot be negative: " + submitOrder);
        }
        return LN_TABLE[Math.min(submitOrder, TABLE_SIZE - 1)];
    }

    /**
     * T_f at scale 1e6; submit order 0 gets the maximum, PRECISION.
     */
    public static long weight(int submitOrder) {
        return FixedPoint.PRECISION * FixedPoint.PRECISION / lnScaled(submitOrder);
    }
}
