package io.warehousetwin.calibration;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
class StageTimingFitterTest {

    @Test
    void sampleStatisticsUseTheBiasCorrectedVariance() {
        SampleStatistics stats = SampleStatistics.compute("pick", new double[]{1, 2, 3, 4, 5});

        assertEquals(5, stats.count());
        assertEquals(1.0, stats.min(), 1e-12);
        assertEquals(5.0, stats.max(), 1e-12);
        assertEquals(3.0, stats.mean(), 1e-12);
        assertEquals(2.5, stats.sampleVariance(), 1e-12);
        assertEquals(2.0, stats.populationVariance(), 1e-12);
        assertTrue(stats.hasSpread());
    }

    @Test
    void varianceStaysExactFarFromZero() {
        SampleStatistics stats = SampleStatistics.compute("ship", new double[]{1e9 + 4, 1e9 + 7, 1e9 + 13, 1e9 + 16});

        assertEquals(1e9 + 10, stats.mean(), 0.0);
        assertEquals(30.0, stats.sampleVariance(), 0.0);
    }

    @Test
    void singleObservationHasNoSpread() {
        SampleStatistics stats = SampleStatistics.compute("pack", new double[]{42});

        assertFalse(stats.hasSpread());
        assertTrue(Double.isNaN(stats.sampleVariance()));
        assertEquals(0.0, stats.populationVariance(), 1e-12);
    }

    @Test
    void emptyInputIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> SampleStatistics.compute("x", new double[0]));
        assertThrows(IllegalArgumentException.class,
            () -> new StageTimingFitter().fit(CalibrationStage.PICK, new double[0]));
    }

    @Test
    void fitReportsEstimatesAndConfidenceWidth() {
        StageFit fit = new StageTimingFitter().fit(CalibrationStage.PICK, new double[]{1, 2, 3, 4, 5});

        assertEquals(CalibrationStage.PICK, fit.stage());
        assertEquals(5, fit.sampleCount());
        assertEquals(3.0, fit.mean(), 1e-12);
        assertEquals(Math.sqrt(2.5), fit.stdDev(), 1e-12);
        assertFalse(fit.stdDefaulted());
        // t(4, 0.975) = 2.7764
        assertEquals(2.7764 * Math.sqrt(2.5) / Math.sqrt(5), fit.meanHalfWidth95(), 1e-3);
    }

    @Test
    void fewerThanTwoSamplesFallBackToTheDefaultStd() {
        StageFit fit = new StageTimingFitter().fit(CalibrationStage.SHIP, new double[]{1.25});

        assertEquals(1.25, fit.mean(), 1e-12);
        assertEquals(StageTimingFitter.DEFAULT_STD, fit.stdDev(), 1e-12);
        assertTrue(fit.stdDefaulted());
        assertTrue(Double.isNaN(fit.meanHalfWidth95()));

        StageFit custom = new StageTimingFitter(0.1).fit(CalibrationStage.SHIP, new double[]{1.25});
        assertEquals(0.1, custom.stdDev(), 1e-12);
    }

    @Test
    void identicalDurationsGiveZeroSpread() {
        StageFit fit = new StageTimingFitter().fit(CalibrationStage.PACK, new double[]{2.0, 2.0, 2.0});

        assertEquals(0.0, fit.stdDev(), 1e-12);
        assertFalse(fit.stdDefaulted());
        assertEquals(0.0, fit.meanHalfWidth95(), 1e-12);
    }
}
