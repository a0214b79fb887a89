/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.dem.gmrf.validation;

import com.hellblazer.dem.gmrf.GmrfException.ConfigurationException;
import net.jqwik.api.ForAll;
import net.jqwik.api.Label;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.DoubleRange;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Random;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class CheckpointSplitterTest {

    @Test
    public void checkpointCountRounds() {
        assertEquals(10, CheckpointSplitter.checkpointCount(1000, 0.01));
        assertEquals(3, CheckpointSplitter.checkpointCount(5, 0.5));
        assertEquals(0, CheckpointSplitter.checkpointCount(49, 0.01));
        assertEquals(0, CheckpointSplitter.checkpointCount(100, 0.0));
        assertEquals(100, CheckpointSplitter.checkpointCount(100, 1.0));
    }

    @Test
    public void ratioOutsideTheUnitInterval() {
        var splitter = new CheckpointSplitter(new Random(1));
        assertThrows(ConfigurationException.class, () -> splitter.split(10, -0.1));
        assertThrows(ConfigurationException.class, () -> splitter.split(10, 1.5));
        assertThrows(ConfigurationException.class, () -> splitter.split(10, Double.NaN));
    }

    @Test
    public void sameSeedSameSplit() {
        var a = new CheckpointSplitter(new Random(1234)).split(500, 0.1);
        var b = new CheckpointSplitter(new Random(1234)).split(500, 0.1);

        assertArrayEquals(a.inserted(), b.inserted());
        assertArrayEquals(a.checkpoints(), b.checkpoints());
        assertEquals(50, a.checkpointCount());
        assertEquals(450, a.insertedCount());
    }

    @Test
    public void emptyDataset() {
        var split = new CheckpointSplitter(new Random()).split(0, 0.5);

        assertEquals(0, split.insertedCount());
        assertEquals(0, split.checkpointCount());
    }

    @Property
    @Label("Inserted and checkpoint rows partition the dataset")
    void splitIsAPartition(@ForAll @IntRange(min = 0, max = 2_000) int n,
                           @ForAll @DoubleRange(min = 0.0, max = 1.0) double ratio, @ForAll long seed) {
        var split = new CheckpointSplitter(new Random(seed)).split(n, ratio);

        assertEquals(CheckpointSplitter.checkpointCount(n, ratio), split.checkpointCount());
        assertEquals(n, split.insertedCount() + split.checkpointCount());
        var all = IntStream.concat(Arrays.stream(split.inserted()), Arrays.stream(split.checkpoints()))
                           .sorted()
                           .toArray();
        assertArrayEquals(IntStream.range(0, n).toArray(), all);
    }
}
