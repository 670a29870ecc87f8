/*
 * Adapted from The MIT License (MIT)
 *
 * Copyright (c) 2020-2022 DaPorkchop_
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy of this software and associated documentation
 * files (the "Software"), to deal in the Software without restriction, including without limitation the rights to use, copy,
 * modify, merge, publish, distribute, sublicense, and/or sell copies of the Software, and to permit persons to whom the Software
 * is furnished to do so, subject to the following conditions:
 *
 * Any persons and/or organizations using this software must include the above copyright notice and this permission notice,
 * provide sufficient credit to the original authors of the project (IE: DaPorkchop_), as well as provide a link to the original project.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES
 * OF MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT HOLDERS
 * BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE SOFTWARE.
 *
 */

package net.daporkchop.mapserver.render;

import net.daporkchop.mapserver.TestDatasets;
import net.daporkchop.mapserver.data.InMemoryDataset;
import net.daporkchop.mapserver.data.SampleSet;
import net.daporkchop.mapserver.field.FieldRef;
import net.daporkchop.mapserver.server.RenderGate;
import net.daporkchop.mapserver.util.geom.Bounds2d;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ValueNormalizerTest {
    private final InMemoryDataset dataset = TestDatasets.unitGrid();
    private final RenderGate gate = new RenderGate();
    private final FieldRef.Compound density = FieldRef.compound("gas", "density");

    @Test
    void wholeDomainBounds() {
        ValueNormalizer normalizer = new ValueNormalizer(this.dataset, this.gate, TestDatasets.TILE_SIZE, false);
        assertEquals(new ColorBounds(1.0d, 100.0d), this.gate.call(() -> normalizer.bounds(this.density, 0)));
        assertEquals(new ColorBounds(1.0d, 100.0d), this.gate.call(() -> normalizer.bounds(this.density, 1)));
        assertEquals(new ColorBounds(0.0d, 15.0d), this.gate.call(() -> normalizer.bounds(FieldRef.compound("gas", "temperature"), 1)));
    }

    @Test
    @DisplayName("samples wider than a tile are ignored")
    void oversizedSamples() {
        ValueNormalizer normalizer = new ValueNormalizer(this.dataset, this.gate, TestDatasets.TILE_SIZE, false);
        //at zoom 3 a tile is exactly as wide as a sample's half-width
        assertEquals(new ColorBounds(1.0d, 100.0d), this.gate.call(() -> normalizer.bounds(this.density, 3)));
        assertTrue(this.gate.call(() -> normalizer.bounds(this.density, 4)).isEmpty());
    }

    @Test
    void requiresTheGate() {
        ValueNormalizer normalizer = new ValueNormalizer(this.dataset, this.gate, TestDatasets.TILE_SIZE, false);
        assertThrows(IllegalStateException.class, () -> normalizer.bounds(this.density, 0));
    }

    @Test
    void cachedBounds() {
        ValueNormalizer cached = new ValueNormalizer(this.dataset, this.gate, TestDatasets.TILE_SIZE, true);
        ColorBounds first = this.gate.call(() -> cached.bounds(this.density, 2));
        assertSame(first, this.gate.call(() -> cached.bounds(this.density, 2)));

        ValueNormalizer uncached = new ValueNormalizer(this.dataset, this.gate, TestDatasets.TILE_SIZE, false);
        assertEquals(first, this.gate.call(() -> uncached.bounds(this.density, 2)));
    }

    @Test
    void regionAndSizeFilters() {
        SampleSet samples = this.dataset.samples(this.density);
        assertEquals(new ColorBounds(1.0d, 1.0d), ValueNormalizer.colorBounds(samples, new Bounds2d(0.0d, 0.2d, 0.0d, 0.2d), 0.0d, 0.0d));
        assertTrue(ValueNormalizer.colorBounds(samples, TestDatasets.UNIT_DOMAIN, 0.2d, 0.0d).isEmpty());
        assertEquals(new ColorBounds(1.0d, 100.0d), ValueNormalizer.colorBounds(samples, TestDatasets.UNIT_DOMAIN, 0.125d, 0.125d));
    }

    @Test
    void nanValuesAreSkipped() {
        SampleSet samples = new SampleSet(
                new double[]{ 0.25d, 0.75d }, new double[]{ 0.5d, 0.5d },
                new double[]{ 0.25d, 0.25d }, new double[]{ 0.5d, 0.5d },
                new double[]{ Double.NaN, 4.0d });
        assertEquals(new ColorBounds(4.0d, 4.0d), ValueNormalizer.colorBounds(samples, TestDatasets.UNIT_DOMAIN, 0.0d, 0.0d));
    }
}
