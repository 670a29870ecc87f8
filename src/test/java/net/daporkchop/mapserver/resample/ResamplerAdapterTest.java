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

package net.daporkchop.mapserver.resample;

import net.daporkchop.mapserver.TestDatasets;
import net.daporkchop.mapserver.data.InMemoryDataset;
import net.daporkchop.mapserver.error.ResourceFaultException;
import net.daporkchop.mapserver.error.UnknownFieldException;
import net.daporkchop.mapserver.field.FieldRef;
import net.daporkchop.mapserver.server.RenderGate;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ResamplerAdapterTest {
    private final InMemoryDataset dataset = TestDatasets.unitGrid();
    private final RenderGate gate = new RenderGate();
    private final FieldRef.Compound density = FieldRef.compound("gas", "density");

    @Test
    void requiresTheGate() {
        ResamplerAdapter adapter = new ResamplerAdapter(this.dataset, new PixelizingResampler(), this.gate, 256);
        assertThrows(IllegalStateException.class, () -> adapter.resample(this.density, TestDatasets.UNIT_DOMAIN));

        double[][] grid = this.gate.call(() -> adapter.resample(this.density, TestDatasets.UNIT_DOMAIN));
        assertEquals(256, grid.length);
        assertEquals(256, grid[255].length);
    }

    @Test
    void primitiveFailuresBecomeResourceFaults() {
        IllegalStateException cause = new IllegalStateException("acceleration structure corrupted");
        ResamplerAdapter adapter = new ResamplerAdapter(this.dataset, (samples, box, rx, ry) -> {
            throw cause;
        }, this.gate, 256);

        ResourceFaultException e = assertThrows(ResourceFaultException.class,
                () -> this.gate.call(() -> adapter.resample(this.density, TestDatasets.UNIT_DOMAIN)));
        assertSame(cause, e.getCause());
        assertFalse(this.gate.isHeld());
    }

    @Test
    void wronglySizedGridsAreResourceFaults() {
        ResamplerAdapter adapter = new ResamplerAdapter(this.dataset, (samples, box, rx, ry) -> new double[rx][ry + 1], this.gate, 16);
        assertThrows(ResourceFaultException.class, () -> this.gate.call(() -> adapter.resample(this.density, TestDatasets.UNIT_DOMAIN)));
    }

    @Test
    void unknownFieldsAreNotWrapped() {
        ResamplerAdapter adapter = new ResamplerAdapter(this.dataset, new PixelizingResampler(), this.gate, 16);
        assertThrows(UnknownFieldException.class,
                () -> this.gate.call(() -> adapter.resample(FieldRef.compound("gas", "pressure"), TestDatasets.UNIT_DOMAIN)));
    }
}
