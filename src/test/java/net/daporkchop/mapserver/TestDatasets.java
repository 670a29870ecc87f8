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

package net.daporkchop.mapserver;

import net.daporkchop.mapserver.data.InMemoryDataset;
import net.daporkchop.mapserver.field.FieldRef;
import net.daporkchop.mapserver.render.PngTileEncoder;
import net.daporkchop.mapserver.render.TileRenderer;
import net.daporkchop.mapserver.render.ValueNormalizer;
import net.daporkchop.mapserver.resample.PixelizingResampler;
import net.daporkchop.mapserver.resample.Resampler;
import net.daporkchop.mapserver.resample.ResamplerAdapter;
import net.daporkchop.mapserver.server.RenderState;
import net.daporkchop.mapserver.tilematrix.DomainTileMatrix;
import net.daporkchop.mapserver.util.geom.Bounds2d;

/**
 * Small datasets shared by the tests.
 */
public final class TestDatasets {
    public static final int TILE_SIZE = 256;
    public static final Bounds2d UNIT_DOMAIN = new Bounds2d(0.0d, 1.0d, 0.0d, 1.0d);

    private TestDatasets() {
    }

    /**
     * A 4x4 grid of samples tiling {@code [0,1]x[0,1]}, with one particle type "PartType0" and one fluid type "gas".
     * <p>
     * {@code gas:density} ranges from 1 to 100, {@code gas:temperature} from 0 to 15, and {@code deposit:PartType0_density} from -1 to 14.
     */
    public static InMemoryDataset unitGrid() {
        int n = 16;
        double[] px = new double[n];
        double[] py = new double[n];
        double[] pdx = new double[n];
        double[] pdy = new double[n];
        double[] density = new double[n];
        double[] temperature = new double[n];
        double[] deposit = new double[n];
        for (int i = 0; i < n; i++) {
            px[i] = 0.125d + 0.25d * (i & 3);
            py[i] = 0.125d + 0.25d * (i >> 2);
            pdx[i] = 0.125d;
            pdy[i] = 0.125d;
            density[i] = i == n - 1 ? 100.0d : 1.0d + i;
            temperature[i] = i;
            deposit[i] = i - 1.0d;
        }

        return InMemoryDataset.builder()
                .positions(px, py, pdx, pdy)
                .domain(UNIT_DOMAIN)
                .field("gas", "density", density)
                .field("gas", "temperature", temperature)
                .field("deposit", "PartType0_density", deposit)
                .particleType("PartType0")
                .build();
    }

    public static TileRenderer renderer(InMemoryDataset dataset, Resampler resampler) {
        RenderState state = new RenderState(dataset, FieldRef.parse("density"));
        return new TileRenderer(state, new DomainTileMatrix(dataset.domain(), TILE_SIZE),
                new ResamplerAdapter(dataset, resampler, state.gate(), TILE_SIZE),
                new ValueNormalizer(dataset, state.gate(), TILE_SIZE, false),
                new PngTileEncoder());
    }

    public static TileRenderer renderer(InMemoryDataset dataset) {
        return renderer(dataset, new PixelizingResampler());
    }
}
