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

import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import net.daporkchop.mapserver.field.FieldRef;
import net.daporkchop.mapserver.resample.ResamplerAdapter;
import net.daporkchop.mapserver.server.RenderState;
import net.daporkchop.mapserver.tilematrix.TileMatrix;
import net.daporkchop.mapserver.util.geom.Bounds2d;
import net.daporkchop.mapserver.util.geom.Point2l;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Renders a single tile of a field into an encoded image.
 *
 * @author DaPorkchop_
 */
@Getter
@Accessors(fluent = true)
public class TileRenderer {
    private static final Logger LOGGER = LoggerFactory.getLogger(TileRenderer.class);

    protected final RenderState state;
    protected final TileMatrix tileMatrix;
    protected final ResamplerAdapter resampler;
    protected final ValueNormalizer normalizer;
    protected final TileEncoder encoder;

    public TileRenderer(@NonNull RenderState state, @NonNull TileMatrix tileMatrix, @NonNull ResamplerAdapter resampler,
                        @NonNull ValueNormalizer normalizer, @NonNull TileEncoder encoder) {
        this.state = state;
        this.tileMatrix = tileMatrix;
        this.resampler = resampler;
        this.normalizer = normalizer;
        this.encoder = encoder;
    }

    /**
     * Renders a tile.
     *
     * @param field    the field to render, either {@code name} or {@code category,name}
     * @param zoom     the zoom level
     * @param x        the tile's x coordinate
     * @param y        the tile's y coordinate
     * @param log      whether to color by the base-10 logarithm of the field's values
     * @param colormap the name of the {@link Colormap} to use
     * @return the encoded image
     */
    public byte[] render(@NonNull String field, int zoom, long x, long y, boolean log, @NonNull String colormap) {
        return this.render(FieldRef.parse(field), zoom, x, y, log, Colormap.byName(colormap));
    }

    public byte[] render(@NonNull FieldRef ref, int zoom, long x, long y, boolean log, @NonNull Colormap colormap) {
        long startTime = System.nanoTime();
        Bounds2d box = this.tileMatrix.tileBounds(new Point2l(x, y), zoom);

        Sampled sampled = this.state.gate().call(() -> {
            FieldRef.Compound field = this.state.dataset().resolve(ref);
            double[][] grid = this.resampler.resample(field, box);
            ColorBounds bounds = this.normalizer.bounds(field, zoom);
            return new Sampled(grid, bounds);
        });

        double[][] grid = sampled.grid;
        ColorBounds bounds = sampled.bounds;
        if (log) {
            bounds = bounds.log10();
            for (double[] row : grid) {
                for (int i = 0; i < row.length; i++) {
                    row[i] = Math.log10(row[i]);
                }
            }
        }

        int height = grid.length;
        int width = height == 0 ? 0 : grid[0].length;
        byte[] encoded = this.encoder.encode(colormap.apply(grid, bounds), width, height);

        LOGGER.debug("rendered {} tile {}/{}/{} (log={}, colormap={}, bounds={}) in {}ms",
                ref, zoom, x, y, log, colormap, bounds, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startTime));
        return encoded;
    }

    @RequiredArgsConstructor
    protected static class Sampled {
        @NonNull
        public final double[][] grid;
        @NonNull
        public final ColorBounds bounds;
    }
}
