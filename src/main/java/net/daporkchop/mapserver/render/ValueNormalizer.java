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

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import lombok.Data;
import lombok.NonNull;
import net.daporkchop.mapserver.data.Dataset;
import net.daporkchop.mapserver.data.SampleSet;
import net.daporkchop.mapserver.field.FieldRef;
import net.daporkchop.mapserver.server.RenderGate;
import net.daporkchop.mapserver.util.geom.Bounds2d;

import static com.google.common.base.Preconditions.*;
import static java.lang.Math.*;

/**
 * Computes the {@link ColorBounds} of a field over the whole domain, so that all tiles of a field at one zoom level share one color scale.
 * <p>
 * Samples whose footprint is much smaller than a pixel at the requested zoom level, or larger than a whole tile, are ignored.
 *
 * @author DaPorkchop_
 */
public class ValueNormalizer {
    /**
     * Samples narrower than {@code 1 / SUBPIXEL_DIVISOR} of a pixel do not contribute to the bounds.
     */
    public static final int SUBPIXEL_DIVISOR = 64;

    protected final Dataset dataset;
    protected final RenderGate gate;
    protected final int tileSize;

    protected final Cache<BoundsKey, ColorBounds> cache;

    /**
     * @param cacheBounds whether to remember computed bounds. The dataset handle is immutable, so this never changes the result.
     */
    public ValueNormalizer(@NonNull Dataset dataset, @NonNull RenderGate gate, int tileSize, boolean cacheBounds) {
        checkArgument(tileSize > 0, "tileSize (%s) must be positive", tileSize);

        this.dataset = dataset;
        this.gate = gate;
        this.tileSize = tileSize;
        this.cache = cacheBounds ? CacheBuilder.newBuilder().maximumSize(1024L).build() : null;
    }

    /**
     * Computes the bounds of the given field over the whole domain, using the pixel size of the given zoom level to filter samples.
     */
    public ColorBounds bounds(@NonNull FieldRef.Compound field, int zoom) {
        checkState(this.gate.isHeldByCurrentThread(), "computing color bounds requires exclusive access to the dataset");

        if (this.cache == null) {
            return this.compute(field, zoom);
        }

        BoundsKey key = new BoundsKey(field, zoom);
        ColorBounds bounds = this.cache.getIfPresent(key);
        if (bounds == null) {
            this.cache.put(key, bounds = this.compute(field, zoom));
        }
        return bounds;
    }

    protected ColorBounds compute(@NonNull FieldRef.Compound field, int zoom) {
        Bounds2d domain = this.dataset.domain();
        double tileWidth = domain.width() / (1L << zoom);
        return colorBounds(this.dataset.samples(field), domain, tileWidth / (SUBPIXEL_DIVISOR * this.tileSize), tileWidth);
    }

    /**
     * Finds the minimum and maximum value of all samples which touch the given region and whose half-widths are within the given range.
     *
     * @param minDx the smallest accepted half-width
     * @param maxDx the largest accepted half-width, or a non-positive value to accept arbitrarily large samples
     */
    public static ColorBounds colorBounds(@NonNull SampleSet samples, @NonNull Bounds2d region, double minDx, double maxDx) {
        double[] px = samples.px();
        double[] py = samples.py();
        double[] pdx = samples.pdx();
        double[] pdy = samples.pdy();
        double[] values = samples.values();

        double mi = Double.POSITIVE_INFINITY;
        double ma = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < values.length; i++) {
            if (Double.isNaN(values[i])) {
                continue;
            } else if (!region.intersects(px[i] - pdx[i], px[i] + pdx[i], py[i] - pdy[i], py[i] + pdy[i])) {
                continue;
            } else if (pdx[i] < minDx || pdy[i] < minDx) {
                continue;
            } else if (maxDx > 0.0d && (pdx[i] > maxDx || pdy[i] > maxDx)) {
                continue;
            }

            mi = min(mi, values[i]);
            ma = max(ma, values[i]);
        }
        return mi > ma ? ColorBounds.EMPTY : new ColorBounds(mi, ma);
    }

    @Data
    protected static final class BoundsKey {
        @NonNull
        private final FieldRef.Compound field;
        private final int zoom;
    }
}
