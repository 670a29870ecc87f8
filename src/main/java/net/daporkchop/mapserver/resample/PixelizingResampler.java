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

import lombok.NonNull;
import net.daporkchop.mapserver.data.SampleSet;
import net.daporkchop.mapserver.util.geom.Bounds2d;

import static com.google.common.base.Preconditions.*;
import static java.lang.Math.*;

/**
 * {@link Resampler} which spreads each sample's value over the pixels its footprint overlaps, weighted by the fraction of each pixel it
 * covers.
 * <p>
 * Pixels which no sample touches are left at {@code 0.0}.
 *
 * @author DaPorkchop_
 */
public class PixelizingResampler implements Resampler {
    @Override
    public double[][] pixelize(@NonNull SampleSet samples, @NonNull Bounds2d box, int resolutionX, int resolutionY) {
        checkArgument(resolutionX > 0 && resolutionY > 0, "invalid resolution: %sx%s", resolutionX, resolutionY);

        double[][] grid = new double[resolutionY][resolutionX];
        double pixelWidth = box.width() / resolutionX;
        double pixelHeight = box.height() / resolutionY;

        double[] px = samples.px();
        double[] py = samples.py();
        double[] pdx = samples.pdx();
        double[] pdy = samples.pdy();
        double[] values = samples.values();
        for (int s = 0; s < values.length; s++) {
            double x0 = px[s] - pdx[s];
            double x1 = px[s] + pdx[s];
            double y0 = py[s] - pdy[s];
            double y1 = py[s] + pdy[s];
            if (!box.intersects(x0, x1, y0, y1)) {
                continue;
            }

            int minCol = max(0, (int) floor((x0 - box.minX()) / pixelWidth));
            int maxCol = min(resolutionX - 1, (int) floor((x1 - box.minX()) / pixelWidth));
            int minRow = max(0, (int) floor((y0 - box.minY()) / pixelHeight));
            int maxRow = min(resolutionY - 1, (int) floor((y1 - box.minY()) / pixelHeight));

            for (int row = minRow; row <= maxRow; row++) {
                double pixelY0 = box.minY() + row * pixelHeight;
                double overlapY = min(y1, pixelY0 + pixelHeight) - max(y0, pixelY0);
                if (overlapY <= 0.0d) {
                    continue;
                }

                for (int col = minCol; col <= maxCol; col++) {
                    double pixelX0 = box.minX() + col * pixelWidth;
                    double overlapX = min(x1, pixelX0 + pixelWidth) - max(x0, pixelX0);
                    if (overlapX > 0.0d) {
                        grid[row][col] += values[s] * (overlapX / pixelWidth) * (overlapY / pixelHeight);
                    }
                }
            }
        }
        return grid;
    }
}
