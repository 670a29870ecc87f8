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

/**
 * Rasterizes scattered samples onto a uniform pixel grid.
 *
 * @author DaPorkchop_
 */
@FunctionalInterface
public interface Resampler {
    /**
     * Rasterizes the given samples over the given rectangle.
     *
     * @param samples     the samples to rasterize
     * @param box         the rectangle covered by the output grid
     * @param resolutionX the number of pixels along the x axis
     * @param resolutionY the number of pixels along the y axis
     * @return a {@code [resolutionY][resolutionX]} grid, where row 0 touches {@link Bounds2d#minY()} and column 0 touches {@link Bounds2d#minX()}
     */
    double[][] pixelize(@NonNull SampleSet samples, @NonNull Bounds2d box, int resolutionX, int resolutionY);
}
