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

import lombok.Data;
import lombok.experimental.Accessors;
import net.daporkchop.mapserver.error.InvalidDomainException;

/**
 * The value range which is stretched across a colormap.
 *
 * @author DaPorkchop_
 */
@Data
@Accessors(fluent = true)
public final class ColorBounds {
    /**
     * Bounds of an empty set of values.
     */
    public static final ColorBounds EMPTY = new ColorBounds(Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY);

    private final double min;
    private final double max;

    public boolean isEmpty() {
        return this.min > this.max;
    }

    /**
     * @return these bounds with {@code log10} applied to both ends
     * @throws InvalidDomainException if the lower bound is not positive
     */
    public ColorBounds log10() {
        if (this.isEmpty()) {
            return this;
        } else if (!(this.min > 0.0d)) {
            throw new InvalidDomainException(String.format("cannot take the logarithm of bounds [%s, %s]", this.min, this.max));
        }
        return new ColorBounds(Math.log10(this.min), Math.log10(this.max));
    }

    /**
     * Maps a value into {@code [0, 1]} relative to these bounds. Values outside of the bounds are clamped, and if both bounds are equal
     * every value maps to {@code 0}.
     */
    public double normalize(double value) {
        double range = this.max - this.min;
        if (!(range > 0.0d)) {
            return 0.0d;
        }
        return Math.min(Math.max((value - this.min) / range, 0.0d), 1.0d);
    }
}
