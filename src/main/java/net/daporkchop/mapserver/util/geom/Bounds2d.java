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

package net.daporkchop.mapserver.util.geom;

import lombok.Data;
import lombok.experimental.Accessors;

import static java.lang.Math.*;

/**
 * An axis-aligned rectangle in physical units.
 *
 * @author DaPorkchop_
 */
@Data
@Accessors(fluent = true)
public final class Bounds2d {
    private final double minX;
    private final double maxX;
    private final double minY;
    private final double maxY;

    public double width() {
        return this.maxX - this.minX;
    }

    public double height() {
        return this.maxY - this.minY;
    }

    /**
     * @return whether the given rectangle lies entirely inside this one
     */
    public boolean contains(Bounds2d other) {
        return other.minX >= this.minX && other.maxX <= this.maxX && other.minY >= this.minY && other.maxY <= this.maxY;
    }

    /**
     * @return whether the closed rectangle {@code [x0,x1]x[y0,y1]} touches this one
     */
    public boolean intersects(double x0, double x1, double y0, double y1) {
        return x1 >= this.minX && x0 <= this.maxX && y1 >= this.minY && y0 <= this.maxY;
    }

    public Bounds2d union(Bounds2d other) {
        return new Bounds2d(min(this.minX, other.minX), max(this.maxX, other.maxX), min(this.minY, other.minY), max(this.maxY, other.maxY));
    }
}
