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

package net.daporkchop.mapserver.data;

import lombok.Getter;
import lombok.NonNull;
import lombok.experimental.Accessors;

import static com.google.common.base.Preconditions.*;

/**
 * Scattered samples of one field: sample centers, half-widths of each sample's footprint, and values.
 * <p>
 * The arrays are shared, not copied, and must not be modified.
 *
 * @author DaPorkchop_
 */
@Getter
@Accessors(fluent = true)
public final class SampleSet {
    private final double[] px;
    private final double[] py;
    private final double[] pdx;
    private final double[] pdy;
    private final double[] values;

    public SampleSet(@NonNull double[] px, @NonNull double[] py, @NonNull double[] pdx, @NonNull double[] pdy, @NonNull double[] values) {
        int n = values.length;
        checkArgument(px.length == n && py.length == n && pdx.length == n && pdy.length == n,
                "mismatched sample array lengths: px=%s py=%s pdx=%s pdy=%s values=%s", px.length, py.length, pdx.length, pdy.length, n);

        this.px = px;
        this.py = py;
        this.pdx = pdx;
        this.pdy = pdy;
        this.values = values;
    }

    public int size() {
        return this.values.length;
    }
}
