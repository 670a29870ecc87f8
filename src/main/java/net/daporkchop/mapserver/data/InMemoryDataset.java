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

import com.google.common.collect.ImmutableList;
import lombok.Getter;
import lombok.NonNull;
import lombok.experimental.Accessors;
import net.daporkchop.mapserver.error.UnknownFieldException;
import net.daporkchop.mapserver.field.FieldRef;
import net.daporkchop.mapserver.util.geom.Bounds2d;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.*;

/**
 * {@link Dataset} whose samples all share one set of positions and are held in memory.
 *
 * @author DaPorkchop_
 */
@Accessors(fluent = true)
public class InMemoryDataset implements Dataset {
    public static Builder builder() {
        return new Builder();
    }

    @Getter
    protected final Bounds2d domain;
    @Getter
    protected final List<String> particleTypes;
    @Getter
    protected final List<String> fluidTypes;
    @Getter
    protected final List<FieldRef.Compound> derivedFieldList;

    protected final double[] px;
    protected final double[] py;
    protected final double[] pdx;
    protected final double[] pdy;
    protected final Map<FieldRef.Compound, double[]> values;

    //lazily populated, not thread-safe
    protected final Map<FieldRef.Compound, SampleSet> sampleCache = new HashMap<>();

    protected InMemoryDataset(@NonNull Builder builder) {
        this.px = builder.px;
        this.py = builder.py;
        this.pdx = builder.pdx;
        this.pdy = builder.pdy;
        this.values = new LinkedHashMap<>(builder.values);
        this.domain = builder.domain != null ? builder.domain : footprintBounds(this.px, this.py, this.pdx, this.pdy);
        this.particleTypes = ImmutableList.copyOf(builder.particleTypes);
        this.derivedFieldList = ImmutableList.copyOf(this.values.keySet());
        this.fluidTypes = this.derivedFieldList.stream()
                .map(FieldRef.Compound::category)
                .filter(category -> !DEPOSIT_CATEGORY.equals(category))
                .distinct()
                .collect(ImmutableList.toImmutableList());
    }

    protected static Bounds2d footprintBounds(@NonNull double[] px, @NonNull double[] py, @NonNull double[] pdx, @NonNull double[] pdy) {
        checkArgument(px.length != 0, "cannot infer the domain of a dataset without samples");

        Bounds2d bounds = null;
        for (int i = 0; i < px.length; i++) {
            Bounds2d b = new Bounds2d(px[i] - pdx[i], px[i] + pdx[i], py[i] - pdy[i], py[i] + pdy[i]);
            bounds = bounds == null ? b : bounds.union(b);
        }
        return bounds;
    }

    @Override
    public FieldRef.Compound resolve(@NonNull FieldRef ref) {
        for (FieldRef.Compound field : this.derivedFieldList) {
            if (ref.matches(field)) {
                return field;
            }
        }
        throw new UnknownFieldException(String.format("unknown field: \"%s\"", ref));
    }

    @Override
    public SampleSet samples(@NonNull FieldRef.Compound field) {
        SampleSet samples = this.sampleCache.get(field);
        if (samples == null) {
            double[] v = this.values.get(field);
            if (v == null) {
                throw new UnknownFieldException(String.format("unknown field: \"%s\"", field));
            }
            this.sampleCache.put(field, samples = new SampleSet(this.px, this.py, this.pdx, this.pdy, v));
        }
        return samples;
    }

    /**
     * Assembles an {@link InMemoryDataset}.
     *
     * @author DaPorkchop_
     */
    public static final class Builder {
        private double[] px;
        private double[] py;
        private double[] pdx;
        private double[] pdy;
        private Bounds2d domain;
        private final Map<FieldRef.Compound, double[]> values = new LinkedHashMap<>();
        private final List<String> particleTypes = new ArrayList<>();

        private Builder() {
        }

        /**
         * Sets the sample centers and footprint half-widths shared by all fields.
         */
        public Builder positions(@NonNull double[] px, @NonNull double[] py, @NonNull double[] pdx, @NonNull double[] pdy) {
            checkArgument(px.length == py.length && px.length == pdx.length && px.length == pdy.length, "mismatched position array lengths");
            this.px = px;
            this.py = py;
            this.pdx = pdx;
            this.pdy = pdy;
            return this;
        }

        /**
         * Overrides the domain, which otherwise is the union of all sample footprints.
         */
        public Builder domain(@NonNull Bounds2d domain) {
            this.domain = domain;
            return this;
        }

        public Builder field(@NonNull String category, @NonNull String name, @NonNull double[] values) {
            FieldRef.Compound field = FieldRef.compound(category, name);
            checkArgument(this.values.putIfAbsent(field, values) == null, "duplicate field: %s", field);
            return this;
        }

        public Builder particleType(@NonNull String particleType) {
            checkArgument(!this.particleTypes.contains(particleType), "duplicate particle type: %s", particleType);
            this.particleTypes.add(particleType);
            return this;
        }

        public InMemoryDataset build() {
            checkState(this.px != null, "positions must be set");
            this.values.forEach((field, v) -> checkState(v.length == this.px.length,
                    "field %s has %s values, but there are %s samples", field, v.length, this.px.length));
            return new InMemoryDataset(this);
        }
    }
}
