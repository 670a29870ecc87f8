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

package net.daporkchop.mapserver.field;

import lombok.Getter;
import lombok.NonNull;
import lombok.experimental.Accessors;
import net.daporkchop.mapserver.data.Dataset;
import net.daporkchop.mapserver.server.RenderState;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.google.common.base.Preconditions.*;

/**
 * Enumerates the fields of the served dataset for the map UI.
 *
 * @author DaPorkchop_
 */
@Getter
@Accessors(fluent = true)
public class FieldCatalog {
    /**
     * The deposit kinds offered for every particle type.
     */
    public static final List<String> DEPOSIT_KINDS = Arrays.asList("cic", "density");

    protected final RenderState state;
    protected final String displayUnit;
    protected final double displayScale;
    protected final boolean defaultLog;
    protected final String defaultColormap;

    /**
     * @param displayUnit     the name of the unit the domain width is reported in
     * @param displayScale    the number of display units per dataset length unit
     * @param defaultLog      whether tiles are colored by the logarithm of their values unless a request says otherwise
     * @param defaultColormap the name of the colormap used unless a request says otherwise
     */
    public FieldCatalog(@NonNull RenderState state, @NonNull String displayUnit, double displayScale, boolean defaultLog, @NonNull String defaultColormap) {
        checkArgument(displayScale > 0.0d, "displayScale (%s) must be positive", displayScale);

        this.state = state;
        this.displayUnit = displayUnit;
        this.displayScale = displayScale;
        this.defaultLog = defaultLog;
        this.defaultColormap = defaultColormap;
    }

    /**
     * @return the deposit field of the given kind for the given particle type
     */
    public static FieldRef.Compound depositField(@NonNull String particleType, @NonNull String kind) {
        return FieldRef.compound(Dataset.DEPOSIT_CATEGORY, particleType + '_' + kind);
    }

    public FieldListing listFields() {
        Dataset dataset = this.state.dataset();
        FieldRef active = this.state.activeField();

        Set<FieldRef.Compound> available = new HashSet<>(dataset.derivedFieldList());

        Map<String, List<FieldListing.Entry>> data = new LinkedHashMap<>();
        for (String particleType : dataset.particleTypes()) {
            List<FieldListing.Entry> entries = new ArrayList<>(DEPOSIT_KINDS.size());
            for (String kind : DEPOSIT_KINDS) {
                FieldRef.Compound field = depositField(particleType, kind);
                if (available.contains(field)) { //skip deposits the dataset does not carry
                    entries.add(new FieldListing.Entry(field, active.matches(field)));
                }
            }
            if (!entries.isEmpty()) {
                data.put(particleType, entries);
            }
        }

        for (String fluidType : dataset.fluidTypes()) {
            List<FieldListing.Entry> entries = new ArrayList<>();
            for (FieldRef.Compound field : dataset.derivedFieldList()) {
                if (fluidType.equals(field.category())) {
                    entries.add(new FieldListing.Entry(field, active.matches(field)));
                }
            }
            data.put(fluidType, entries);
        }

        double width = dataset.domain().width() * this.displayScale;
        return new FieldListing(data, width, this.displayUnit, active, this.defaultLog, this.defaultColormap);
    }
}
