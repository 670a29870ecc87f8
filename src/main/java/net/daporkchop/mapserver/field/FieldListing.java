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

import lombok.Data;
import lombok.NonNull;
import lombok.experimental.Accessors;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.List;
import java.util.Map;

/**
 * A snapshot of the fields a client may select, as reported by {@link FieldCatalog#listFields()}.
 *
 * @author DaPorkchop_
 */
@Data
@Accessors(fluent = true)
public final class FieldListing {
    /**
     * The selectable fields, keyed by particle or fluid type.
     */
    @NonNull
    private final Map<String, List<Entry>> data;

    /**
     * The width of the domain along the x axis, in {@link #unit()}.
     */
    private final double width;

    @NonNull
    private final String unit;

    @NonNull
    private final FieldRef active;

    /**
     * Whether tiles are colored by the logarithm of their values when a request does not say otherwise.
     */
    private final boolean log;

    /**
     * The name of the colormap used when a request does not say otherwise.
     */
    @NonNull
    private final String colormap;

    /**
     * @return the number of entries flagged as active
     */
    public long activeCount() {
        return this.data.values().stream().flatMap(List::stream).filter(Entry::active).count();
    }

    /**
     * Converts this listing to the document served to the map UI.
     * <p>
     * Fields are written as {@code [category, name]} pairs, and each entry as a {@code [field, active]} pair.
     */
    public JSONObject toJson() {
        JSONObject data = new JSONObject();
        this.data.forEach((type, entries) -> {
            JSONArray array = new JSONArray();
            entries.forEach(entry -> array.put(new JSONArray().put(toJson(entry.field())).put(entry.active())));
            data.put(type, array);
        });

        return new JSONObject()
                .put("data", data)
                .put("width", this.width)
                .put("unit", this.unit)
                .put("active", toJson(this.active))
                .put("log", this.log)
                .put("cmap", this.colormap);
    }

    private static Object toJson(@NonNull FieldRef field) {
        return field instanceof FieldRef.Compound
                ? new JSONArray().put(((FieldRef.Compound) field).category()).put(field.name())
                : field.name();
    }

    /**
     * @author DaPorkchop_
     */
    @Data
    @Accessors(fluent = true)
    public static final class Entry {
        @NonNull
        private final FieldRef.Compound field;
        private final boolean active;
    }
}
