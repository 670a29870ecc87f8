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

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.experimental.Accessors;
import net.daporkchop.mapserver.error.UnknownFieldException;

/**
 * Identifies a scalar field, either by bare name or by {@code (category, name)}.
 *
 * @author DaPorkchop_
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
public abstract class FieldRef {
    /**
     * Separates the category from the name in the textual form of a {@link Compound} reference.
     */
    public static final char SEPARATOR = ',';

    /**
     * Parses a field reference as it appears in a request path.
     *
     * @param text either {@code name} or {@code category,name}
     */
    public static FieldRef parse(@NonNull String text) {
        int idx = text.indexOf(SEPARATOR);
        if (idx < 0) {
            if (text.isEmpty()) {
                throw new UnknownFieldException("empty field name");
            }
            return new Simple(text);
        }

        String category = text.substring(0, idx);
        String name = text.substring(idx + 1);
        if (category.isEmpty() || name.isEmpty() || name.indexOf(SEPARATOR) >= 0) {
            throw new UnknownFieldException(String.format("malformed field reference: \"%s\"", text));
        }
        return new Compound(category, name);
    }

    public static Simple simple(@NonNull String name) {
        return new Simple(name);
    }

    public static Compound compound(@NonNull String category, @NonNull String name) {
        return new Compound(category, name);
    }

    protected final String name;

    protected FieldRef(@NonNull String name) {
        this.name = name;
    }

    /**
     * Checks whether this reference selects the given field. A {@link Simple} reference matches any field with the same name.
     */
    public abstract boolean matches(@NonNull Compound field);

    /**
     * @return the form accepted by {@link #parse(String)}
     */
    @Override
    public abstract String toString();

    @EqualsAndHashCode(callSuper = true)
    public static final class Simple extends FieldRef {
        private Simple(@NonNull String name) {
            super(name);
        }

        @Override
        public boolean matches(@NonNull Compound field) {
            return this.name.equals(field.name);
        }

        @Override
        public String toString() {
            return this.name;
        }
    }

    @Getter
    @Accessors(fluent = true)
    @EqualsAndHashCode(callSuper = true)
    public static final class Compound extends FieldRef {
        private final String category;

        private Compound(@NonNull String category, @NonNull String name) {
            super(name);
            this.category = category;
        }

        @Override
        public boolean matches(@NonNull Compound field) {
            return this.equals(field);
        }

        @Override
        public String toString() {
            return this.category + SEPARATOR + this.name;
        }
    }
}
