/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.hashjoin.spi.type;

import io.hashjoin.spi.row.Row;
import io.hashjoin.spi.row.RowBuilder;

import javax.annotation.Nullable;

public interface Type
{
    /**
     * Returns the name of this type that should be displayed to end-users.
     */
    String getDisplayName();

    /**
     * Gets the Java class type used to represent this value in a row.
     */
    Class<?> getJavaType();

    /**
     * True if values of this type can be stored in the packed binary row layout.
     */
    boolean isPackable();

    /**
     * Gets an object representation of the type value in the {@code row}
     * {@code field}. This is the value a user sees, for example a String for
     * varchar. Returns null for a null field.
     */
    @Nullable
    Object getObjectValue(Row row, int field);

    /**
     * Appends the value at {@code field} of {@code row} to the builder, including nulls.
     */
    void appendTo(Row row, int field, RowBuilder rowBuilder);

    /**
     * Appends a user value, as returned by {@link #getObjectValue}, to the builder.
     */
    void writeObject(RowBuilder rowBuilder, @Nullable Object value);
}
