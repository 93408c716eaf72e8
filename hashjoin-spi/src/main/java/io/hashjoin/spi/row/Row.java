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
package io.hashjoin.spi.row;

import io.airlift.slice.Slice;

/**
 * A fixed-arity sequence of typed field values. Values are read with the getter matching
 * the field's type; reading a null field with a typed getter is undefined, so callers
 * check {@link #isNull(int)} first.
 */
public interface Row
{
    int getFieldCount();

    boolean isNull(int field);

    boolean getBoolean(int field);

    int getInt(int field);

    long getLong(int field);

    double getDouble(int field);

    Slice getSlice(int field);

    /**
     * Gets a value that has no fixed-width or binary representation, such as an array.
     */
    Object getObject(int field);

    /**
     * Returns true if at least one field of this row is null.
     */
    default boolean anyNull()
    {
        for (int field = 0; field < getFieldCount(); field++) {
            if (isNull(field)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns a row with the same values that shares no mutable state with this row.
     */
    Row copy();

    /**
     * Returns the retained size of this row in memory, including the row object itself.
     */
    long getRetainedSizeInBytes();
}
