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
 * Writes the fields of one row in order. After {@link #build()} the builder is reset
 * and can be used for the next row.
 */
public interface RowBuilder
{
    RowBuilder appendNull();

    RowBuilder appendBoolean(boolean value);

    RowBuilder appendInt(int value);

    RowBuilder appendLong(long value);

    RowBuilder appendDouble(double value);

    RowBuilder appendSlice(Slice value);

    RowBuilder appendObject(Object value);

    /**
     * Discards any fields written since the last row was built.
     */
    void reset();

    /**
     * Returns the row holding all appended fields. Implementations may return
     * a row backed by a buffer that the next call overwrites.
     */
    Row build();
}
