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
package io.hashjoin.operator;

import io.hashjoin.spi.row.Row;

import java.util.List;

/**
 * Build side of a hash join: a read-only multimap from join key to the build rows
 * sharing that key, in the order they were added.
 */
public interface HashedRelation
{
    /**
     * Returns the rows whose key equals {@code key}, or an empty list. Never null.
     * The key must be of the encoding the relation was built with.
     */
    List<Row> get(Row key);

    long getRowCount();

    int getKeyCount();

    default boolean isEmpty()
    {
        return getRowCount() == 0;
    }

    /**
     * True if no two build rows share a key.
     */
    default boolean isUniqueKey()
    {
        return getRowCount() == getKeyCount();
    }

    long getRetainedSizeInBytes();
}
