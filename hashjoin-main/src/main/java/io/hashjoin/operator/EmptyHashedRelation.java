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

import com.google.common.collect.ImmutableList;
import io.hashjoin.spi.row.Row;

import java.util.List;

final class EmptyHashedRelation
        implements HashedRelation
{
    public static final EmptyHashedRelation INSTANCE = new EmptyHashedRelation();

    private EmptyHashedRelation() {}

    @Override
    public List<Row> get(Row key)
    {
        return ImmutableList.of();
    }

    @Override
    public long getRowCount()
    {
        return 0;
    }

    @Override
    public int getKeyCount()
    {
        return 0;
    }

    @Override
    public long getRetainedSizeInBytes()
    {
        return 0;
    }
}
