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
import io.hashjoin.spi.type.Type;

import java.util.Iterator;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.collect.ImmutableList.toImmutableList;
import static java.util.Objects.requireNonNull;

/**
 * Leaf plan serving rows that are already in memory.
 */
public class ValuesOperator
        implements PhysicalPlan
{
    private final List<Type> types;
    private final List<List<Row>> partitions;

    public static ValuesOperator singlePartition(List<Type> types, List<Row> rows)
    {
        return new ValuesOperator(types, ImmutableList.of(rows));
    }

    public ValuesOperator(List<Type> types, List<List<Row>> partitions)
    {
        this.types = ImmutableList.copyOf(requireNonNull(types, "types is null"));
        requireNonNull(partitions, "partitions is null");
        checkArgument(!partitions.isEmpty(), "partitions is empty");
        this.partitions = partitions.stream()
                .map(ImmutableList::copyOf)
                .collect(toImmutableList());
        for (List<Row> partition : this.partitions) {
            for (Row row : partition) {
                checkArgument(row.getFieldCount() == types.size(), "Expected rows with %s fields, but got %s", types.size(), row.getFieldCount());
            }
        }
    }

    @Override
    public List<Type> getOutputTypes()
    {
        return types;
    }

    @Override
    public int getPartitionCount()
    {
        return partitions.size();
    }

    @Override
    public Iterator<Row> execute(int partition)
    {
        checkElementIndex(partition, partitions.size(), "partition");
        return partitions.get(partition).iterator();
    }
}
