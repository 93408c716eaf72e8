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
import io.hashjoin.spi.type.Type;

import java.util.Iterator;
import java.util.List;

/**
 * A node of an executable plan. Its output is split into partitions that are
 * produced independently.
 */
public interface PhysicalPlan
{
    List<Type> getOutputTypes();

    int getPartitionCount();

    /**
     * Returns the rows of one partition. The iterator may reuse the row it returns.
     */
    Iterator<Row> execute(int partition);
}
