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
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.openjdk.jol.info.ClassLayout;

import java.util.List;

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.util.Objects.requireNonNull;

/**
 * Hashed relation held on the heap. Keys map to a bucket index; buckets keep rows in
 * insertion order.
 */
final class InMemoryHashedRelation
        implements HashedRelation
{
    private static final int INSTANCE_SIZE = ClassLayout.parseClass(InMemoryHashedRelation.class).instanceSize();

    private final Object2IntOpenHashMap<Row> keyToBucket;
    private final List<List<Row>> buckets;
    private final long rowCount;
    private final long bucketsSizeInBytes;

    InMemoryHashedRelation(Object2IntOpenHashMap<Row> keyToBucket, List<List<Row>> buckets, long rowCount, long bucketsSizeInBytes)
    {
        this.keyToBucket = requireNonNull(keyToBucket, "keyToBucket is null");
        this.buckets = requireNonNull(buckets, "buckets is null");
        this.rowCount = rowCount;
        this.bucketsSizeInBytes = bucketsSizeInBytes;
    }

    @Override
    public List<Row> get(Row key)
    {
        int bucket = keyToBucket.getInt(key);
        if (bucket < 0) {
            return ImmutableList.of();
        }
        return buckets.get(bucket);
    }

    @Override
    public long getRowCount()
    {
        return rowCount;
    }

    @Override
    public int getKeyCount()
    {
        return buckets.size();
    }

    @Override
    public long getRetainedSizeInBytes()
    {
        return INSTANCE_SIZE + bucketsSizeInBytes;
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("rowCount", rowCount)
                .add("keyCount", buckets.size())
                .add("retainedSizeInBytes", getRetainedSizeInBytes())
                .toString();
    }
}
