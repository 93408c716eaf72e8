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
import io.airlift.log.Logger;
import io.airlift.units.DataSize;
import io.hashjoin.operator.project.RowProjection;
import io.hashjoin.spi.row.Row;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import org.openjdk.jol.info.ClassLayout;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import static com.google.common.base.Preconditions.checkState;
import static io.airlift.units.DataSize.succinctBytes;
import static io.hashjoin.ExceededMemoryLimitException.exceededBuildMemoryLimit;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Drains the build side of a join into a {@link HashedRelation}. Every stored row and key is
 * charged against the build memory limit; the build fails instead of dropping rows.
 * <p>
 * Rows whose key has a null field are stored like any other row. Such keys never match,
 * since the probe side skips null keys before looking them up.
 */
public class HashedRelationBuilder
{
    private static final Logger log = Logger.get(HashedRelationBuilder.class);

    private static final int BUCKET_INSTANCE_SIZE = ClassLayout.parseClass(ObjectArrayList.class).instanceSize();
    // key reference and bucket index in the open hash map, at its default load factor
    private static final int HASH_ENTRY_SIZE = 2 * (Long.BYTES + Integer.BYTES);

    private final KeyExtractor keyExtractor;
    private final RowProjection materializer;
    private final DataSize maxMemory;
    private final long maxMemoryInBytes;

    private final Object2IntOpenHashMap<Row> keyToBucket = new Object2IntOpenHashMap<>();
    private final List<ObjectArrayList<Row>> buckets = new ObjectArrayList<>();
    private long rowCount;
    private long reservedBytes;
    private boolean finished;

    public static HashedRelation buildHashedRelation(Iterator<Row> buildRows, KeyExtractor keyExtractor, RowProjection materializer, DataSize maxMemory)
    {
        return new HashedRelationBuilder(keyExtractor, materializer, maxMemory)
                .addRows(buildRows)
                .build();
    }

    public HashedRelationBuilder(KeyExtractor keyExtractor, RowProjection materializer, DataSize maxMemory)
    {
        this.keyExtractor = requireNonNull(keyExtractor, "keyExtractor is null");
        this.materializer = requireNonNull(materializer, "materializer is null");
        this.maxMemory = requireNonNull(maxMemory, "maxMemory is null");
        this.maxMemoryInBytes = maxMemory.toBytes();
        keyToBucket.defaultReturnValue(-1);
    }

    public HashedRelationBuilder addRows(Iterator<Row> rows)
    {
        while (rows.hasNext()) {
            addRow(rows.next());
        }
        return this;
    }

    public HashedRelationBuilder addRow(Row row)
    {
        checkState(!finished, "relation already built");
        Row key = keyExtractor.extractKey(row);
        int bucket = keyToBucket.getInt(key);
        if (bucket < 0) {
            // the extracted key may live in a reused buffer
            Row storedKey = key.copy();
            bucket = buckets.size();
            keyToBucket.put(storedKey, bucket);
            buckets.add(new ObjectArrayList<>(1));
            reserve(storedKey.getRetainedSizeInBytes() + BUCKET_INSTANCE_SIZE + HASH_ENTRY_SIZE);
        }

        Row storedRow = materializer.project(row);
        buckets.get(bucket).add(storedRow);
        rowCount++;
        reserve(storedRow.getRetainedSizeInBytes() + Long.BYTES);
        return this;
    }

    public long getReservedBytes()
    {
        return reservedBytes;
    }

    public HashedRelation build()
    {
        checkState(!finished, "relation already built");
        finished = true;

        if (rowCount == 0) {
            return EmptyHashedRelation.INSTANCE;
        }

        ImmutableList.Builder<List<Row>> readOnlyBuckets = ImmutableList.builderWithExpectedSize(buckets.size());
        for (ObjectArrayList<Row> bucket : buckets) {
            bucket.trim();
            readOnlyBuckets.add(Collections.unmodifiableList(bucket));
        }
        HashedRelation relation = new InMemoryHashedRelation(keyToBucket, readOnlyBuckets.build(), rowCount, reservedBytes);
        log.debug("Built hashed relation with %s rows and %s keys (unique: %s) using %s",
                rowCount,
                relation.getKeyCount(),
                relation.isUniqueKey(),
                succinctBytes(reservedBytes));
        return relation;
    }

    private void reserve(long bytes)
    {
        reservedBytes += bytes;
        if (reservedBytes > maxMemoryInBytes) {
            throw exceededBuildMemoryLimit(
                    maxMemory,
                    format("%s rows with %s distinct keys need %s", rowCount, buckets.size(), succinctBytes(reservedBytes)));
        }
    }
}
