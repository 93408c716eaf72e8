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

import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import io.airlift.log.Logger;
import io.hashjoin.spi.HashJoinException;
import io.hashjoin.spi.row.Row;
import io.hashjoin.spi.type.Type;
import io.hashjoin.sql.relational.KeyExpression;

import java.util.Iterator;
import java.util.List;
import java.util.function.Supplier;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static io.hashjoin.operator.HashedRelationBuilder.buildHashedRelation;
import static io.hashjoin.operator.RowEncoding.GENERIC;
import static io.hashjoin.operator.RowEncoding.PACKED;
import static io.hashjoin.operator.RowEncoding.selectEncoding;
import static io.hashjoin.spi.StandardErrorCode.INVALID_JOIN_KEYS;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Inner equi-join of two plans. Each partition builds its own hashed relation from the build
 * child and then streams the other child through it. Output columns are the left child's
 * followed by the right child's, whichever side is built.
 */
public class HashJoinOperator
        implements PhysicalPlan
{
    private static final Logger log = Logger.get(HashJoinOperator.class);

    private final PhysicalPlan left;
    private final PhysicalPlan right;
    private final JoinSides joinSides;
    private final JoinConfig config;
    private final List<Type> outputTypes;
    private final Supplier<RowEncoding> rowEncoding = Suppliers.memoize(this::selectRowEncoding);

    public HashJoinOperator(
            PhysicalPlan left,
            List<? extends KeyExpression> leftKeys,
            PhysicalPlan right,
            List<? extends KeyExpression> rightKeys,
            BuildSide buildSide,
            JoinConfig config)
    {
        this.left = requireNonNull(left, "left is null");
        this.right = requireNonNull(right, "right is null");
        requireNonNull(leftKeys, "leftKeys is null");
        requireNonNull(rightKeys, "rightKeys is null");
        this.config = requireNonNull(config, "config is null");

        checkArgument(!leftKeys.isEmpty(), "an equi-join needs at least one key");
        checkArgument(leftKeys.size() == rightKeys.size(), "left and right key counts differ: %s vs %s", leftKeys.size(), rightKeys.size());
        for (int i = 0; i < leftKeys.size(); i++) {
            Type leftType = leftKeys.get(i).getType();
            Type rightType = rightKeys.get(i).getType();
            if (!leftType.equals(rightType)) {
                throw new HashJoinException(INVALID_JOIN_KEYS, format("Join key %s is %s on the left but %s on the right", i, leftType, rightType));
            }
        }
        leftKeys.forEach(key -> key.validate(left.getOutputTypes()));
        rightKeys.forEach(key -> key.validate(right.getOutputTypes()));
        checkArgument(
                left.getPartitionCount() == right.getPartitionCount(),
                "left and right partition counts differ: %s vs %s",
                left.getPartitionCount(),
                right.getPartitionCount());

        this.joinSides = JoinSides.resolve(buildSide, left, leftKeys, right, rightKeys);
        this.outputTypes = ImmutableList.copyOf(Iterables.concat(left.getOutputTypes(), right.getOutputTypes()));
    }

    public PhysicalPlan getLeft()
    {
        return left;
    }

    public PhysicalPlan getRight()
    {
        return right;
    }

    public JoinSides getJoinSides()
    {
        return joinSides;
    }

    public RowEncoding getRowEncoding()
    {
        return rowEncoding.get();
    }

    public boolean outputsPackedRows()
    {
        return getRowEncoding() == PACKED;
    }

    @Override
    public List<Type> getOutputTypes()
    {
        return outputTypes;
    }

    @Override
    public int getPartitionCount()
    {
        return left.getPartitionCount();
    }

    @Override
    public Iterator<Row> execute(int partition)
    {
        return join(partition);
    }

    /**
     * Builds the hashed relation for {@code partition} and returns the iterator probing it.
     * The build side is fully consumed before this method returns.
     *
     * @throws io.hashjoin.ExceededMemoryLimitException if the build side does not fit in the configured memory
     */
    public JoinProbeIterator join(int partition)
    {
        checkElementIndex(partition, getPartitionCount(), "partition");
        RowEncoding encoding = getRowEncoding();

        PhysicalPlan buildPlan = joinSides.getBuildPlan();
        HashedRelation hashedRelation = buildHashedRelation(
                buildPlan.execute(partition),
                KeyExtractor.create(joinSides.getBuildKeys(), buildPlan.getOutputTypes(), encoding),
                encoding.createMaterializer(buildPlan.getOutputTypes()),
                config.getMaxBuildMemory());

        PhysicalPlan streamPlan = joinSides.getStreamPlan();
        return new JoinProbeIterator(
                streamPlan.execute(partition),
                encoding.createInputProjection(streamPlan.getOutputTypes()),
                hashedRelation,
                KeyExtractor.create(joinSides.getStreamKeys(), streamPlan.getOutputTypes(), encoding),
                joinSides.getBuildSide(),
                encoding.createOutputProjection(outputTypes),
                new JoinStatisticsCounter(joinSides.getBuildSide(), encoding, hashedRelation.getRowCount()));
    }

    private RowEncoding selectRowEncoding()
    {
        RowEncoding encoding = selectEncoding(joinSides.getBuildKeys(), outputTypes, config.isPackedRowEncodingEnabled());
        if (encoding == GENERIC && config.isPackedRowEncodingEnabled()) {
            log.debug("Packed rows do not support join keys %s or output types %s, using generic rows", joinSides.getBuildKeys(), outputTypes);
        }
        return encoding;
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("joinSides", joinSides)
                .add("outputTypes", outputTypes)
                .toString();
    }
}
