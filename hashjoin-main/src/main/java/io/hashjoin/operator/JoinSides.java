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
import io.hashjoin.sql.relational.KeyExpression;

import java.util.List;

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.util.Objects.requireNonNull;

/**
 * Which child of a join is hashed (build) and which is iterated (stream).
 */
public final class JoinSides
{
    private final BuildSide buildSide;
    private final PhysicalPlan buildPlan;
    private final PhysicalPlan streamPlan;
    private final List<KeyExpression> buildKeys;
    private final List<KeyExpression> streamKeys;

    public static JoinSides resolve(
            BuildSide buildSide,
            PhysicalPlan left,
            List<? extends KeyExpression> leftKeys,
            PhysicalPlan right,
            List<? extends KeyExpression> rightKeys)
    {
        switch (requireNonNull(buildSide, "buildSide is null")) {
            case BUILD_LEFT:
                return new JoinSides(buildSide, left, right, leftKeys, rightKeys);
            case BUILD_RIGHT:
                return new JoinSides(buildSide, right, left, rightKeys, leftKeys);
            default:
                throw new IllegalArgumentException("Unsupported build side: " + buildSide);
        }
    }

    private JoinSides(
            BuildSide buildSide,
            PhysicalPlan buildPlan,
            PhysicalPlan streamPlan,
            List<? extends KeyExpression> buildKeys,
            List<? extends KeyExpression> streamKeys)
    {
        this.buildSide = buildSide;
        this.buildPlan = requireNonNull(buildPlan, "buildPlan is null");
        this.streamPlan = requireNonNull(streamPlan, "streamPlan is null");
        this.buildKeys = ImmutableList.copyOf(requireNonNull(buildKeys, "buildKeys is null"));
        this.streamKeys = ImmutableList.copyOf(requireNonNull(streamKeys, "streamKeys is null"));
    }

    public BuildSide getBuildSide()
    {
        return buildSide;
    }

    public PhysicalPlan getBuildPlan()
    {
        return buildPlan;
    }

    public PhysicalPlan getStreamPlan()
    {
        return streamPlan;
    }

    public List<KeyExpression> getBuildKeys()
    {
        return buildKeys;
    }

    public List<KeyExpression> getStreamKeys()
    {
        return streamKeys;
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("buildSide", buildSide)
                .add("buildKeys", buildKeys)
                .add("streamKeys", streamKeys)
                .toString();
    }
}
