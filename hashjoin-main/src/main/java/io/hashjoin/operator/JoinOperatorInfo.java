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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static io.hashjoin.operator.JoinStatisticsCounter.HISTOGRAM_BUCKETS;
import static java.util.Objects.requireNonNull;

public class JoinOperatorInfo
{
    private final BuildSide buildSide;
    private final RowEncoding rowEncoding;
    private final long[] logHistogramProbes;
    private final long[] logHistogramOutput;
    private final long nullKeyProbes;
    private final long buildRowCount;

    public static JoinOperatorInfo createJoinOperatorInfo(BuildSide buildSide, RowEncoding rowEncoding, long[] logHistogramCounters, long nullKeyProbes, long buildRowCount)
    {
        long[] logHistogramProbes = new long[HISTOGRAM_BUCKETS];
        long[] logHistogramOutput = new long[HISTOGRAM_BUCKETS];
        for (int i = 0; i < HISTOGRAM_BUCKETS; i++) {
            logHistogramProbes[i] = logHistogramCounters[2 * i];
            logHistogramOutput[i] = logHistogramCounters[2 * i + 1];
        }
        return new JoinOperatorInfo(buildSide, rowEncoding, logHistogramProbes, logHistogramOutput, nullKeyProbes, buildRowCount);
    }

    @JsonCreator
    public JoinOperatorInfo(
            @JsonProperty("buildSide") BuildSide buildSide,
            @JsonProperty("rowEncoding") RowEncoding rowEncoding,
            @JsonProperty("logHistogramProbes") long[] logHistogramProbes,
            @JsonProperty("logHistogramOutput") long[] logHistogramOutput,
            @JsonProperty("nullKeyProbes") long nullKeyProbes,
            @JsonProperty("buildRowCount") long buildRowCount)
    {
        checkArgument(logHistogramProbes.length == HISTOGRAM_BUCKETS);
        checkArgument(logHistogramOutput.length == HISTOGRAM_BUCKETS);
        this.buildSide = requireNonNull(buildSide, "buildSide is null");
        this.rowEncoding = requireNonNull(rowEncoding, "rowEncoding is null");
        this.logHistogramProbes = logHistogramProbes;
        this.logHistogramOutput = logHistogramOutput;
        this.nullKeyProbes = nullKeyProbes;
        this.buildRowCount = buildRowCount;
    }

    @JsonProperty
    public BuildSide getBuildSide()
    {
        return buildSide;
    }

    @JsonProperty
    public RowEncoding getRowEncoding()
    {
        return rowEncoding;
    }

    @JsonProperty
    public long[] getLogHistogramProbes()
    {
        return logHistogramProbes;
    }

    @JsonProperty
    public long[] getLogHistogramOutput()
    {
        return logHistogramOutput;
    }

    /**
     * Stream rows skipped without a lookup because their key had a null field
     */
    @JsonProperty
    public long getNullKeyProbes()
    {
        return nullKeyProbes;
    }

    @JsonProperty
    public long getBuildRowCount()
    {
        return buildRowCount;
    }

    public long getProbeCount()
    {
        return Arrays.stream(logHistogramProbes).sum() + nullKeyProbes;
    }

    public long getOutputRowCount()
    {
        return Arrays.stream(logHistogramOutput).sum();
    }

    public JoinOperatorInfo mergeWith(JoinOperatorInfo other)
    {
        checkState(this.buildSide == other.buildSide, "different build sides");
        checkState(this.rowEncoding == other.rowEncoding, "different row encodings");
        long[] logHistogramProbes = new long[HISTOGRAM_BUCKETS];
        long[] logHistogramOutput = new long[HISTOGRAM_BUCKETS];
        for (int i = 0; i < HISTOGRAM_BUCKETS; i++) {
            logHistogramProbes[i] = this.logHistogramProbes[i] + other.logHistogramProbes[i];
            logHistogramOutput[i] = this.logHistogramOutput[i] + other.logHistogramOutput[i];
        }
        return new JoinOperatorInfo(
                buildSide,
                rowEncoding,
                logHistogramProbes,
                logHistogramOutput,
                this.nullKeyProbes + other.nullKeyProbes,
                this.buildRowCount + other.buildRowCount);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("buildSide", buildSide)
                .add("rowEncoding", rowEncoding)
                .add("logHistogramProbes", logHistogramProbes)
                .add("logHistogramOutput", logHistogramOutput)
                .add("nullKeyProbes", nullKeyProbes)
                .add("buildRowCount", buildRowCount)
                .toString();
    }
}
