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

import io.airlift.configuration.Config;
import io.airlift.configuration.ConfigDescription;
import io.airlift.units.DataSize;
import io.airlift.units.DataSize.Unit;

import javax.validation.constraints.NotNull;

public class JoinConfig
{
    private boolean packedRowEncodingEnabled = true;
    private DataSize maxBuildMemory = new DataSize(1, Unit.GIGABYTE);

    public boolean isPackedRowEncodingEnabled()
    {
        return packedRowEncodingEnabled;
    }

    @Config("join.packed-row-encoding-enabled")
    @ConfigDescription("Use the packed binary row encoding when all join key and output types support it")
    public JoinConfig setPackedRowEncodingEnabled(boolean packedRowEncodingEnabled)
    {
        this.packedRowEncodingEnabled = packedRowEncodingEnabled;
        return this;
    }

    @NotNull
    public DataSize getMaxBuildMemory()
    {
        return maxBuildMemory;
    }

    @Config("join.max-build-memory")
    @ConfigDescription("Maximum memory the build side of one join partition may hold")
    public JoinConfig setMaxBuildMemory(DataSize maxBuildMemory)
    {
        this.maxBuildMemory = maxBuildMemory;
        return this;
    }
}
