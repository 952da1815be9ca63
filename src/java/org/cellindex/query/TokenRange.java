/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.cellindex.query;

import java.util.Objects;

import com.google.common.geometry.S2CellId;

/**
 * Inclusive range of cell tokens, {@code [low, high]}.
 */
public final class TokenRange
{
    public final String low;
    public final String high;

    public TokenRange(String low, String high)
    {
        this.low = low;
        this.high = high;
    }

    /**
     * The range holding the tokens of {@code cell} and of all its descendants.
     */
    public static TokenRange descendantsOf(S2CellId cell)
    {
        return new TokenRange(cell.rangeMin().toToken(), cell.rangeMax().toToken());
    }

    public boolean contains(String token)
    {
        return low.compareTo(token) <= 0 && token.compareTo(high) <= 0;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
            return true;
        if (!(o instanceof TokenRange))
            return false;

        TokenRange that = (TokenRange) o;
        return low.equals(that.low) && high.equals(that.high);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(low, high);
    }

    @Override
    public String toString()
    {
        return String.format("[%s, %s]", low, high);
    }
}
