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
package org.cellindex.index;

import java.util.Objects;

import com.google.common.base.Preconditions;

/**
 * One posting: object {@code id} is covered by the cell with token {@code token}. Ordered by token, then id.
 */
public final class PostingEntry implements Comparable<PostingEntry>
{
    public final String token;
    public final long id;

    public PostingEntry(String token, long id)
    {
        Preconditions.checkArgument(id >= 0, "Object ids must not be negative, got %s", id);
        this.token = Preconditions.checkNotNull(token);
        this.id = id;
    }

    public int compareTo(PostingEntry that)
    {
        int cmp = token.compareTo(that.token);
        return cmp != 0 ? cmp : Long.compare(id, that.id);
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
            return true;
        if (!(o instanceof PostingEntry))
            return false;

        PostingEntry that = (PostingEntry) o;
        return id == that.id && token.equals(that.token);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(token, id);
    }

    @Override
    public String toString()
    {
        return "(" + token + ", " + id + ')';
    }
}
