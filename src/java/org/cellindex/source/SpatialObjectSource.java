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
package org.cellindex.source;

import java.io.IOException;

import org.cellindex.utils.CloseableIterator;

public interface SpatialObjectSource extends CloseableIterator<SpatialObject>
{
    /**
     * @return the number of input records passed over because they could not be turned into an object
     */
    default long skipped()
    {
        return 0;
    }

    interface Factory
    {
        /**
         * Opens a new source positioned at the first object.
         */
        SpatialObjectSource open() throws IOException;
    }
}
