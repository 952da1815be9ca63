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
package org.cellindex.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * The YAML options of an index build and benchmark run. Field names are the YAML keys; see
 * {@link BenchmarkDescriptor} for validation and typed access.
 */
public class Config
{
    /** Covering budget, shared by the objects written to the index and the queries. */
    public int index_min_level = 0;
    public int index_max_level = 30;
    public int index_max_cells = 4;

    /** Query levels, walked from max down to min for every sampled center. */
    public int query_min_level = 8;
    public int query_max_level = 20;

    /** Number of queries per operation, (max - min + 1) * 100 when unset. */
    public Integer query_max_count;

    /** Percentage of the input objects used as query centers. */
    public int query_selectivity_percent = 1;
    public String query_shape = "cell";
    public List<String> query_operations = new ArrayList<>(Arrays.asList("contains", "containing", "intersects"));
    public long sample_seed = 0;

    /** One of distinct, single_cell, index_single_cell. */
    public String count_policy = "single_cell";

    public long progress_interval_ms = 1000;
    public int repeat_count = 1;

    /** Whether repeated runs of an operation record into the same histograms, or each start from empty ones. */
    public boolean accumulate_across_repeats = false;
    public int histogram_reservoir_size = 8192;

    public String jdbc_url;
    public String jdbc_user;
    public String jdbc_password;
    public String postings_table = "postings";
    public String geometries_table = "roads";

    public int sorted_index_block_size_kb = 16;
    public int block_cache_size_mb = 64;

    /** Cap on the objects indexed by a build, unlimited when unset. */
    public Long build_max_objects;
}
