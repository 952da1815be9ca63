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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.zip.GZIPInputStream;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Splitter;
import com.google.common.geometry.S2LatLng;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads objects from tab separated records whose first column is a WKT {@code LINESTRING (lng lat, lng lat, ...)}.
 * {@code MULTILINESTRING} records are skipped and counted. Objects are numbered from 0 in input order, skipped
 * records excluded. Files ending in {@code .gz} are decompressed.
 */
public class WktLineStringSource implements SpatialObjectSource
{
    private static final Logger logger = LoggerFactory.getLogger(WktLineStringSource.class);

    private static final String LINESTRING = "LINESTRING";
    private static final String MULTILINESTRING = "MULTILINESTRING";
    private static final Splitter COLUMNS = Splitter.on('\t').limit(2);
    private static final Splitter VERTICES = Splitter.on(',').trimResults().omitEmptyStrings();
    private static final Splitter COORDINATES = Splitter.on(' ').trimResults().omitEmptyStrings();

    private final String name;
    private final BufferedReader reader;

    private SpatialObject next;
    private long nextId;
    private long lineNumber;
    private long skipped;
    private boolean exhausted;

    @VisibleForTesting
    WktLineStringSource(String name, BufferedReader reader)
    {
        this.name = name;
        this.reader = reader;
    }

    public static WktLineStringSource open(Path path) throws IOException
    {
        InputStream in = Files.newInputStream(path);
        try
        {
            if (path.getFileName().toString().endsWith(".gz"))
                in = new GZIPInputStream(in);
        }
        catch (IOException e)
        {
            in.close();
            throw e;
        }
        return new WktLineStringSource(path.toString(), new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8)));
    }

    public boolean hasNext()
    {
        if (next != null)
            return true;
        if (exhausted)
            return false;

        try
        {
            String line;
            while ((line = reader.readLine()) != null)
            {
                lineNumber++;
                if (line.isEmpty())
                    continue;

                String geometry = COLUMNS.split(line).iterator().next().trim();
                if (geometry.startsWith(MULTILINESTRING))
                {
                    skipped++;
                    logger.trace("Skipping multi linestring at {}:{}", name, lineNumber);
                    continue;
                }

                next = new SpatialObject(nextId++, parse(geometry));
                return true;
            }
        }
        catch (IOException e)
        {
            throw new UncheckedIOException(e);
        }

        exhausted = true;
        if (skipped > 0)
            logger.warn("Skipped {} multi linestring records in {}", skipped, name);
        return false;
    }

    public SpatialObject next()
    {
        if (!hasNext())
            throw new NoSuchElementException();
        SpatialObject object = next;
        next = null;
        return object;
    }

    private List<S2LatLng> parse(String geometry)
    {
        if (!geometry.startsWith(LINESTRING))
            throw invalid(geometry, null);

        int open = geometry.indexOf('(');
        int close = geometry.lastIndexOf(')');
        if (open < 0 || close < open)
            throw invalid(geometry, null);

        List<S2LatLng> points = new ArrayList<>();
        for (String vertex : VERTICES.split(geometry.substring(open + 1, close)))
        {
            List<String> lngLat = COORDINATES.splitToList(vertex);
            if (lngLat.size() != 2)
                throw invalid(geometry, null);
            try
            {
                double lng = Double.parseDouble(lngLat.get(0));
                double lat = Double.parseDouble(lngLat.get(1));
                points.add(S2LatLng.fromDegrees(lat, lng));
            }
            catch (NumberFormatException e)
            {
                throw invalid(geometry, e);
            }
        }
        if (points.isEmpty())
            throw invalid(geometry, null);
        return points;
    }

    private IllegalArgumentException invalid(String geometry, Throwable cause)
    {
        return new IllegalArgumentException(String.format("Invalid linestring at %s:%d: %s", name, lineNumber, geometry), cause);
    }

    @Override
    public long skipped()
    {
        return skipped;
    }

    public void close()
    {
        try
        {
            reader.close();
        }
        catch (IOException e)
        {
            throw new UncheckedIOException(e);
        }
    }
}
