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

import java.net.URL;

import org.cellindex.exceptions.ConfigurationException;

public interface ConfigurationLoader
{
    String LOADER_PROPERTY = "cellindex.config.loader";

    /**
     * Creates a ConfigurationLoader instance based on the value of the "cellindex.config.loader" system property.
     * When the property is not set, it creates a {@link YamlConfigurationLoader} instance.
     *
     * @throws ConfigurationException if the provided class cannot be constructed.
     */
    static ConfigurationLoader create() throws ConfigurationException
    {
        String loaderClass = System.getProperty(LOADER_PROPERTY);
        if (loaderClass == null)
            return new YamlConfigurationLoader();

        try
        {
            return Class.forName(loaderClass).asSubclass(ConfigurationLoader.class).getDeclaredConstructor().newInstance();
        }
        catch (ReflectiveOperationException | ClassCastException e)
        {
            throw new ConfigurationException("Unable to create configuration loader " + loaderClass, e);
        }
    }

    /**
     * Loads the {@link Config} from its default location.
     *
     * @throws ConfigurationException if the configuration cannot be properly loaded.
     */
    Config loadConfig() throws ConfigurationException;

    /**
     * @param url configuration location.
     * @throws ConfigurationException if the configuration cannot be properly loaded.
     */
    Config loadConfig(URL url) throws ConfigurationException;
}
