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

import java.io.IOException;
import java.io.InputStream;
import java.net.MalformedURLException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.introspector.PropertyUtils;

import org.cellindex.exceptions.ConfigurationException;

/**
 * Loads {@link Config} from YAML. The location is taken from the "cellindex.config" system property: a URL, a file
 * path or a classpath resource, {@code cellindex.yaml} on the classpath by default. Unknown keys are rejected.
 */
public class YamlConfigurationLoader implements ConfigurationLoader
{
    private static final Logger logger = LoggerFactory.getLogger(YamlConfigurationLoader.class);

    public static final String CONFIG_PROPERTY = "cellindex.config";
    public static final String DEFAULT_CONFIG = "cellindex.yaml";

    public static URL configURL(String location) throws ConfigurationException
    {
        URL url;
        try
        {
            url = new URL(location);
            url.openStream().close(); // catches well-formed but bogus URLs
        }
        catch (IOException e)
        {
            Path path = Paths.get(location);
            if (Files.isRegularFile(path))
            {
                try
                {
                    url = path.toUri().toURL();
                }
                catch (MalformedURLException malformed)
                {
                    throw new ConfigurationException("Invalid configuration path " + location, malformed);
                }
            }
            else
            {
                url = YamlConfigurationLoader.class.getClassLoader().getResource(location);
                if (url == null)
                    throw new ConfigurationException("Cannot locate " + location + " as a URL, a file or a classpath resource", false);
            }
        }

        logger.info("Configuration location: {}", url);
        return url;
    }

    @Override
    public Config loadConfig() throws ConfigurationException
    {
        return loadConfig(configURL(System.getProperty(CONFIG_PROPERTY, DEFAULT_CONFIG)));
    }

    @Override
    public Config loadConfig(URL url) throws ConfigurationException
    {
        logger.debug("Loading settings from {}", url);
        try (InputStream is = url.openStream())
        {
            Config config = newYaml().loadAs(is, Config.class);
            return config == null ? new Config() : config;
        }
        catch (YAMLException e)
        {
            throw new ConfigurationException("Invalid yaml: " + url + ": " + e.getMessage(), e);
        }
        catch (IOException e)
        {
            throw new ConfigurationException("Cannot read " + url, e);
        }
    }

    public Config loadConfig(String yaml) throws ConfigurationException
    {
        try
        {
            Config config = newYaml().loadAs(yaml, Config.class);
            return config == null ? new Config() : config;
        }
        catch (YAMLException e)
        {
            throw new ConfigurationException("Invalid yaml: " + e.getMessage(), e);
        }
    }

    private static Yaml newYaml()
    {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Constructor constructor = new Constructor(Config.class, options);
        PropertyUtils propertyUtils = new PropertyUtils();
        propertyUtils.setSkipMissingProperties(false);
        constructor.setPropertyUtils(propertyUtils);
        return new Yaml(constructor);
    }
}
