/*
 * Copyright 2019 CS Systemes d'Information
 *
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
package fr.cs.ikats.api.configuration;

import com.typesafe.config.ConfigFactory;
import net.sf.oval.exception.ConstraintsViolatedException;
import org.junit.Assert;
import org.junit.Test;

import java.net.URI;
import java.time.Duration;

/**
 * Tests for the {@link IkatsConfiguration} class.
 *
 * @author CS Systemes d'Information
 */
public class IkatsConfigurationTest {

    @Test
    public void testDefaults() {
        final IkatsConfiguration configuration = new IkatsConfiguration.Builder().build();
        Assert.assertEquals("http://localhost", configuration.getHost());
        Assert.assertEquals(80, configuration.getPort());
        Assert.assertEquals(Duration.ofSeconds(300), configuration.getRequestTimeout());
        Assert.assertFalse(configuration.isEmulate());
        Assert.assertEquals("IKATS_SESSION", configuration.getName());
        Assert.assertEquals(
                URI.create("http://localhost:80/datamodel/TemporalDataManagerWebApp/webapi"),
                configuration.getDatamodelUri());
        Assert.assertEquals(URI.create("http://localhost:80/tsdb"), configuration.getTsdbUri());
        Assert.assertEquals(URI.create("http://localhost:80/pybase/ikats/algo/catalogue"), configuration.getCatalogUri());
    }

    @Test
    public void testHostNormalized() {
        final IkatsConfiguration configuration = new IkatsConfiguration.Builder()
                .setHost("ikats.example.org/")
                .setPort(8080)
                .build();
        Assert.assertEquals("http://ikats.example.org", configuration.getHost());
        Assert.assertEquals(URI.create("http://ikats.example.org:8080/tsdb"), configuration.getTsdbUri());
    }

    @Test
    public void testHttpsHostKept() {
        final IkatsConfiguration configuration = new IkatsConfiguration.Builder()
                .setHost("https://ikats.example.org")
                .build();
        Assert.assertEquals("https://ikats.example.org", configuration.getHost());
    }

    @Test
    public void testFromConfig() {
        final IkatsConfiguration configuration = IkatsConfiguration.fromConfig(ConfigFactory.parseString(
                "ikats { host = \"10.0.0.1\", port = 9000, tsdbPath = \"/opentsdb\", requestTimeout = 5s, "
                        + "emulate = true, name = \"test\" }"));
        Assert.assertEquals("http://10.0.0.1", configuration.getHost());
        Assert.assertEquals(9000, configuration.getPort());
        Assert.assertEquals("/opentsdb", configuration.getTsdbPath());
        Assert.assertEquals("/datamodel", configuration.getDatamodelPath());
        Assert.assertEquals(Duration.ofSeconds(5), configuration.getRequestTimeout());
        Assert.assertTrue(configuration.isEmulate());
        Assert.assertEquals("test", configuration.getName());
    }

    @Test
    public void testFromConfigWithoutBlock() {
        final IkatsConfiguration configuration = IkatsConfiguration.fromConfig(ConfigFactory.empty());
        Assert.assertEquals(80, configuration.getPort());
    }

    @Test
    public void testReferenceConfiguration() {
        final IkatsConfiguration configuration = IkatsConfiguration.fromConfig(ConfigFactory.defaultReference());
        Assert.assertEquals("/pybase", configuration.getCatalogPath());
        Assert.assertFalse(configuration.isEmulate());
    }

    @Test(expected = ConstraintsViolatedException.class)
    public void testInvalidPort() {
        new IkatsConfiguration.Builder().setPort(70000).build();
    }

    @Test(expected = ConstraintsViolatedException.class)
    public void testNonPositiveTimeout() {
        new IkatsConfiguration.Builder().setRequestTimeout(Duration.ZERO).build();
    }

    @Test(expected = ConstraintsViolatedException.class)
    public void testEmptyName() {
        new IkatsConfiguration.Builder().setName("").build();
    }
}
