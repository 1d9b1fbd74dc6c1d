/*
 * Copyright 2018,2019, Regents of the University of Lancaster
 * All rights reserved.
 * 
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions are
 * met:
 * 
 *  * Redistributions of source code must retain the above copyright
 *    notice, this list of conditions and the following disclaimer.
 * 
 *  * Redistributions in binary form must reproduce the above copyright
 *    notice, this list of conditions and the following disclaimer in the
 *    documentation and/or other materials provided with the
 *    distribution.
 * 
 *  * Neither the name of the University of Lancaster nor the names of
 *    its contributors may be used to endorse or promote products derived
 *    from this software without specific prior written permission.
 * 
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS
 * "AS IS" AND ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT
 * LIMITED TO, THE IMPLIED WARRANTIES OF MERCHANTABILITY AND FITNESS FOR
 * A PARTICULAR PURPOSE ARE DISCLAIMED. IN NO EVENT SHALL THE COPYRIGHT
 * OWNER OR CONTRIBUTORS BE LIABLE FOR ANY DIRECT, INDIRECT, INCIDENTAL,
 * SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES (INCLUDING, BUT NOT
 * LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES; LOSS OF USE,
 * DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND ON ANY
 * THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
 * (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE
 * OF THIS SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.
 *
 *
 * Author: Steven Simpson <s.simpson@lancaster.ac.uk>
 */

package uk.ac.lancs.config;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.net.URI;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Properties;

import org.junit.Test;

public class TestConfiguration {
    private URI sample() throws Exception {
        return getClass().getResource("sample.properties").toURI();
    }

    @Test
    public void testGet() throws Exception {
        Configuration conf = new ConfigurationContext().get(sample());
        assertEquals("sample", conf.get("name"));
        assertEquals("localhost", conf.get("db.host"));
        assertNull(conf.get("db.user"));
        assertEquals("nobody", conf.get("db.user", "nobody"));
    }

    @Test
    public void testSubview() throws Exception {
        Configuration db = new ConfigurationContext().get(sample())
            .subview("db");
        assertEquals("5432", db.get("port"));
        assertEquals(new HashSet<>(Arrays.asList("host", "port", "pool.size")),
                     db.keys());
        assertEquals("4", db.subview("pool").get("size"));
        assertEquals("4", db.subview("..pool.").get("size"));
    }

    @Test
    public void testFragment() throws Exception {
        URI location = new URI(sample().toString() + "#db.pool");
        Configuration pool = new ConfigurationContext().get(location);
        assertEquals("4", pool.get("size"));
    }

    @Test
    public void testCached() throws Exception {
        ConfigurationContext ctxt = new ConfigurationContext();
        assertSame(ctxt.get(sample()), ctxt.get(sample()));
    }

    @Test
    public void testDefaults() throws Exception {
        Properties defaults = new Properties();
        defaults.setProperty("db.user", "admin");
        Configuration conf = new ConfigurationContext(defaults).get(sample());
        assertEquals("admin", conf.get("db.user"));
    }

    @Test
    public void testList() throws Exception {
        Configuration conf = new ConfigurationContext().get(sample());
        assertEquals(Arrays.asList("a", "b", "c"), conf.getList("list"));
        assertNull(conf.getList("missing"));
    }

    @Test
    public void testKeysWithPrefix() throws Exception {
        Configuration conf = new ConfigurationContext().get(sample());
        assertEquals(new HashSet<>(Arrays.asList("db.pool.size")),
                     conf.keys("db.pool"));
        assertEquals(Arrays.asList("host", "pool", "port"),
                     conf.children("db"));
    }

    @Test
    public void testNormalize() {
        assertEquals("a.b", Configuration.normalizeKey(".a..b."));
        assertEquals("a.b.", Configuration.normalizePrefix("a.b"));
        assertEquals("", Configuration.normalizePrefix(""));
    }

    @Test
    public void testToProperties() {
        Properties props = new Properties();
        props.setProperty("x.y", "1");
        Properties copy = ConfigurationContext.of(props).subview("x")
            .toProperties();
        assertEquals("1", copy.getProperty("y"));
        assertTrue(copy.size() == 1);
    }
}
