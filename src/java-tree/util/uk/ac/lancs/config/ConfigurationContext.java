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

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.net.URLConnection;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Loads and caches configurations. A configuration loaded twice
 * through the same context is fetched only once.
 * 
 * @author simpsons
 */
public final class ConfigurationContext {
    private final Map<URI, BaseConfiguration> cache = new HashMap<>();
    private final Properties defaults;

    /**
     * Create a configuration context with a set of default parameters.
     * 
     * @param defaults the default parameters as Java properties
     */
    public ConfigurationContext(Properties defaults) {
        this.defaults = defaults;
    }

    /**
     * Create a configuration context with no defaults.
     */
    public ConfigurationContext() {
        this.defaults = new Properties();
    }

    /**
     * Get the configuration for a given location. The fragment may be a
     * subview identifier.
     * 
     * @param location the location to load the configuration from
     * 
     * @return the requested configuration
     * 
     * @throws IOException if there was an error loading the
     * configuration
     */
    public synchronized Configuration get(URI location) throws IOException {
        location = location.normalize();
        String fragment = location.getFragment();
        if (fragment != null) location = defragment(location);
        BaseConfiguration root = cache.get(location);
        if (root == null) {
            root = new BaseConfiguration(location, load(location, defaults));
            cache.put(location, root);
            final URI loaded = location;
            logger.fine(() -> String.format("loaded configuration %s",
                                            loaded));
        }
        if (fragment != null) return root.subview(fragment);
        return root;
    }

    /**
     * Get the configuration from a file.
     * 
     * <p>
     * This method simply converts the {@link File} into a {@link URI},
     * and calls {@link #get(URI)}.
     * 
     * @param file the location to load the configuration from
     * 
     * @return the requested configuration
     * 
     * @throws IOException if there was an error loading the
     * configuration
     */
    public Configuration get(File file) throws IOException {
        return get(file.toURI());
    }

    /**
     * Get the configuration from a file named by a string.
     * 
     * @param name the name of the file to load the configuration from
     * 
     * @return the requested configuration
     * 
     * @throws IOException if there was an error loading the
     * configuration
     */
    public Configuration get(String name) throws IOException {
        return get(new File(name));
    }

    /**
     * Create a configuration from properties already in memory. The
     * result is not cached, and the context's defaults do not apply.
     * 
     * @param props the properties
     * 
     * @return a configuration viewing a snapshot of the properties
     */
    public static Configuration of(Properties props) {
        return new BaseConfiguration(null, props);
    }

    private static Properties load(URI location, Properties defaults)
        throws IOException {
        URL url = location.toURL();
        URLConnection conn = url.openConnection();
        try (InputStream in = conn.getInputStream()) {
            Properties result = new Properties(defaults);
            result.load(in);
            return result;
        }
    }

    private static URI defragment(URI location) {
        try {
            return new URI(location.getScheme(),
                           location.getSchemeSpecificPart(), null);
        } catch (URISyntaxException ex) {
            throw new AssertionError("unreachable", ex);
        }
    }

    private static final Logger logger =
        Logger.getLogger(ConfigurationContext.class.getName());
}
