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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Properties;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Views a set of named configuration properties. Property names are the
 * same as for Java properties files.
 * 
 * <p>
 * Subviews of a configuration are obtainable. For example, if the
 * subview <samp>foo.bar</samp> is obtained, then only properties whose
 * names in the original view begin with <samp>foo.bar.</samp> will be
 * visible. Furthermore, their names will lack the prefix
 * <samp>foo.bar.</samp>.
 * 
 * @author simpsons
 */
public interface Configuration {
    /**
     * Get a configuration parameter.
     * 
     * @param key the parameter key
     * 
     * @return the parameter's value, or {@code null} if not present
     */
    String get(String key);

    /**
     * Get a configuration parameter, or a default.
     * 
     * @param key the parameter key
     * 
     * @param defaultValue the value to return if the parameter is not
     * set
     * 
     * @return the parameter's value, or <samp>defaultValue</samp> if
     * not set
     */
    default String get(String key, String defaultValue) {
        String value = get(key);
        if (value == null) return defaultValue;
        return value;
    }

    /**
     * Get a configuration parameter as a space- or comma-separated
     * list.
     * 
     * @param key the parameter key
     * 
     * @return the non-empty items of the parameter's value, or
     * {@code null} if not present
     */
    default List<String> getList(String key) {
        String value = get(key);
        if (value == null) return null;
        return Arrays.asList(LIST_SEPARATOR.split(value.trim())).stream()
            .filter(s -> !s.isEmpty()).collect(Collectors.toList());
    }

    /**
     * Get a subview.
     * 
     * @param prefix the additional prefix to narrow down the available
     * parameters
     * 
     * @return the requested subview
     */
    Configuration subview(String prefix);

    /**
     * List keys in this configuration.
     * 
     * @return the keys
     */
    Set<String> keys();

    /**
     * List keys with a given prefix.
     * 
     * @param prefix the prefix, which will be normalized
     * 
     * @return the keys beginning with the normalized prefix, in full
     */
    default Set<String> keys(String prefix) {
        String safePrefix = normalizePrefix(prefix);
        if (safePrefix.isEmpty()) return keys();
        Set<String> result = new LinkedHashSet<>();
        for (String key : keys())
            if (key.startsWith(safePrefix)) result.add(key);
        return Collections.unmodifiableSet(result);
    }

    /**
     * List the distinct first components of keys with a given prefix.
     * For example, with keys <samp>a.x.1</samp>, <samp>a.x.2</samp> and
     * <samp>a.y</samp>, the children of <samp>a</samp> are
     * <samp>x</samp> and <samp>y</samp>.
     * 
     * @param prefix the prefix, which will be normalized
     * 
     * @return the next key component after the prefix, for each key
     * with the prefix
     */
    default List<String> children(String prefix) {
        String safePrefix = normalizePrefix(prefix);
        Set<String> result = new LinkedHashSet<>();
        for (String key : keys(prefix)) {
            String rest = key.substring(safePrefix.length());
            int dot = rest.indexOf('.');
            result.add(dot < 0 ? rest : rest.substring(0, dot));
        }
        return new ArrayList<>(result);
    }

    /**
     * Convert the properties in this configuration into a conventional
     * Java properties object.
     * 
     * @return a copy of this configuration's properties
     */
    default Properties toProperties() {
        Properties result = new Properties();
        for (String key : keys())
            result.setProperty(key, get(key));
        return result;
    }

    /**
     * Normalize a node key. Double dots are condensed to single ones.
     * Leading and trailing dots are removed.
     * 
     * @param key the node key to normalize
     * 
     * @return the normalized node key
     */
    static String normalizeKey(String key) {
        if (key == null) return null;
        return Arrays.asList(key.split("\\.+")).stream()
            .filter(s -> !s.isEmpty()).collect(Collectors.joining("."));
    }

    /**
     * Normalize a node key prefix.
     * 
     * @param prefix the node key prefix to normalize
     * 
     * @return the normalized prefix, ending in a dot unless empty
     */
    static String normalizePrefix(String prefix) {
        if (prefix == null) return null;
        String key = normalizeKey(prefix);
        return key.isEmpty() ? "" : key + '.';
    }

    /**
     * Separates items of list-valued parameters
     */
    static final Pattern LIST_SEPARATOR = Pattern.compile("[\\s,]+");
}
