/*

Copyright (C) SYSTAP, LLC 2006-2008.  All rights reserved.

Contact:
     SYSTAP, LLC
     4501 Tower Road
     Greensboro, NC 27410
     licenses@bigdata.com

This program is free software; you can redistribute it and/or modify
it under the terms of the GNU General Public License as published by
the Free Software Foundation; version 2 of the License.

This program is distributed in the hope that it will be useful,
but WITHOUT ANY WARRANTY; without even the implied warranty of
MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
GNU General Public License for more details.

You should have received a copy of the GNU General Public License
along with this program; if not, write to the Free Software
Foundation, Inc., 59 Temple Place, Suite 330, Boston, MA  02111-1307  USA

*/
/*
 * Created on Nov 23, 2008
 */

package com.sysreg.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import org.apache.log4j.Logger;

/**
 * Resolves configuration properties for the registry and its collaborators.
 * Defaults are declared by <code>Options</code> interfaces nested in the
 * configured classes. A default may be overridden globally using the property
 * name, or for a specific namespace (typically the name of a registry) using
 * the property name formed by {@link #getOverrideProperty(String, String)}.
 * 
 * @version $Id$
 */
public class Configuration {

    /**
     * Resolved values are logged at INFO.
     */
    protected static final transient Logger log = Logger.getLogger(Configuration.class);

    /**
     * The prefix for the names of namespace specific overrides.
     */
    public static final transient String NAMESPACE = "com.sysreg.namespace";

    /**
     * Separates the components of a namespace and of a property name.
     */
    public static final transient char DOT = '.';

    /**
     * Resolve a property. The first of the following which is defined wins:
     * <ol>
     * <li>the namespace override, e.g.,
     * <code>com.sysreg.namespace.btrfs.com.sysreg.dispatch.Dispatcher.bufferSize</code>
     * for the namespace <code>btrfs</code>;</li>
     * <li>the override for each shorter namespace obtained by dropping the
     * last {@link #DOT} separated component, so <code>fs.btrfs</code> is also
     * configured by an override for <code>fs</code>;</li>
     * <li>the global name of the property;</li>
     * <li>the default.</li>
     * </ol>
     * 
     * @param properties
     *            The configuration.
     * @param namespace
     *            The namespace (optional).
     * @param globalName
     *            The name of the property without any namespace.
     * @param defaultValue
     *            The default (optional).
     * 
     * @return The value -or- <code>null</code> if the property is not defined
     *         and there is no default.
     */
    public static String getProperty(final Properties properties,
            final String namespace, final String globalName,
            final String defaultValue) {

        if (properties == null)
            throw new IllegalArgumentException();

        if (globalName == null)
            throw new IllegalArgumentException();

        for (String key : candidates(namespace, globalName)) {

            final String val = properties.getProperty(key);

            if (val != null) {

                if (log.isInfoEnabled())
                    log.info(key + "=" + val);

                return val;

            }

        }

        if (log.isInfoEnabled())
            log.info(globalName + "=" + defaultValue + " (default)");

        return defaultValue;

    }

    /**
     * The property names consulted for a namespace, most specific first.
     */
    private static List<String> candidates(final String namespace,
            final String globalName) {

        final List<String> keys = new ArrayList<String>();

        if (namespace != null) {

            String ns = namespace;

            while (ns.length() > 0) {

                keys.add(getOverrideProperty(ns, globalName));

                final int pos = ns.lastIndexOf(DOT);

                ns = pos == -1 ? "" : ns.substring(0, pos);

            }

        }

        keys.add(globalName);

        return keys;

    }

    /**
     * Resolve a property and convert it using the validator.
     * 
     * @return The validated value -or- <code>null</code> if the property is
     *         not defined and there is no default.
     * 
     * @throws ConfigurationException
     *             if the value can not be parsed or is not accepted by the
     *             validator.
     */
    public static <E> E getProperty(final Properties properties,
            final String namespace, final String globalName,
            final String defaultValue, final IValidator<E> validator)
            throws ConfigurationException {

        if (validator == null)
            throw new IllegalArgumentException();

        final String val = getProperty(properties, namespace, globalName,
                defaultValue);

        if (val == null)
            return null;

        final E e;

        try {

            e = validator.parse(globalName, val);

        } catch (ConfigurationException ex) {

            throw ex;

        } catch (RuntimeException ex) {

            throw new ConfigurationException(globalName, val, ex.toString());

        }

        validator.accept(globalName, val, e);

        return e;

    }

    /**
     * The name of the property which overrides <i>property</i> for the
     * <i>namespace</i>.
     */
    public static String getOverrideProperty(final String namespace,
            final String property) {

        if (namespace == null)
            throw new IllegalArgumentException();

        if (property == null)
            throw new IllegalArgumentException();

        return NAMESPACE + DOT + namespace + DOT + property;

    }

}
