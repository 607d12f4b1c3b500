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
package com.sysreg.render;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.apache.log4j.Logger;

import com.sysreg.attr.AttributeDescriptor;
import com.sysreg.registry.INode;
import com.sysreg.registry.PublishFailedException;

/**
 * An {@link IRenderer} which maintains the published directory structure in
 * memory. Each published node is a directory whose path is the path of its
 * parent's directory followed by the name of the node. The attributes of the
 * node are the files in that directory.
 * <p>
 * Unpublishing a node removes its directory together with everything which is
 * published beneath it. A node which was detached from such a directory stays
 * live in the registry but is no longer reachable by path.
 * <p>
 * Publication may be made to fail for a given path using
 * {@link #failPublish(String)}.
 * 
 * @version $Id$
 */
public class InMemoryRenderer implements IRenderer {

    protected static final Logger log = Logger.getLogger(InMemoryRenderer.class);

    /**
     * A published directory.
     */
    private static class Entry {

        final INode node;

        final String path;

        final List<String> attributeNames;

        Entry(final INode node, final String path,
                final List<String> attributeNames) {

            this.node = node;

            this.path = path;

            this.attributeNames = Collections
                    .unmodifiableList(new ArrayList<String>(attributeNames));

        }

    }

    /**
     * Published directories by path.
     */
    private final Map<String, Entry> dirs = new ConcurrentHashMap<String, Entry>();

    /**
     * The path of each published node.
     * <p>
     * Note: Nodes do not override equals() so this is an identity map.
     */
    private final Map<INode, String> paths = new ConcurrentHashMap<INode, String>();

    /**
     * Paths for which publication will be rejected.
     */
    private final Set<String> failures = ConcurrentHashMap.newKeySet();

    synchronized public void publish(final INode node,
            final List<String> attributeNames) throws PublishFailedException {

        if (node == null)
            throw new IllegalArgumentException();

        if (attributeNames == null)
            throw new IllegalArgumentException();

        if (paths.containsKey(node))
            throw new PublishFailedException("Already published: "
                    + paths.get(node));

        final INode parent = node.getParent();

        final String parentPath;

        if (parent == null) {

            parentPath = "";

        } else {

            parentPath = paths.get(parent);

            if (parentPath == null)
                throw new PublishFailedException("Parent not published: "
                        + node.getPath());

        }

        final String path = parentPath + INode.pathSeparator + node.getName();

        if (failures.contains(path))
            throw new PublishFailedException("Rejected: " + path);

        if (dirs.containsKey(path))
            throw new PublishFailedException("Exists: " + path);

        dirs.put(path, new Entry(node, path, attributeNames));

        paths.put(node, path);

        if (log.isDebugEnabled())
            log.debug("Published: " + path + " " + attributeNames);

    }

    synchronized public void unpublish(final INode node) {

        if (node == null)
            throw new IllegalArgumentException();

        final String path = paths.remove(node);

        if (path == null) {

            // Not published.
            return;

        }

        final String prefix = path + INode.pathSeparator;

        final Iterator<Entry> itr = dirs.values().iterator();

        while (itr.hasNext()) {

            final Entry e = itr.next();

            if (e.path.equals(path) || e.path.startsWith(prefix)) {

                itr.remove();

                paths.remove(e.node);

                if (log.isDebugEnabled())
                    log.debug("Unpublished: " + e.path);

            }

        }

    }

    public AttributeRef resolve(final String path) throws PathNotFoundException {

        final String s = normalize(path);

        final int pos = s.lastIndexOf(INode.pathSeparator);

        if (pos <= 0) {

            // A top-level name is a directory, never an attribute.
            throw new PathNotFoundException(path);

        }

        final Entry e = dirs.get(s.substring(0, pos));

        if (e == null)
            throw new PathNotFoundException(path);

        final String name = s.substring(pos + 1);

        if (!e.attributeNames.contains(name))
            throw new PathNotFoundException(path);

        final AttributeDescriptor a = e.node.getType().getAttribute(name);

        if (a == null)
            throw new PathNotFoundException(path);

        return new AttributeRef(e.node, a, s);

    }

    /**
     * The names of the sub-directories and attributes of a published
     * directory.
     * 
     * @param path
     *            The path of the directory. <code>/</code> lists the top
     *            level.
     * 
     * @return The names in sorted order.
     * 
     * @throws PathNotFoundException
     *             if no directory is published at that path.
     */
    public List<String> list(final String path) throws PathNotFoundException {

        final String s = path.equals(INode.pathSeparator) ? "" : normalize(path);

        final List<String> names = new ArrayList<String>();

        if (s.length() > 0) {

            final Entry e = dirs.get(s);

            if (e == null)
                throw new PathNotFoundException(path);

            names.addAll(e.attributeNames);

        }

        final String prefix = s + INode.pathSeparator;

        for (String p : dirs.keySet()) {

            if (p.startsWith(prefix)
                    && p.indexOf(INode.pathSeparator.charAt(0), prefix.length()) == -1) {

                names.add(p.substring(prefix.length()));

            }

        }

        Collections.sort(names);

        return names;

    }

    /**
     * <code>true</code> iff the node is published.
     */
    public boolean isPublished(final INode node) {

        return paths.containsKey(node);

    }

    /**
     * The path under which the node is published -or- <code>null</code> if
     * it is not published.
     */
    public String getPublishedPath(final INode node) {

        return paths.get(node);

    }

    /**
     * Cause the publication of a node at the given path to fail.
     * 
     * @param path
     *            The path, e.g., <code>/health</code>.
     */
    public void failPublish(final String path) {

        failures.add(normalize(path));

    }

    /**
     * Clear any failures set by {@link #failPublish(String)}.
     */
    public void clearFailures() {

        failures.clear();

    }

    /**
     * Returns an absolute path without a trailing separator.
     */
    private static String normalize(String path) {

        if (path == null)
            throw new IllegalArgumentException();

        if (!path.startsWith(INode.pathSeparator))
            path = INode.pathSeparator + path;

        while (path.length() > 1 && path.endsWith(INode.pathSeparator))
            path = path.substring(0, path.length() - 1);

        return path;

    }

}
