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
package com.sysreg.registry;

import java.lang.ref.WeakReference;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import com.sysreg.attr.NodeType;

/**
 * A registry node. Nodes are created by
 * {@link Registry#create(String, NodeType, INode, Object)} with a reference
 * count of ONE (1), which is the handle of the creator. The reference count is
 * mutated atomically. Once it reaches zero it never increases again and the
 * {@link Registry} finalizes the node.
 * <p>
 * Structural edits of the children of a node are made while holding the
 * monitor of that node.
 * 
 * @version $Id$
 */
public final class Node implements INode {

    private final Registry registry;

    private final String name;

    private final NodeType type;

    private final AtomicInteger refCount = new AtomicInteger(1);

    /**
     * The parent -or- <code>null</code> for a root or a detached node.
     */
    private volatile WeakReference<Node> parent;

    final Map<String, Node> children = new ConcurrentHashMap<String, Node>();

    private volatile Object payload;

    /**
     * Set once the node has been finalized (or abandoned after a failed
     * publish). Guarded by the monitor of this node.
     */
    private boolean destroyed = false;

    Node(final Registry registry, final String name, final NodeType type,
            final Node parent, final Object payload) {

        if (registry == null)
            throw new IllegalArgumentException();

        if (name == null)
            throw new IllegalArgumentException();

        if (type == null)
            throw new IllegalArgumentException();

        this.registry = registry;

        this.name = name;

        this.type = type;

        this.parent = parent == null ? null : new WeakReference<Node>(parent);

        this.payload = payload;

    }

    Registry getRegistry() {

        return registry;

    }

    public String getName() {

        return name;

    }

    public NodeType getType() {

        return type;

    }

    public Node getParent() {

        final WeakReference<Node> ref = parent;

        return ref == null ? null : ref.get();

    }

    /**
     * Clears the parent link.
     */
    void detach() {

        parent = null;

    }

    public String getPath() {

        final Node p = getParent();

        if (p == null) {

            /*
             * Handles: "/foo".
             */

            return pathSeparator + name;

        }

        /*
         * Handles "/foo/bar", etc.
         */

        return p.getPath() + pathSeparator + name;

    }

    public int getRefCount() {

        return refCount.get();

    }

    public boolean isLive() {

        return refCount.get() > 0;

    }

    /**
     * Take an additional reference unless the count has already reached
     * zero.
     * 
     * @return <code>false</code> iff the node is no longer live.
     */
    boolean get() {

        while (true) {

            final int c = refCount.get();

            if (c == 0)
                return false;

            if (refCount.compareAndSet(c, c + 1))
                return true;

        }

    }

    /**
     * Drop a reference.
     * 
     * @return <code>true</code> iff this was the last reference, in which
     *         case the caller is responsible for finalizing the node.
     * 
     * @throws NodeDestroyedException
     *             if the count was already zero.
     */
    boolean put() {

        while (true) {

            final int c = refCount.get();

            if (c == 0)
                throw new NodeDestroyedException(getPath());

            if (refCount.compareAndSet(c, c - 1))
                return c == 1;

        }

    }

    /**
     * Marks the node as destroyed and detaches its children.
     * 
     * @return The children which were detached.
     */
    synchronized List<Node> markDestroyed() {

        destroyed = true;

        final List<Node> orphans = new ArrayList<Node>(children.values());

        children.clear();

        for (Node child : orphans) {

            child.detach();

        }

        return orphans;

    }

    /**
     * Used to roll back a node which was never published. The reference count
     * is cleared without finalizing the node.
     */
    synchronized void abandon() {

        destroyed = true;

        refCount.set(0);

        detach();

    }

    /**
     * <code>true</code> iff children may still be attached. Only valid while
     * holding the monitor of this node.
     */
    boolean isAcceptingChildren() {

        return !destroyed && refCount.get() > 0;

    }

    void clearPayload() {

        payload = null;

    }

    public Node getChild(final String name) {

        if (name == null)
            throw new IllegalArgumentException();

        return children.get(name);

    }

    public List<INode> getChildren() {

        final List<INode> a = new ArrayList<INode>(children.values());

        Collections.sort(a, NameComparator.INSTANCE);

        return a;

    }

    public Object getPayload() {

        return payload;

    }

    public String toString() {

        return getPath() + "{type=" + type.getName() + ",refCount="
                + refCount.get() + "}";

    }

    /**
     * Places nodes into order by name.
     */
    static class NameComparator implements Comparator<INode> {

        static final NameComparator INSTANCE = new NameComparator();

        public int compare(final INode o1, final INode o2) {

            return o1.getName().compareTo(o2.getName());

        }

    }

}
