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

import java.util.List;

import com.sysreg.attr.NodeType;

/**
 * A node in the registry. Each node has a name, which is unique among its
 * siblings, a {@link NodeType} declaring the attributes it exposes, a
 * reference count, and an opaque payload owned by the node.
 * 
 * @version $Id$
 */
public interface INode {

    /**
     * Separator for path name components.
     */
    public static final String pathSeparator = "/";

    /**
     * The local name (does not include the path from the root).
     */
    public String getName();

    /**
     * The immediate parent -or- <code>null</code> iff this is a root node or
     * a node which was detached when its parent was finalized.
     */
    public INode getParent();

    /**
     * Path from the top of the registry inclusive of the local name, e.g.,
     * <code>/devices/sda</code>. The path is derived from the current parent
     * chain, so a detached node reports a path of its own name only.
     */
    public String getPath();

    /**
     * The type of the node.
     */
    public NodeType getType();

    /**
     * The current reference count. Zero once the node has been finalized.
     */
    public int getRefCount();

    /**
     * <code>true</code> until the reference count reaches zero.
     */
    public boolean isLive();

    /**
     * Return the directly attached child by name.
     * 
     * @return The child -or- <code>null</code> if there is no such child.
     */
    public INode getChild(String name);

    /**
     * A snapshot of the directly attached children in order by name.
     */
    public List<INode> getChildren();

    /**
     * The payload -or- <code>null</code> if none was given or the node has
     * been finalized.
     */
    public Object getPayload();

}
