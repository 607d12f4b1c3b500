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

import java.util.List;

import com.sysreg.registry.INode;
import com.sysreg.registry.PublishFailedException;

/**
 * The layer which exposes the nodes of a registry and their attributes as
 * browsable paths (the analogue of sysfs) and which turns requests against
 * those paths into reads and writes of attributes.
 * 
 * @version $Id$
 */
public interface IRenderer {

    /**
     * Make the node and its attributes visible beneath the published location
     * of its parent (or at the top level for a node without a parent), keyed
     * by the name of the node.
     * 
     * @param node
     *            The node.
     * @param attributeNames
     *            The names of the attributes to expose, in display order.
     * 
     * @throws PublishFailedException
     *             if the node can not be published.
     */
    public void publish(INode node, List<String> attributeNames)
            throws PublishFailedException;

    /**
     * Remove the node from view. This is a NOP if the node is not published.
     */
    public void unpublish(INode node);

    /**
     * Resolve the path of an attribute, e.g., <code>devices/sda/label</code>.
     * 
     * @param path
     *            The path of the attribute.
     * 
     * @return The node and the attribute.
     * 
     * @throws PathNotFoundException
     *             if nothing is published at that path.
     */
    public AttributeRef resolve(String path) throws PathNotFoundException;

}
