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

import com.sysreg.attr.NodeType;

/**
 * The declaration of a root node which is created by
 * {@link Registry#initialize(java.util.List)}.
 * 
 * @version $Id$
 */
public class RootDeclaration {

    private final String name;

    private final NodeType type;

    private final Object payload;

    public RootDeclaration(final String name, final NodeType type) {

        this(name, type, null/* payload */);

    }

    /**
     * @param name
     *            The name of the root node.
     * @param type
     *            The type of the root node.
     * @param payload
     *            The payload of the root node (optional).
     */
    public RootDeclaration(final String name, final NodeType type,
            final Object payload) {

        if (name == null)
            throw new IllegalArgumentException();

        if (type == null)
            throw new IllegalArgumentException();

        this.name = name;

        this.type = type;

        this.payload = payload;

    }

    public String getName() {

        return name;

    }

    public NodeType getType() {

        return type;

    }

    public Object getPayload() {

        return payload;

    }

    public String toString() {

        return name + ":" + type.getName();

    }

}
