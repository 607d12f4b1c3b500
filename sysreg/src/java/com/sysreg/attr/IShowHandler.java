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
package com.sysreg.attr;

import com.sysreg.registry.INode;

/**
 * Callback producing the current value of an attribute.
 * 
 * @version $Id$
 */
public interface IShowHandler {

    /**
     * Return the current value of the attribute for the node.
     * 
     * @param node
     *            The node against which the attribute is read. The caller
     *            holds a reference on the node for the duration of the call.
     * 
     * @return The value.
     * 
     * @throws AttributeException
     *             if the value can not be produced. The exception is passed
     *             through to the requester unchanged.
     */
    public byte[] show(INode node) throws AttributeException;

}
