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
 * Callback accepting a new value for an attribute.
 * <p>
 * Note: Concurrent stores against the same node are not serialized by the
 * registry. An implementation which mutates the node payload must provide its
 * own synchronization.
 * 
 * @version $Id$
 */
public interface IStoreHandler {

    /**
     * Accept a new value for the attribute.
     * 
     * @param node
     *            The node against which the attribute is written. The caller
     *            holds a reference on the node for the duration of the call.
     * @param value
     *            The value.
     * 
     * @throws AttributeException
     *             if the value is rejected. The exception is passed through to
     *             the requester unchanged.
     */
    public void store(INode node, byte[] value) throws AttributeException;

}
