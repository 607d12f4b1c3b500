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

/**
 * Observer notified as nodes are published and finalized (the analogue of a
 * uevent broadcast). Exceptions thrown by a listener are logged and do not
 * affect the state of the registry.
 * 
 * @version $Id$
 */
public interface IRegistryListener {

    /**
     * Invoked once a node has been created and published.
     */
    public void nodeAdded(INode node);

    /**
     * Invoked once a node has been finalized.
     */
    public void nodeRemoved(INode node);

}
