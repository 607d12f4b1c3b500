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
 * Thrown when {@link Registry#initialize(java.util.List)} fails. All root
 * nodes which were created before the failure have been destroyed again, in
 * reverse creation order, by the time this exception is thrown. Failures to
 * destroy those roots, e.g., from a release callback, are attached as
 * suppressed exceptions.
 * 
 * @version $Id$
 */
public class InitFailedException extends RegistryException {

    /**
     * 
     */
    private static final long serialVersionUID = -2981409245130357412L;

    private final String nodeName;

    /**
     * @param nodeName
     *            The name of the declared root whose creation failed.
     * @param cause
     *            The failure.
     */
    public InitFailedException(final String nodeName, final Throwable cause) {

        super("Initialization failed: " + nodeName, cause);

        this.nodeName = nodeName;

    }

    /**
     * The name of the declared root whose creation failed.
     */
    public String getNodeName() {

        return nodeName;

    }

}
