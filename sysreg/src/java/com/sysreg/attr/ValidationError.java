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

/**
 * An instance of this class is thrown when an {@link AttributeDescriptor} or a
 * {@link NodeType} is malformed, e.g., two attributes of a type share a name
 * or a {@link AttributeMode#ReadWrite} attribute does not declare a store
 * callback. It is thrown when the declaration is constructed, so a malformed
 * type never reaches the registry. It is also thrown for a node name which
 * could not be used as a path component.
 * 
 * @version $Id$
 */
public class ValidationError extends IllegalArgumentException {

    /**
     * 
     */
    private static final long serialVersionUID = -4311725312370553150L;

    /**
     * 
     */
    public ValidationError() {
    }

    /**
     * @param message
     */
    public ValidationError(String message) {
        super(message);
    }

    /**
     * @param cause
     */
    public ValidationError(Throwable cause) {
        super(cause);
    }

    /**
     * @param message
     * @param cause
     */
    public ValidationError(String message, Throwable cause) {
        super(message, cause);
    }

}
