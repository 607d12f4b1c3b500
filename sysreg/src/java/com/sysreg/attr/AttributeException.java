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
 * Base class for failures reading or writing an attribute. Show and store
 * callbacks throw instances of this class (or a subclass) to report their own
 * failures, which are passed through to the requester unchanged.
 * 
 * @version $Id$
 */
public class AttributeException extends Exception {

    /**
     * 
     */
    private static final long serialVersionUID = 2872163409512730337L;

    /**
     * 
     */
    public AttributeException() {
    }

    /**
     * @param message
     */
    public AttributeException(String message) {
        super(message);
    }

    /**
     * @param cause
     */
    public AttributeException(Throwable cause) {
        super(cause);
    }

    /**
     * @param message
     * @param cause
     */
    public AttributeException(String message, Throwable cause) {
        super(message, cause);
    }

}
