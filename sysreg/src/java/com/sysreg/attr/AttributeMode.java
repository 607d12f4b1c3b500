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
 * The access mode of an attribute.
 * 
 * @version $Id$
 */
public enum AttributeMode {

    /**
     * The attribute may be read but not written.
     */
    ReadOnly("ReadOnly", 0444),

    /**
     * The attribute may be written and, if it declares a show callback, read.
     */
    ReadWrite("ReadWrite", 0644);

    private final String name;

    private final int permissions;

    AttributeMode(final String name, final int permissions) {

        this.name = name;

        this.permissions = permissions;

    }

    /**
     * The unix style permission bits under which an attribute having this
     * mode is exposed by a renderer.
     */
    public int getPermissions() {

        return permissions;

    }

    /**
     * <code>true</code> iff this mode permits writes.
     */
    public boolean isWritable() {

        return this == ReadWrite;

    }

    public String toString() {

        return name;

    }

}
