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
 * An immutable declaration of one named attribute of a {@link NodeType}: its
 * name, its {@link AttributeMode} and the optional callbacks used to read and
 * write its value.
 * <p>
 * An attribute without a show callback is write-only. A
 * {@link AttributeMode#ReadWrite} attribute must declare a store callback.
 * 
 * @version $Id$
 */
public class AttributeDescriptor {

    private final String name;

    private final AttributeMode mode;

    private final IShowHandler show;

    private final IStoreHandler store;

    /**
     * @param name
     *            The attribute name.
     * @param mode
     *            The access mode.
     * @param show
     *            The show callback (optional).
     * @param store
     *            The store callback (required iff the mode is
     *            {@link AttributeMode#ReadWrite}).
     * 
     * @throws IllegalArgumentException
     *             if the <i>name</i> or the <i>mode</i> is <code>null</code>.
     * @throws ValidationError
     *             if the name is not a legal name.
     * @throws ValidationError
     *             if the mode is {@link AttributeMode#ReadWrite} and no store
     *             callback was given.
     */
    public AttributeDescriptor(final String name, final AttributeMode mode,
            final IShowHandler show, final IStoreHandler store) {

        if (name == null)
            throw new IllegalArgumentException();

        if (mode == null)
            throw new IllegalArgumentException();

        checkName(name);

        if (mode == AttributeMode.ReadWrite && store == null) {

            throw new ValidationError("ReadWrite attribute without store: "
                    + name);

        }

        this.name = name;

        this.mode = mode;

        this.show = show;

        this.store = store;

    }

    /**
     * Verify that a name may be used for a node or an attribute.
     * 
     * @throws IllegalArgumentException
     *             if the name is <code>null</code>.
     * @throws ValidationError
     *             if the name is empty or contains the
     *             {@link INode#pathSeparator}.
     */
    public static void checkName(final String name) {

        if (name == null)
            throw new IllegalArgumentException();

        if (name.length() == 0)
            throw new ValidationError("Empty name");

        if (name.contains(INode.pathSeparator))
            throw new ValidationError("Name contains '" + INode.pathSeparator
                    + "': " + name);

    }

    public String getName() {

        return name;

    }

    public AttributeMode getMode() {

        return mode;

    }

    /**
     * The show callback -or- <code>null</code> if the attribute is
     * write-only.
     */
    public IShowHandler getShow() {

        return show;

    }

    /**
     * The store callback -or- <code>null</code>.
     */
    public IStoreHandler getStore() {

        return store;

    }

    /**
     * <code>true</code> iff the attribute declares a show callback.
     */
    public boolean isReadable() {

        return show != null;

    }

    /**
     * <code>true</code> iff the attribute is {@link AttributeMode#ReadWrite}
     * and declares a store callback.
     */
    public boolean isWritable() {

        return mode.isWritable() && store != null;

    }

    /**
     * Invokes the show callback.
     * 
     * @throws NotReadableException
     *             if the attribute is not readable.
     */
    public byte[] show(final INode node) throws AttributeException {

        if (show == null)
            throw new NotReadableException(name);

        return show.show(node);

    }

    /**
     * Invokes the store callback.
     * 
     * @throws NotWritableException
     *             if the attribute is not writable.
     */
    public void store(final INode node, final byte[] value)
            throws AttributeException {

        if (!isWritable())
            throw new NotWritableException(name);

        store.store(node, value);

    }

    public String toString() {

        return getClass().getSimpleName() + "{name=" + name + ",mode=" + mode
                + ",readable=" + isReadable() + ",writable=" + isWritable()
                + "}";

    }

}
