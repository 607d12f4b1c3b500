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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.sysreg.registry.INode;

/**
 * The immutable schema shared by every node of a kind: a name, the ordered
 * list of {@link AttributeDescriptor}s exposed by each such node, and the
 * {@link IReleaseHandler} invoked once a node's reference count reaches zero.
 * <p>
 * Types are declared with a {@link Builder}, which validates the declaration
 * when the type is built:
 * 
 * <pre>
 * final NodeType info = new NodeType.Builder(&quot;info&quot;)
 *         .readOnly(&quot;num_devices&quot;, numDevices)
 *         .build();
 * </pre>
 * 
 * @version $Id$
 */
public class NodeType {

    /**
     * A release callback which does nothing. The registry clears the payload
     * of a node once the release callback returns, so this suffices unless the
     * payload holds resources which must be closed.
     */
    public static final IReleaseHandler NOP_RELEASE = new IReleaseHandler() {

        public void release(INode node) {
            // NOP
        }

    };

    private final String name;

    private final List<AttributeDescriptor> attributes;

    private final Map<String, AttributeDescriptor> byName;

    private final IReleaseHandler release;

    private NodeType(final Builder b) {

        this.name = b.name;

        final Map<String, AttributeDescriptor> m = new LinkedHashMap<String, AttributeDescriptor>();

        for (AttributeDescriptor a : b.attributes) {

            if (m.put(a.getName(), a) != null) {

                throw new ValidationError("Duplicate attribute: type=" + name
                        + ", attribute=" + a.getName());

            }

        }

        this.byName = Collections.unmodifiableMap(m);

        this.attributes = Collections
                .unmodifiableList(new ArrayList<AttributeDescriptor>(
                        b.attributes));

        this.release = b.release;

    }

    public String getName() {

        return name;

    }

    /**
     * The attributes in display order.
     */
    public List<AttributeDescriptor> getAttributes() {

        return attributes;

    }

    /**
     * The attribute names in display order.
     */
    public List<String> getAttributeNames() {

        return new ArrayList<String>(byName.keySet());

    }

    /**
     * Return the named attribute.
     * 
     * @return The attribute -or- <code>null</code> if the type does not
     *         declare an attribute with that name.
     */
    public AttributeDescriptor getAttribute(final String name) {

        if (name == null)
            throw new IllegalArgumentException();

        return byName.get(name);

    }

    public IReleaseHandler getRelease() {

        return release;

    }

    public String toString() {

        return getClass().getSimpleName() + "{name=" + name + ",attributes="
                + byName.keySet() + "}";

    }

    /**
     * Declarative builder for a {@link NodeType}. The builder may be reused,
     * but each {@link #build()} yields an independent immutable type.
     */
    public static class Builder {

        private final String name;

        private final List<AttributeDescriptor> attributes = new ArrayList<AttributeDescriptor>();

        private IReleaseHandler release = NOP_RELEASE;

        /**
         * @param name
         *            The name of the type.
         */
        public Builder(final String name) {

            if (name == null)
                throw new IllegalArgumentException();

            if (name.length() == 0)
                throw new ValidationError("Empty type name");

            this.name = name;

        }

        /**
         * Append an attribute.
         */
        public Builder attribute(final AttributeDescriptor a) {

            if (a == null)
                throw new IllegalArgumentException();

            attributes.add(a);

            return this;

        }

        /**
         * Append a {@link AttributeMode#ReadOnly} attribute.
         * 
         * @param show
         *            The show callback (optional).
         */
        public Builder readOnly(final String name, final IShowHandler show) {

            return attribute(new AttributeDescriptor(name,
                    AttributeMode.ReadOnly, show, null/* store */));

        }

        /**
         * Append a {@link AttributeMode#ReadWrite} attribute.
         */
        public Builder readWrite(final String name, final IShowHandler show,
                final IStoreHandler store) {

            return attribute(new AttributeDescriptor(name,
                    AttributeMode.ReadWrite, show, store));

        }

        /**
         * Append a write-only attribute.
         */
        public Builder writeOnly(final String name, final IStoreHandler store) {

            return attribute(new AttributeDescriptor(name,
                    AttributeMode.ReadWrite, null/* show */, store));

        }

        /**
         * Set the release callback (default {@link NodeType#NOP_RELEASE}).
         */
        public Builder release(final IReleaseHandler release) {

            if (release == null)
                throw new IllegalArgumentException();

            this.release = release;

            return this;

        }

        /**
         * Build the type.
         * 
         * @throws ValidationError
         *             if two attributes share a name.
         */
        public NodeType build() {

            return new NodeType(this);

        }

    }

}
