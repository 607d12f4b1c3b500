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

import java.util.Arrays;

import junit.framework.TestCase;

import org.apache.log4j.Logger;

import com.sysreg.registry.INode;

/**
 * Test suite for {@link NodeType} and its {@link NodeType.Builder}.
 * 
 * @version $Id$
 */
public class TestNodeType extends TestCase {

    protected static final Logger log = Logger.getLogger(TestNodeType.class);

    public TestNodeType() {
    }

    public TestNodeType(String name) {
        super(name);
    }

    private static final IStoreHandler store = new IStoreHandler() {

        public void store(INode node, byte[] value) {
            // NOP
        }

    };

    public void test_builder_correctRejection() {

        try {
            new NodeType.Builder(null);
            fail("Expecting: " + IllegalArgumentException.class);
        } catch (IllegalArgumentException ex) {
            if (log.isInfoEnabled())
                log.info("Ignoring expected exception: " + ex);
        }

        try {
            new NodeType.Builder("");
            fail("Expecting: " + ValidationError.class);
        } catch (ValidationError ex) {
            if (log.isInfoEnabled())
                log.info("Ignoring expected exception: " + ex);
        }

        try {
            new NodeType.Builder("t").attribute(null);
            fail("Expecting: " + IllegalArgumentException.class);
        } catch (IllegalArgumentException ex) {
            if (log.isInfoEnabled())
                log.info("Ignoring expected exception: " + ex);
        }

        try {
            new NodeType.Builder("t").release(null);
            fail("Expecting: " + IllegalArgumentException.class);
        } catch (IllegalArgumentException ex) {
            if (log.isInfoEnabled())
                log.info("Ignoring expected exception: " + ex);
        }

    }

    /**
     * Two attributes with the same name are rejected when the type is built.
     */
    public void test_duplicateAttribute() {

        final NodeType.Builder b = new NodeType.Builder("t").readOnly("x",
                null).readWrite("x", null, store);

        try {
            b.build();
            fail("Expecting: " + ValidationError.class);
        } catch (ValidationError ex) {
            if (log.isInfoEnabled())
                log.info("Ignoring expected exception: " + ex);
        }

    }

    /**
     * A ReadWrite attribute without a store callback is rejected by the
     * builder.
     */
    public void test_readWriteWithoutStore() {

        try {
            new NodeType.Builder("t").readWrite("x", null, null);
            fail("Expecting: " + ValidationError.class);
        } catch (ValidationError ex) {
            if (log.isInfoEnabled())
                log.info("Ignoring expected exception: " + ex);
        }

    }

    /**
     * Attributes are kept in declaration order.
     */
    public void test_attributeOrder() {

        final NodeType t = new NodeType.Builder("t").readOnly("c", null)
                .writeOnly("a", store).readWrite("b", null, store).build();

        assertEquals("t", t.getName());
        assertEquals(Arrays.asList("c", "a", "b"), t.getAttributeNames());
        assertEquals(3, t.getAttributes().size());
        assertEquals("c", t.getAttributes().get(0).getName());
        assertSame(t.getAttributes().get(1), t.getAttribute("a"));
        assertNull(t.getAttribute("d"));

        assertEquals(AttributeMode.ReadOnly, t.getAttribute("c").getMode());
        assertFalse(t.getAttribute("a").isReadable());
        assertTrue(t.getAttribute("a").isWritable());

        try {
            t.getAttributes().clear();
            fail("Expecting: " + UnsupportedOperationException.class);
        } catch (UnsupportedOperationException ex) {
            if (log.isInfoEnabled())
                log.info("Ignoring expected exception: " + ex);
        }

    }

    public void test_release() {

        assertSame(NodeType.NOP_RELEASE, new NodeType.Builder("t").build()
                .getRelease());

        final IReleaseHandler r = new IReleaseHandler() {

            public void release(INode node) {
            }

        };

        assertSame(r, new NodeType.Builder("t").release(r).build()
                .getRelease());

    }

    /**
     * Each build of a builder yields an independent type.
     */
    public void test_builder_reuse() {

        final NodeType.Builder b = new NodeType.Builder("t").readOnly("x",
                null);

        final NodeType t1 = b.build();

        b.readOnly("y", null);

        final NodeType t2 = b.build();

        assertEquals(Arrays.asList("x"), t1.getAttributeNames());
        assertEquals(Arrays.asList("x", "y"), t2.getAttributeNames());

    }

}
