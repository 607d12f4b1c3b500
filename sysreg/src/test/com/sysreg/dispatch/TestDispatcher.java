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
package com.sysreg.dispatch;

import java.util.Arrays;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import com.sysreg.attr.AttributeException;
import com.sysreg.attr.IReleaseHandler;
import com.sysreg.attr.IShowHandler;
import com.sysreg.attr.IStoreHandler;
import com.sysreg.attr.NodeType;
import com.sysreg.attr.NotReadableException;
import com.sysreg.attr.NotWritableException;
import com.sysreg.config.Configuration;
import com.sysreg.config.ConfigurationException;
import com.sysreg.registry.AbstractRegistryTestCase;
import com.sysreg.registry.INode;
import com.sysreg.registry.Registry;
import com.sysreg.render.PathNotFoundException;

/**
 * Test suite for routing reads and writes through the {@link Dispatcher}.
 * 
 * @version $Id$
 */
public class TestDispatcher extends AbstractRegistryTestCase {

    public TestDispatcher() {
    }

    public TestDispatcher(String name) {
        super(name);
    }

    /**
     * Show callback for a payload which is an {@link AtomicReference}.
     */
    private static final IShowHandler showRef = new IShowHandler() {

        public byte[] show(INode node) {

            return bytes(ref(node).get());

        }

    };

    /**
     * Store callback for a payload which is an {@link AtomicReference}.
     */
    private static final IStoreHandler storeRef = new IStoreHandler() {

        public void store(INode node, byte[] value) {

            ref(node).set(string(value));

        }

    };

    @SuppressWarnings("unchecked")
    private static AtomicReference<String> ref(final INode node) {

        return (AtomicReference<String>) node.getPayload();

    }

    public void test_ctor() {

        try {
            new Dispatcher(null);
            fail("Expecting: " + IllegalArgumentException.class);
        } catch (IllegalArgumentException ex) {
            if (log.isInfoEnabled())
                log.info("Ignoring expected exception: " + ex);
        }

        assertEquals(Integer.parseInt(Dispatcher.Options.DEFAULT_BUFFER_SIZE),
                new Dispatcher(newRegistry()).getBufferSize());

    }

    /**
     * A read-only attribute of a root node is read through its path. Dropping
     * the only handle finalizes and unpublishes the node.
     */
    public void test_readOnlyRoot() throws Exception {

        final Registry registry = newRegistry();

        final Dispatcher dispatcher = new Dispatcher(registry);

        final CountingRelease release = new CountingRelease();

        final NodeType infoType = new NodeType.Builder("info").readOnly(
                "num_devices", constant("0")).release(release).build();

        final INode info = registry.create("info", infoType, null);

        assertEquals("0", string(dispatcher.onRead("info/num_devices")));

        assertEquals("0", string(dispatcher.onRead("/info/num_devices")));

        // the dispatch does not leak a reference.
        assertEquals(1, info.getRefCount());

        registry.destroy(info);

        assertEquals(1, release.count.get());

        assertFalse(renderer(registry).isPublished(info));

        try {
            dispatcher.onRead("info/num_devices");
            fail("Expecting: " + PathNotFoundException.class);
        } catch (PathNotFoundException ex) {
            if (log.isInfoEnabled())
                log.info("Ignoring expected exception: " + ex);
        }

    }

    public void test_readWrite() throws Exception {

        final Registry registry = newRegistry();

        final Dispatcher dispatcher = new Dispatcher(registry);

        final NodeType t = new NodeType.Builder("health").readWrite("status",
                showRef, storeRef).build();

        final INode health = registry.create("health", t, null,
                new AtomicReference<String>("ok"));

        assertEquals("ok", string(dispatcher.onRead("health/status")));

        dispatcher.onWrite("health/status", bytes("degraded"));

        assertEquals("degraded", string(dispatcher.onRead("health/status")));

        assertEquals(1, health.getRefCount());

    }

    /**
     * A write-only attribute can not be read and a read-only attribute can not
     * be written. Neither request reaches the other callback or changes the
     * payload.
     */
    public void test_capabilities() throws Exception {

        final Registry registry = newRegistry();

        final Dispatcher dispatcher = new Dispatcher(registry);

        final AtomicInteger stores = new AtomicInteger();

        final IStoreHandler countingStore = new IStoreHandler() {

            public void store(INode node, byte[] value)
                    throws AttributeException {

                stores.incrementAndGet();

                storeRef.store(node, value);

            }

        };

        final NodeType t = new NodeType.Builder("t")//
                .writeOnly("w", countingStore)//
                .readOnly("r", showRef)//
                .build();

        final AtomicReference<String> payload = new AtomicReference<String>(
                "v");

        final INode node = registry.create("n", t, null, payload);

        try {
            dispatcher.onRead("n/w");
            fail("Expecting: " + NotReadableException.class);
        } catch (NotReadableException ex) {
            if (log.isInfoEnabled())
                log.info("Ignoring expected exception: " + ex);
        }

        try {
            dispatcher.onWrite("n/r", bytes("x"));
            fail("Expecting: " + NotWritableException.class);
        } catch (NotWritableException ex) {
            if (log.isInfoEnabled())
                log.info("Ignoring expected exception: " + ex);
        }

        assertEquals(0, stores.get());
        assertEquals("v", payload.get());
        assertSame(payload, node.getPayload());
        assertEquals(1, node.getRefCount());

        dispatcher.onWrite("n/w", bytes("x"));

        assertEquals(1, stores.get());
        assertEquals("x", payload.get());

    }

    /**
     * Errors thrown by a callback are passed through to the caller and the
     * reference taken for the dispatch is dropped.
     */
    public void test_callbackErrors() throws Exception {

        final Registry registry = newRegistry();

        final Dispatcher dispatcher = new Dispatcher(registry);

        final NodeType t = new NodeType.Builder("t").readWrite("a",
                new IShowHandler() {

                    public byte[] show(INode node) throws AttributeException {

                        throw new AttributeException("show failed");

                    }

                }, new IStoreHandler() {

                    public void store(INode node, byte[] value) {

                        throw new IllegalStateException("store failed");

                    }

                }).build();

        final INode node = registry.create("n", t, null);

        try {
            dispatcher.onRead("n/a");
            fail("Expecting: " + AttributeException.class);
        } catch (AttributeException ex) {
            assertEquals("show failed", ex.getMessage());
        }

        assertEquals(1, node.getRefCount());

        try {
            dispatcher.onWrite("n/a", bytes("x"));
            fail("Expecting: " + IllegalStateException.class);
        } catch (IllegalStateException ex) {
            assertEquals("store failed", ex.getMessage());
        }

        assertEquals(1, node.getRefCount());

    }

    /**
     * When the dispatch drops the last reference and the release callback
     * fails, the caller still sees the failure of the show callback.
     */
    public void test_callbackError_releaseThrows() throws Exception {

        final Registry registry = newRegistry();

        final Dispatcher dispatcher = new Dispatcher(registry);

        final AtomicInteger releases = new AtomicInteger();

        final NodeType t = new NodeType.Builder("t").readOnly("a",
                new IShowHandler() {

                    public byte[] show(INode node) throws AttributeException {

                        // the creator drops its handle meanwhile.
                        registry.destroy(node);

                        throw new AttributeException("show failed");

                    }

                }).release(new IReleaseHandler() {

                    public void release(INode node) {

                        releases.incrementAndGet();

                        throw new IllegalStateException("release failed");

                    }

                }).build();

        final INode node = registry.create("n", t, null);

        try {
            dispatcher.onRead("n/a");
            fail("Expecting: " + AttributeException.class);
        } catch (AttributeException ex) {
            assertEquals("show failed", ex.getMessage());
        }

        assertEquals(1, releases.get());
        assertFalse(node.isLive());
        assertNull(registry.getRoot("n"));

    }

    /**
     * A show callback which produces <code>null</code> reads as an empty
     * value.
     */
    public void test_nullShow() throws Exception {

        final Registry registry = newRegistry();

        final NodeType t = new NodeType.Builder("t").readOnly("a",
                new IShowHandler() {

                    public byte[] show(INode node) {

                        return null;

                    }

                }).build();

        registry.create("n", t, null);

        assertEquals(0, new Dispatcher(registry).onRead("n/a").length);

    }

    public void test_pathNotFound() throws Exception {

        final Registry registry = newRegistry();

        final Dispatcher dispatcher = new Dispatcher(registry);

        registry.create("n", new NodeType.Builder("t").readOnly("a",
                constant("v")).build(), null);

        for (String path : new String[] { "n", "n/b", "m/a", "n/a/b" }) {

            try {
                dispatcher.onRead(path);
                fail("Expecting: " + PathNotFoundException.class + " for "
                        + path);
            } catch (PathNotFoundException ex) {
                if (log.isInfoEnabled())
                    log.info("Ignoring expected exception: " + ex);
            }

            try {
                dispatcher.onWrite(path, bytes("v"));
                fail("Expecting: " + PathNotFoundException.class + " for "
                        + path);
            } catch (PathNotFoundException ex) {
                if (log.isInfoEnabled())
                    log.info("Ignoring expected exception: " + ex);
            }

        }

    }

    /**
     * The buffer size may be overridden for the namespace of the registry.
     * Longer reads are truncated and longer writes are rejected before the
     * store callback runs.
     */
    public void test_bufferSize() throws Exception {

        final Properties p = new Properties();

        p.setProperty(Configuration.getOverrideProperty(getName(),
                Dispatcher.Options.BUFFER_SIZE), "4");

        final Registry registry = newRegistry(p);

        final Dispatcher dispatcher = new Dispatcher(registry);

        assertEquals(4, dispatcher.getBufferSize());

        final AtomicReference<String> payload = new AtomicReference<String>(
                "abcdefgh");

        registry.create("n", new NodeType.Builder("t").readWrite("a",
                showRef, storeRef).build(), null, payload);

        assertTrue(Arrays.equals(bytes("abcd"), dispatcher.onRead("n/a")));

        try {
            dispatcher.onWrite("n/a", bytes("12345"));
            fail("Expecting: " + AttributeException.class);
        } catch (AttributeException ex) {
            if (log.isInfoEnabled())
                log.info("Ignoring expected exception: " + ex);
        }

        assertEquals("abcdefgh", payload.get());

        dispatcher.onWrite("n/a", bytes("1234"));

        assertEquals("1234", payload.get());

    }

    public void test_bufferSize_invalid() {

        final Properties p = new Properties();

        p.setProperty(Dispatcher.Options.BUFFER_SIZE, "0");

        try {
            new Dispatcher(newRegistry(p));
            fail("Expecting: " + ConfigurationException.class);
        } catch (ConfigurationException ex) {
            if (log.isInfoEnabled())
                log.info("Ignoring expected exception: " + ex);
        }

    }

    /**
     * An attribute of a child is read through the path of its parent. Once the
     * parent is destroyed the child stays live but is no longer reachable.
     */
    public void test_childAttribute() throws Exception {

        final Registry registry = newRegistry();

        final Dispatcher dispatcher = new Dispatcher(registry);

        final INode devices = registry.create("devices", new NodeType.Builder(
                "devices").build(), null);

        final INode sda = registry.create("sda", new NodeType.Builder(
                "device").readOnly("label", constant("sda")).build(), devices);

        assertEquals("sda", string(dispatcher.onRead("devices/sda/label")));

        registry.destroy(devices);

        assertTrue(sda.isLive());
        assertNull(sda.getParent());
        assertEquals(1, sda.getRefCount());

        try {
            dispatcher.onRead("devices/sda/label");
            fail("Expecting: " + PathNotFoundException.class);
        } catch (PathNotFoundException ex) {
            if (log.isInfoEnabled())
                log.info("Ignoring expected exception: " + ex);
        }

        registry.destroy(sda);

    }

}
