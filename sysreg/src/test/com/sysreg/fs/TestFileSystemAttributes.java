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
package com.sysreg.fs;

import java.util.Arrays;
import java.util.Properties;

import com.sysreg.attr.AttributeException;
import com.sysreg.attr.NotWritableException;
import com.sysreg.config.Configuration;
import com.sysreg.dispatch.Dispatcher;
import com.sysreg.registry.AbstractRegistryTestCase;
import com.sysreg.registry.DuplicateNodeException;
import com.sysreg.registry.INode;
import com.sysreg.registry.InitFailedException;
import com.sysreg.registry.Registry;
import com.sysreg.render.InMemoryRenderer;
import com.sysreg.render.PathNotFoundException;

/**
 * Test suite for the file system attribute tree.
 * 
 * @version $Id$
 */
public class TestFileSystemAttributes extends AbstractRegistryTestCase {

    public TestFileSystemAttributes() {
    }

    public TestFileSystemAttributes(String name) {
        super(name);
    }

    private InMemoryRenderer renderer;

    private FileSystemAttributes fs;

    protected void setUp() throws Exception {

        super.setUp();

        renderer = new InMemoryRenderer();

        fs = new FileSystemAttributes(renderer, new Properties());

    }

    protected void tearDown() throws Exception {

        renderer = null;

        fs = null;

        super.tearDown();

    }

    private String read(final String path) throws AttributeException {

        return string(fs.getDispatcher().onRead(path));

    }

    public void test_defaults() {

        final Registry registry = fs.getRegistry();

        assertEquals(FileSystemAttributes.Options.DEFAULT_NAME, registry
                .getName());

        assertSame(renderer, registry.getRenderer());

        assertEquals(4096, fs.getDispatcher().getBufferSize());

        assertTrue(registry.getRoots().isEmpty());

    }

    /**
     * The name of the registry is configurable and namespaces the other
     * options.
     */
    public void test_configuration() {

        final Properties p = new Properties();

        p.setProperty(FileSystemAttributes.Options.NAME, "fs1");

        p.setProperty(Configuration.getOverrideProperty("fs1",
                Dispatcher.Options.BUFFER_SIZE), "128");

        final FileSystemAttributes fs1 = new FileSystemAttributes(
                new InMemoryRenderer(), p);

        assertEquals("fs1", fs1.getRegistry().getName());

        assertEquals(128, fs1.getDispatcher().getBufferSize());

    }

    public void test_init() throws Exception {

        fs.init();

        assertEquals(Arrays.asList("devices", "health", "info"), renderer
                .list("/"));

        assertEquals(Arrays.asList(), renderer.list("/devices"));

        assertEquals(Arrays.asList("status"), renderer.list("/health"));

        assertEquals(Arrays.asList("num_devices"), renderer.list("/info"));

        assertEquals("0", read("info/num_devices"));

        assertEquals(FileSystemAttributes.DEFAULT_STATUS,
                read("health/status"));

        try {
            fs.init();
            fail("Expecting: " + IllegalStateException.class);
        } catch (IllegalStateException ex) {
            if (log.isInfoEnabled())
                log.info("Ignoring expected exception: " + ex);
        }

    }

    public void test_devices() throws Exception {

        fs.init();

        final INode sda = fs.createDevice("sda");

        fs.createDevice("sdb");

        assertEquals("/devices/sda", sda.getPath());

        assertEquals("sda", read("devices/sda/label"));

        assertEquals("sdb", read("/devices/sdb/label"));

        assertEquals("2", read("info/num_devices"));

        assertEquals(Arrays.asList("sda", "sdb"), renderer.list("/devices"));

        try {
            fs.createDevice("sda");
            fail("Expecting: " + DuplicateNodeException.class);
        } catch (DuplicateNodeException ex) {
            if (log.isInfoEnabled())
                log.info("Ignoring expected exception: " + ex);
        }

        try {
            fs.getDispatcher().onWrite("devices/sda/label", bytes("x"));
            fail("Expecting: " + NotWritableException.class);
        } catch (NotWritableException ex) {
            if (log.isInfoEnabled())
                log.info("Ignoring expected exception: " + ex);
        }

        fs.killDevice("sda");

        assertFalse(sda.isLive());

        assertEquals("1", read("info/num_devices"));

        try {
            read("devices/sda/label");
            fail("Expecting: " + PathNotFoundException.class);
        } catch (PathNotFoundException ex) {
            if (log.isInfoEnabled())
                log.info("Ignoring expected exception: " + ex);
        }

        try {
            fs.killDevice("sda");
            fail("Expecting: " + IllegalArgumentException.class);
        } catch (IllegalArgumentException ex) {
            if (log.isInfoEnabled())
                log.info("Ignoring expected exception: " + ex);
        }

    }

    public void test_createDevice_notInitialized() throws Exception {

        try {
            fs.createDevice("sda");
            fail("Expecting: " + IllegalStateException.class);
        } catch (IllegalStateException ex) {
            if (log.isInfoEnabled())
                log.info("Ignoring expected exception: " + ex);
        }

    }

    public void test_healthStatus() throws Exception {

        fs.init();

        final Dispatcher dispatcher = fs.getDispatcher();

        dispatcher.onWrite("health/status", bytes("degraded\n"));

        assertEquals("degraded", read("health/status"));

        try {
            dispatcher.onWrite("health/status", bytes("  "));
            fail("Expecting: " + AttributeException.class);
        } catch (AttributeException ex) {
            if (log.isInfoEnabled())
                log.info("Ignoring expected exception: " + ex);
        }

        assertEquals("degraded", read("health/status"));

        try {
            dispatcher.onWrite("info/num_devices", bytes("3"));
            fail("Expecting: " + NotWritableException.class);
        } catch (NotWritableException ex) {
            if (log.isInfoEnabled())
                log.info("Ignoring expected exception: " + ex);
        }

    }

    /**
     * A failure to publish one of the top-level directories leaves none of
     * them behind, and initialization may then be retried.
     */
    public void test_init_failure() throws Exception {

        renderer.failPublish("/health");

        try {
            fs.init();
            fail("Expecting: " + InitFailedException.class);
        } catch (InitFailedException ex) {
            assertEquals(FileSystemAttributes.HEALTH, ex.getNodeName());
        }

        assertTrue(fs.getRegistry().getRoots().isEmpty());

        assertEquals(Arrays.asList(), renderer.list("/"));

        renderer.clearFailures();

        fs.init();

        assertEquals(3, fs.getRegistry().getRoots().size());

    }

    public void test_exit() throws Exception {

        fs.init();

        final INode sda = fs.createDevice("sda");

        final INode devices = fs.getRegistry().getRoot(
                FileSystemAttributes.DEVICES);

        fs.exit();

        assertFalse(sda.isLive());

        assertFalse(devices.isLive());

        assertTrue(fs.getRegistry().getRoots().isEmpty());

        assertEquals(Arrays.asList(), renderer.list("/"));

        try {
            fs.exit();
            fail("Expecting: " + IllegalStateException.class);
        } catch (IllegalStateException ex) {
            if (log.isInfoEnabled())
                log.info("Ignoring expected exception: " + ex);
        }

    }

}
