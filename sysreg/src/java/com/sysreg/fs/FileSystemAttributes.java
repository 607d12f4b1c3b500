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

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

import org.apache.log4j.Logger;

import com.sysreg.attr.AttributeException;
import com.sysreg.attr.IShowHandler;
import com.sysreg.attr.IStoreHandler;
import com.sysreg.attr.NodeType;
import com.sysreg.config.Configuration;
import com.sysreg.dispatch.Dispatcher;
import com.sysreg.registry.INode;
import com.sysreg.registry.InitFailedException;
import com.sysreg.registry.Registry;
import com.sysreg.registry.RegistryException;
import com.sysreg.registry.RootDeclaration;
import com.sysreg.render.IRenderer;

/**
 * Exposes the state of a file system through a {@link Registry}:
 * 
 * <pre>
 * /devices/&lt;label&gt;/label
 * /health/status
 * /info/num_devices
 * </pre>
 * 
 * {@link #init()} creates the three top-level directories atomically.
 * Devices are added and removed as they are attached to and detached from the
 * file system. {@link #exit()} removes any remaining devices and then tears
 * down the top-level directories.
 * 
 * @version $Id$
 */
public class FileSystemAttributes {

    protected static final Logger log = Logger.getLogger(FileSystemAttributes.class);

    /**
     * Options for {@link FileSystemAttributes}.
     */
    public interface Options extends Registry.Options, Dispatcher.Options {

        /**
         * The name of the registry (default {@value #DEFAULT_NAME}).
         */
        String NAME = FileSystemAttributes.class.getName() + ".name";

        String DEFAULT_NAME = "btrfs";

    }

    public static final String DEVICES = "devices";

    public static final String HEALTH = "health";

    public static final String INFO = "info";

    public static final String NUM_DEVICES = "num_devices";

    public static final String STATUS = "status";

    public static final String LABEL = "label";

    /**
     * The initial value of the {@value #STATUS} attribute.
     */
    public static final String DEFAULT_STATUS = "ok";

    private final Registry registry;

    private final Dispatcher dispatcher;

    private final NodeType devicesType;

    private final NodeType healthType;

    private final NodeType infoType;

    private final NodeType deviceType;

    /**
     * The handles for the devices created by {@link #createDevice(String)}.
     */
    private final Map<String, INode> devices = new ConcurrentHashMap<String, INode>();

    /**
     * @param renderer
     *            The renderer which exposes the registry.
     * @param properties
     *            The configuration properties.
     */
    public FileSystemAttributes(final IRenderer renderer,
            final Properties properties) {

        final String name = Configuration.getProperty(properties,
                null/* namespace */, Options.NAME, Options.DEFAULT_NAME);

        this.registry = new Registry(name, renderer, properties);

        this.dispatcher = new Dispatcher(registry);

        this.devicesType = new NodeType.Builder(DEVICES).build();

        this.healthType = new NodeType.Builder(HEALTH).readWrite(STATUS,
                new IShowHandler() {

                    public byte[] show(INode node) {

                        return encode(status(node).get());

                    }

                }, new IStoreHandler() {

                    public void store(INode node, byte[] value)
                            throws AttributeException {

                        final String s = decode(value).trim();

                        if (s.length() == 0)
                            throw new AttributeException("Empty status");

                        status(node).set(s);

                    }

                }).build();

        this.infoType = new NodeType.Builder(INFO).readOnly(NUM_DEVICES,
                new IShowHandler() {

                    public byte[] show(INode node) {

                        final INode d = registry.getRoot(DEVICES);

                        final int n = d == null ? 0 : d.getChildren().size();

                        return encode(Integer.toString(n));

                    }

                }).build();

        this.deviceType = new NodeType.Builder("device").readOnly(LABEL,
                new IShowHandler() {

                    public byte[] show(INode node) {

                        return encode((String) node.getPayload());

                    }

                }).build();

    }

    @SuppressWarnings("unchecked")
    private static AtomicReference<String> status(final INode node) {

        return (AtomicReference<String>) node.getPayload();

    }

    private static byte[] encode(final String s) {

        return s.getBytes(StandardCharsets.UTF_8);

    }

    private static String decode(final byte[] b) {

        return new String(b, StandardCharsets.UTF_8);

    }

    public Registry getRegistry() {

        return registry;

    }

    public Dispatcher getDispatcher() {

        return dispatcher;

    }

    /**
     * Create the top-level directories.
     * 
     * @throws InitFailedException
     *             if any of them could not be created, in which case none of
     *             them exists.
     */
    public void init() throws InitFailedException {

        final List<RootDeclaration> roots = Arrays.asList(
                new RootDeclaration(DEVICES, devicesType),
                new RootDeclaration(HEALTH, healthType,
                        new AtomicReference<String>(DEFAULT_STATUS)),
                new RootDeclaration(INFO, infoType));

        registry.initialize(roots);

    }

    /**
     * Create the directory for a device beneath {@value #DEVICES}.
     * 
     * @param label
     *            The device label, which names the directory.
     * 
     * @return The device node.
     * 
     * @throws IllegalStateException
     *             if {@link #init()} has not been called.
     * @throws RegistryException
     *             if the device node could not be created.
     */
    public INode createDevice(final String label) throws RegistryException {

        if (label == null)
            throw new IllegalArgumentException();

        final INode parent = registry.getRoot(DEVICES);

        if (parent == null)
            throw new IllegalStateException("Not initialized: "
                    + registry.getName());

        final INode node = registry.create(label, deviceType, parent, label);

        devices.put(label, node);

        if (log.isInfoEnabled())
            log.info("Device: " + node.getPath());

        return node;

    }

    /**
     * Drop the handle on a device created by {@link #createDevice(String)}.
     * 
     * @param label
     *            The device label.
     * 
     * @throws IllegalArgumentException
     *             if there is no such device.
     */
    public void killDevice(final String label) {

        if (label == null)
            throw new IllegalArgumentException();

        final INode node = devices.remove(label);

        if (node == null)
            throw new IllegalArgumentException("No such device: " + label);

        registry.destroy(node);

    }

    /**
     * Remove any remaining devices and then tear down the top-level
     * directories.
     */
    public void exit() {

        for (String label : new ArrayList<String>(devices.keySet())) {

            killDevice(label);

        }

        registry.exit();

    }

}
